package org.sharehub.thumbnails.controller.rest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.exception.GlobalExceptionHandler;
import org.sharehub.thumbnails.exception.TenantNotFoundException;
import org.sharehub.thumbnails.service.QuotaService;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaControllerTest {

    private static final UUID TENANT_ID = UUID.randomUUID();

    @Mock
    private QuotaService quotaService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new QuotaController(quotaService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void status_returnsSnapshot() {
        when(quotaService.status(TENANT_ID)).thenReturn(Mono.just(QuotaStatus.of(3, 5)));

        webTestClient.get()
                .uri("/api/v1/thumbnails/quota/" + TENANT_ID)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.available").isEqualTo(true)
                .jsonPath("$.used").isEqualTo(3)
                .jsonPath("$.total").isEqualTo(5)
                .jsonPath("$.remaining").isEqualTo(2);
    }

    @Test
    void status_unknownTenant_returns404() {
        when(quotaService.status(TENANT_ID)).thenReturn(Mono.error(new TenantNotFoundException(TENANT_ID)));

        webTestClient.get()
                .uri("/api/v1/thumbnails/quota/" + TENANT_ID)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void reset_returnsFreshQuota() {
        when(quotaService.reset(TENANT_ID)).thenReturn(Mono.just(QuotaStatus.of(0, 5)));

        webTestClient.post()
                .uri("/api/v1/thumbnails/quota/" + TENANT_ID + "/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.used").isEqualTo(0);
    }

    @Test
    void updateTotal_negative_isRejectedBeforeService() {
        webTestClient.put()
                .uri("/api/v1/thumbnails/quota/" + TENANT_ID + "/total")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"total\":-1}")
                .exchange()
                .expectStatus().isBadRequest();

        verify(quotaService, never()).updateTotal(any(), anyInt());
    }

    @Test
    void statistics_returnsAggregate() {
        when(quotaService.statistics()).thenReturn(Mono.just(new QuotaStatistics(4, 2.5, 1)));

        webTestClient.get()
                .uri("/api/v1/thumbnails/quota/statistics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalTenants").isEqualTo(4)
                .jsonPath("$.tenantsAtLimit").isEqualTo(1);
    }
}
