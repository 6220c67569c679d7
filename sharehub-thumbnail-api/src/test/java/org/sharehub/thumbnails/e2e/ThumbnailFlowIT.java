package org.sharehub.thumbnails.e2e;

import org.junit.jupiter.api.Test;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.config.RetentionProperties;
import org.sharehub.thumbnails.controller.rest.ConversionWebhookController;
import org.sharehub.thumbnails.dto.request.ConversionRequest;
import org.sharehub.thumbnails.dto.request.GenerateThumbnailRequest;
import org.sharehub.thumbnails.dto.request.RetryThumbnailRequest;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.dto.response.RetentionSweepResult;
import org.sharehub.thumbnails.dto.response.RetroactiveSweepResult;
import org.sharehub.thumbnails.enums.InputFormat;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import org.sharehub.thumbnails.exception.StorageException;
import org.sharehub.thumbnails.service.ConversionClient;
import org.sharehub.thumbnails.service.ObjectStorageService;
import org.sharehub.thumbnails.service.QuotaService;
import org.sharehub.thumbnails.service.WebhookSignatureVerifier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.test.context.TestConstructor;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.context.TestConstructor.AutowireMode.ALL;

@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestConstructor(autowireMode = ALL)
public class ThumbnailFlowIT extends TestContainersBaseConfig {

    private static final String PPTX = InputFormat.PPTX.getMimeType();
    private static final String WEBHOOK_URI = RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_WEBHOOKS + "/conversion";

    @MockBean
    private ObjectStorageService objectStorageService;

    @MockBean
    private ConversionClient conversionClient;

    @Autowired
    private QuotaService quotaService;

    @Autowired
    private RetentionProperties retentionProperties;

    private final AtomicReference<String> lastJobId = new AtomicReference<>();

    public ThumbnailFlowIT(WebTestClient webTestClient, DatabaseClient databaseClient) {
        super(webTestClient, databaseClient);
    }

    private void givenConversionAccepted() {
        when(objectStorageService.signDownloadUrl(anyString(), any())).thenReturn(Mono.just("https://storage.test/signed"));
        when(conversionClient.submit(any(ConversionRequest.class)))
                .thenAnswer(invocation -> {
                    String jobId = "it-job-" + UUID.randomUUID();
                    lastJobId.set(jobId);
                    return Mono.just(jobId);
                });
    }

    private WebTestClient.ResponseSpec generate(UUID slideId, UUID tenantId, UUID eventId) {
        return webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_THUMBNAILS + "/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new GenerateThumbnailRequest(slideId, tenantId, eventId))
                .exchange();
    }

    private WebTestClient.ResponseSpec postWebhook(String body, UUID slideId) {
        return webTestClient.post()
                .uri(uri -> uri.path(WEBHOOK_URI).queryParam("slideId", slideId).build())
                .contentType(MediaType.APPLICATION_JSON)
                .header(ConversionWebhookController.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body.getBytes(StandardCharsets.UTF_8), WEBHOOK_SECRET))
                .bodyValue(body)
                .exchange();
    }

    private RetentionSweepResult runRetentionSweep() {
        return webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_MAINTENANCE + "/retention/sweep")
                .exchange()
                .expectStatus().isOk()
                .expectBody(RetentionSweepResult.class)
                .returnResult()
                .getResponseBody();
    }

    @Test
    void concurrentReservations_neverExceedTotal() {
        UUID tenantId = insertTenant(5, 0);

        List<QuotaStatus> results = Flux.range(0, 20)
                .flatMap(i -> quotaService.reserve(tenantId), 20)
                .collectList()
                .block();

        assertNotNull(results);
        assertEquals(5, results.stream().filter(QuotaStatus::available).count());
        assertEquals(5, quotaUsed(tenantId));
    }

    @Test
    void rollback_neverDropsBelowZero() {
        UUID tenantId = insertTenant(5, 0);

        quotaService.rollback(tenantId).block();

        assertEquals(0, quotaUsed(tenantId));
    }

    @Test
    void reserveThenRollback_leavesUsedUnchanged() {
        UUID tenantId = insertTenant(5, 2);

        QuotaStatus reserved = quotaService.reserve(tenantId).block();
        assertNotNull(reserved);
        assertTrue(reserved.available());
        assertEquals(3, quotaUsed(tenantId));

        quotaService.rollback(tenantId).block();

        assertEquals(2, quotaUsed(tenantId));
    }

    @Test
    void updateTotal_capsUsedCounter() {
        UUID tenantId = insertTenant(10, 8);

        webTestClient.put()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_QUOTA + "/" + tenantId + "/total")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"total\":3}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.used").isEqualTo(3)
                .jsonPath("$.total").isEqualTo(3)
                .jsonPath("$.available").isEqualTo(false);
    }

    @Test
    void generateThenFailedWebhook_chargesOnceAndRecordsFailureOnce() {
        givenConversionAccepted();
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID slideId = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusHours(1));

        generate(slideId, tenantId, eventId)
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").value(jobId -> assertEquals(lastJobId.get(), jobId));
        assertEquals(1, quotaUsed(tenantId));
        assertEquals(ThumbnailStatus.PROCESSING, thumbnailStatus(slideId));

        String externalJobId = lastJobId.get();
        String body = "{\"event\":\"job.failed\",\"job\":{\"id\":\"" + externalJobId + "\",\"status\":\"error\",\"tasks\":[" +
                "{\"name\":\"convert-to-thumbnail\",\"operation\":\"convert\",\"status\":\"error\",\"message\":\"Corrupt file\"}]}}";

        postWebhook(body, slideId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.processed").isEqualTo(true)
                .jsonPath("$.thumbnailStatus").isEqualTo("FAILED");

        postWebhook(body, slideId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alreadyProcessed").isEqualTo(true);

        assertEquals(ThumbnailStatus.FAILED, thumbnailStatus(slideId));
        assertEquals(1, failureCount(eventId));
        assertEquals(1, quotaUsed(tenantId));
    }

    @Test
    void generateThenFinishedWebhook_storesThumbnailAndCompletesSlide() {
        givenConversionAccepted();
        String exportUrl = "https://storage.cloudconvert.test/" + UUID.randomUUID() + "/thumb.jpg";
        when(conversionClient.downloadResult(exportUrl)).thenReturn(Mono.just(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}));
        when(objectStorageService.putObject(anyString(), any(byte[].class), anyString())).thenReturn(Mono.empty());
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID slideId = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusHours(1));

        generate(slideId, tenantId, eventId).expectStatus().isAccepted();

        String body = "{\"event\":\"job.finished\",\"job\":{\"id\":\"" + lastJobId.get() + "\",\"status\":\"finished\",\"tasks\":[" +
                "{\"name\":\"export-thumbnail\",\"operation\":\"export/url\",\"status\":\"finished\"," +
                "\"result\":{\"files\":[{\"filename\":\"thumb.jpg\",\"url\":\"" + exportUrl + "\"}]}}]}}";

        postWebhook(body, slideId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.processed").isEqualTo(true)
                .jsonPath("$.thumbnailStatus").isEqualTo("COMPLETED");

        String expectedKey = "tenants/" + tenantId + "/events/" + eventId + "/thumbnails/" + slideId + "-thumbnail.jpg";
        assertEquals(ThumbnailStatus.COMPLETED, thumbnailStatus(slideId));
        assertEquals(expectedKey, thumbnailKey(slideId));
        assertEquals(1, quotaUsed(tenantId));
        assertEquals(0, openJobCount(slideId));
        verify(objectStorageService).putObject(eq(expectedKey), any(byte[].class), eq("image/jpeg"));

        postWebhook(body, slideId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alreadyProcessed").isEqualTo(true);
        verify(objectStorageService, times(1)).putObject(anyString(), any(byte[].class), anyString());
    }

    @Test
    void retry_supersedesJobWhoseWebhookNeverCame() {
        givenConversionAccepted();
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID slideId = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusHours(3));

        generate(slideId, tenantId, eventId).expectStatus().isAccepted();
        String abandonedJobId = lastJobId.get();

        webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_THUMBNAILS + "/retry")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RetryThumbnailRequest(slideId))
                .exchange()
                .expectStatus().isEqualTo(409);

        backdateJobs(slideId, OffsetDateTime.now().minusHours(2));

        webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_THUMBNAILS + "/retry")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RetryThumbnailRequest(slideId))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").value(jobId -> assertNotEquals(abandonedJobId, jobId));

        assertEquals(ThumbnailStatus.PROCESSING, thumbnailStatus(slideId));
        assertEquals(1, openJobCount(slideId));
        assertEquals(2, quotaUsed(tenantId));

        String lateBody = "{\"event\":\"job.failed\",\"job\":{\"id\":\"" + abandonedJobId + "\",\"status\":\"error\"}}";
        postWebhook(lateBody, slideId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alreadyProcessed").isEqualTo(true);
        assertEquals(ThumbnailStatus.PROCESSING, thumbnailStatus(slideId));
    }

    @Test
    void webhookWithBadSignature_isRejected() {
        String body = "{\"event\":\"job.finished\",\"job\":{\"id\":\"unknown\"}}";

        webTestClient.post()
                .uri(WEBHOOK_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .header(ConversionWebhookController.SIGNATURE_HEADER, "0000")
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void generate_quotaExhausted_returns403AndLeavesSlideUntouched() {
        UUID tenantId = insertTenant(1, 1);
        UUID eventId = insertEvent(tenantId, true);
        UUID slideId = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now());

        generate(slideId, tenantId, eventId)
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.status").isEqualTo("QUOTA_EXHAUSTED")
                .jsonPath("$.upgradeUrl").exists();

        assertEquals(ThumbnailStatus.NONE, thumbnailStatus(slideId));
        assertEquals(1, quotaUsed(tenantId));
    }

    @Test
    void retroactiveSweep_submitsWithinTenantQuota() {
        givenConversionAccepted();
        UUID tenantId = insertTenant(2, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID disabledEvent = insertEvent(tenantId, false);
        for (int i = 0; i < 3; i++) {
            insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusDays(1).plusMinutes(i));
        }
        insertSlide(tenantId, disabledEvent, PPTX, OffsetDateTime.now().minusDays(1));

        RetroactiveSweepResult result = webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_MAINTENANCE + "/thumbnails/sweep")
                .exchange()
                .expectStatus().isOk()
                .expectBody(RetroactiveSweepResult.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(result);
        assertEquals(2, quotaUsed(tenantId));
        assertTrue(result.processed() >= 2);
        assertEquals(result.totalSlides(),
                result.processed() + result.skipped() + result.failed() + result.quotaExhausted());
    }

    @Test
    void retentionSweep_marksExpiredSlidesDeleted() {
        when(objectStorageService.objectExists(anyString())).thenReturn(Mono.just(true));
        when(objectStorageService.deleteObject(anyString())).thenReturn(Mono.empty());
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID expired = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusDays(5));
        UUID fresh = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusHours(1));

        RetentionSweepResult result = webTestClient.post()
                .uri(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_MAINTENANCE + "/retention/sweep")
                .exchange()
                .expectStatus().isOk()
                .expectBody(RetentionSweepResult.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(result);
        assertTrue(result.deletedCount() >= 1);
        assertTrue(result.errors().isEmpty());
        verify(objectStorageService, atLeastOnce()).deleteObject(contains(expired.toString()));
        verify(objectStorageService, never()).deleteObject(contains(fresh.toString()));
    }

    @Test
    void retentionSweep_secondRunDeletesNothing() {
        when(objectStorageService.objectExists(anyString())).thenReturn(Mono.just(true));
        when(objectStorageService.deleteObject(anyString())).thenReturn(Mono.empty());
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID expired = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusDays(4));

        RetentionSweepResult first = runRetentionSweep();
        assertNotNull(first);
        assertTrue(first.deletedCount() >= 1);
        assertTrue(isDeleted(expired));

        RetentionSweepResult second = runRetentionSweep();
        assertNotNull(second);
        assertEquals(0, second.deletedCount());
        assertEquals(0, second.processedCount());
        verify(objectStorageService, times(1)).deleteObject(contains(expired.toString()));
    }

    @Test
    void retentionSweep_failingObjectDoesNotBlockLaterSlides() {
        UUID tenantId = insertTenant(5, 0);
        UUID eventId = insertEvent(tenantId, true);
        UUID stuck = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusDays(400));
        UUID next = insertSlide(tenantId, eventId, PPTX, OffsetDateTime.now().minusDays(399));
        when(objectStorageService.objectExists(anyString())).thenReturn(Mono.just(true));
        when(objectStorageService.deleteObject(anyString())).thenReturn(Mono.empty());
        when(objectStorageService.deleteObject(contains(stuck.toString())))
                .thenReturn(Mono.error(new StorageException("access denied")));

        int batchSize = retentionProperties.getBatchSize();
        retentionProperties.setBatchSize(1);
        try {
            RetentionSweepResult first = runRetentionSweep();
            assertNotNull(first);
            assertEquals(1, first.errors().size());
            assertEquals(stuck, first.errors().get(0).slideId());

            RetentionSweepResult second = runRetentionSweep();
            assertNotNull(second);
            assertEquals(1, second.deletedCount());
            assertTrue(second.errors().isEmpty());
        } finally {
            retentionProperties.setBatchSize(batchSize);
        }

        assertFalse(isDeleted(stuck));
        assertTrue(isDeleted(next));
    }
}
