package org.sharehub.thumbnails.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.dto.request.UpdateQuotaTotalRequest;
import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.service.QuotaService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * REST Controller for tenant thumbnail quota
 */
@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_QUOTA)
@RequiredArgsConstructor
@Tag(name = "Thumbnail quota", description = "Per-tenant thumbnail quota status and administration")
public class QuotaController {

    private final QuotaService quotaService;

    @GetMapping(value = "/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Quota statistics", description = "Tenant count, average quota used and number of tenants at their limit")
    public Mono<QuotaStatistics> statistics() {
        return quotaService.statistics();
    }

    @GetMapping(value = "/{tenantId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Quota status", description = "Read-only snapshot of the tenant thumbnail quota")
    public Mono<QuotaStatus> status(@PathVariable UUID tenantId) {
        return quotaService.status(tenantId);
    }

    @PostMapping(value = "/{tenantId}/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Reset quota", description = "Sets the used counter back to zero, typically after a plan upgrade")
    public Mono<QuotaStatus> reset(@PathVariable UUID tenantId) {
        log.info("Resetting thumbnail quota of tenant {}", tenantId);
        return quotaService.reset(tenantId);
    }

    @PutMapping(value = "/{tenantId}/total", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update quota total", description = "Changes the tenant thumbnail allowance; the used counter is capped to the new total")
    public Mono<QuotaStatus> updateTotal(@PathVariable UUID tenantId, @Valid @RequestBody UpdateQuotaTotalRequest request) {
        log.info("Setting thumbnail quota total of tenant {} to {}", tenantId, request.total());
        return quotaService.updateTotal(tenantId, request.total());
    }
}
