package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Per-tenant thumbnail quota ledger.
 */
public interface QuotaService {

    /**
     * Reserves one thumbnail for the tenant if any is left.
     * An exhausted quota is reported through {@link QuotaStatus#available()}, not as an error.
     */
    Mono<QuotaStatus> reserve(UUID tenantId);

    /**
     * Gives back one reservation. The counter never drops below zero.
     */
    Mono<Void> rollback(UUID tenantId);

    Mono<QuotaStatus> status(UUID tenantId);

    Mono<QuotaStatus> reset(UUID tenantId);

    Mono<QuotaStatus> updateTotal(UUID tenantId, int total);

    Mono<QuotaStatistics> statistics();
}
