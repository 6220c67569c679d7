package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Single-statement operations on the tenant thumbnail quota counter.
 * Each method completes empty when the tenant does not exist.
 */
public interface TenantQuotaDAO {

    /**
     * Increments the used counter when it is below the total.
     *
     * @return the counter after the increment, or empty when nothing was reserved
     */
    Mono<QuotaStatus> incrementIfAvailable(UUID tenantId);

    Mono<Long> decrement(UUID tenantId);

    Mono<QuotaStatus> findStatus(UUID tenantId);

    Mono<QuotaStatus> resetUsed(UUID tenantId);

    Mono<QuotaStatus> updateTotal(UUID tenantId, int total);

    Mono<QuotaStatistics> statistics();
}
