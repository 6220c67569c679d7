package org.sharehub.thumbnails.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.exception.TenantNotFoundException;
import org.sharehub.thumbnails.repository.TenantQuotaDAO;
import org.sharehub.thumbnails.service.QuotaService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaServiceImpl implements QuotaService {

    private final TenantQuotaDAO tenantQuotaDAO;

    @Override
    public Mono<QuotaStatus> reserve(UUID tenantId) {
        return tenantQuotaDAO.incrementIfAvailable(tenantId)
                .doOnNext(quota -> log.debug("Reserved thumbnail quota for tenant {}: {}/{}", tenantId, quota.used(), quota.total()))
                .switchIfEmpty(Mono.defer(() -> status(tenantId)
                        .map(snapshot -> new QuotaStatus(false, snapshot.used(), snapshot.total(), snapshot.remaining()))
                        .doOnNext(snapshot -> log.info("Thumbnail quota exhausted for tenant {}: {}/{}", tenantId, snapshot.used(), snapshot.total()))));
    }

    @Override
    public Mono<Void> rollback(UUID tenantId) {
        return tenantQuotaDAO.decrement(tenantId)
                .flatMap(rows -> rows == 0 ? Mono.error(new TenantNotFoundException(tenantId)) : Mono.just(rows))
                .doOnNext(rows -> log.debug("Rolled back thumbnail quota reservation for tenant {}", tenantId))
                .then();
    }

    @Override
    public Mono<QuotaStatus> status(UUID tenantId) {
        return tenantQuotaDAO.findStatus(tenantId)
                .switchIfEmpty(Mono.error(new TenantNotFoundException(tenantId)));
    }

    @Override
    public Mono<QuotaStatus> reset(UUID tenantId) {
        return tenantQuotaDAO.resetUsed(tenantId)
                .switchIfEmpty(Mono.error(new TenantNotFoundException(tenantId)))
                .doOnNext(quota -> log.info("Thumbnail quota reset for tenant {}", tenantId));
    }

    @Override
    public Mono<QuotaStatus> updateTotal(UUID tenantId, int total) {
        if (total < 0) {
            return Mono.error(new IllegalArgumentException("Thumbnail quota total must be >= 0. Requested value: " + total));
        }
        return tenantQuotaDAO.updateTotal(tenantId, total)
                .switchIfEmpty(Mono.error(new TenantNotFoundException(tenantId)))
                .doOnNext(quota -> log.info("Thumbnail quota total for tenant {} set to {} (used {})", tenantId, quota.total(), quota.used()));
    }

    @Override
    public Mono<QuotaStatistics> statistics() {
        return tenantQuotaDAO.statistics();
    }
}
