package org.sharehub.thumbnails.repository.impl;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.sharehub.thumbnails.dto.response.QuotaStatistics;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.repository.TenantQuotaDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.TENANTS;

@Service
@RequiredArgsConstructor
public class TenantQuotaDAOImpl implements TenantQuotaDAO {

    private static final String RETURNING = " RETURNING " + THUMBNAIL_QUOTA_USED + ", " + THUMBNAIL_QUOTA_TOTAL;

    // The used < total guard and the increment run as one statement, so concurrent reservations cannot overshoot
    public static final String INCREMENT_IF_AVAILABLE = "UPDATE " + TENANTS +
            " SET " + THUMBNAIL_QUOTA_USED + " = " + THUMBNAIL_QUOTA_USED + " + 1, " + UPDATED_AT + " = NOW()" +
            " WHERE " + ID + " = :id AND " + THUMBNAIL_QUOTA_USED + " < " + THUMBNAIL_QUOTA_TOTAL + RETURNING;

    public static final String DECREMENT = "UPDATE " + TENANTS +
            " SET " + THUMBNAIL_QUOTA_USED + " = GREATEST(" + THUMBNAIL_QUOTA_USED + " - 1, 0), " + UPDATED_AT + " = NOW()" +
            " WHERE " + ID + " = :id";

    public static final String FIND_STATUS = "SELECT " + THUMBNAIL_QUOTA_USED + ", " + THUMBNAIL_QUOTA_TOTAL +
            " FROM " + TENANTS + " WHERE " + ID + " = :id";

    public static final String RESET_USED = "UPDATE " + TENANTS +
            " SET " + THUMBNAIL_QUOTA_USED + " = 0, " + UPDATED_AT + " = NOW()" +
            " WHERE " + ID + " = :id" + RETURNING;

    public static final String UPDATE_TOTAL = "UPDATE " + TENANTS +
            " SET " + THUMBNAIL_QUOTA_TOTAL + " = :total, " +
            THUMBNAIL_QUOTA_USED + " = LEAST(" + THUMBNAIL_QUOTA_USED + ", :total), " + UPDATED_AT + " = NOW()" +
            " WHERE " + ID + " = :id" + RETURNING;

    public static final String STATISTICS = """
            SELECT COUNT(*) AS total_tenants,
                   CAST(ROUND(COALESCE(AVG(thumbnail_quota_used), 0), 2) AS DOUBLE PRECISION) AS avg_quota_used,
                   COUNT(*) FILTER (WHERE thumbnail_quota_used >= thumbnail_quota_total) AS tenants_at_limit
            FROM tenants""";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<QuotaStatus> incrementIfAvailable(UUID tenantId) {
        return databaseClient.sql(INCREMENT_IF_AVAILABLE)
                .bind(ID, tenantId)
                .map(row -> new QuotaStatus(true, used(row), total(row), Math.max(0, total(row) - used(row))))
                .one();
    }

    @Override
    public Mono<Long> decrement(UUID tenantId) {
        return databaseClient.sql(DECREMENT)
                .bind(ID, tenantId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<QuotaStatus> findStatus(UUID tenantId) {
        return databaseClient.sql(FIND_STATUS)
                .bind(ID, tenantId)
                .map(row -> QuotaStatus.of(used(row), total(row)))
                .one();
    }

    @Override
    public Mono<QuotaStatus> resetUsed(UUID tenantId) {
        return databaseClient.sql(RESET_USED)
                .bind(ID, tenantId)
                .map(row -> QuotaStatus.of(used(row), total(row)))
                .one();
    }

    @Override
    public Mono<QuotaStatus> updateTotal(UUID tenantId, int total) {
        return databaseClient.sql(UPDATE_TOTAL)
                .bind(ID, tenantId)
                .bind("total", total)
                .map(row -> QuotaStatus.of(used(row), total(row)))
                .one();
    }

    @Override
    public Mono<QuotaStatistics> statistics() {
        return databaseClient.sql(STATISTICS)
                .map(row -> new QuotaStatistics(
                        row.get("total_tenants", Long.class),
                        row.get("avg_quota_used", Double.class),
                        row.get("tenants_at_limit", Long.class)))
                .one()
                .defaultIfEmpty(new QuotaStatistics(0L, 0d, 0L));
    }

    private static int used(Readable row) {
        return row.get(THUMBNAIL_QUOTA_USED, Integer.class);
    }

    private static int total(Readable row) {
        return row.get(THUMBNAIL_QUOTA_TOTAL, Integer.class);
    }
}
