package org.sharehub.thumbnails.dto.response;

public record QuotaStatistics(
        long totalTenants,
        double averageQuotaUsed,   // Rounded to two decimals
        long tenantsAtLimit
) {
}
