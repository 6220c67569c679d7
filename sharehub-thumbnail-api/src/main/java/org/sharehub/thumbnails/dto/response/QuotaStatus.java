package org.sharehub.thumbnails.dto.response;

/**
 * Snapshot of a tenant thumbnail quota.
 */
public record QuotaStatus(boolean available, int used, int total, int remaining) {

    public static QuotaStatus of(int used, int total) {
        return new QuotaStatus(used < total, used, total, Math.max(0, total - used));
    }
}
