package org.sharehub.thumbnails.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

/**
 * Configuration properties for thumbnail generation.
 * Maps to sharehub.thumbnail.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "sharehub.thumbnail")
public class ThumbnailProperties {

    /**
     * Lifetime of the signed download URL handed to the conversion service.
     */
    private Duration signedUrlTtl = Duration.ofHours(1);

    /**
     * Public base URL of this service, used to build the webhook callback URL.
     */
    private String callbackBaseUrl = "http://localhost:8081";

    /**
     * Hint returned to the caller when the tenant quota is exhausted.
     */
    private String upgradeUrl = "/admin/settings/billing?upgrade=thumbnail-quota";

    /**
     * A job still waiting for its webhook after this long may be superseded by a retry.
     */
    private Duration staleJobAfter = Duration.ofMinutes(30);

    /**
     * Retroactive sweep configuration.
     */
    private Sweep sweep = new Sweep();

    /**
     * Failure tracking configuration.
     */
    private Failure failure = new Failure();

    @Data
    public static class Sweep {

        private boolean enabled = true;

        /**
         * Cron expression of the daily sweep (default: 2 AM).
         */
        private String cron = "0 0 2 * * ?";

        /**
         * Only files uploaded within this many days are picked up.
         */
        private int lookBackDays = 30;

        private int maxPerTenant = 10;

        private int maxPerRun = 50;

        /**
         * Pause between two submissions, to stay under the conversion service rate limit.
         */
        private Duration delay = Duration.ofSeconds(2);
    }

    @Data
    public static class Failure {

        /**
         * Trailing window over which failures are counted.
         */
        private int windowHours = 24;

        /**
         * Number of failures in the window that escalates to a notification.
         */
        private int notificationThreshold = 3;

        /**
         * FailureNotifier implementation to use. "log" writes escalations to the application log.
         */
        private String notifier = "log";
    }

    @PostConstruct
    public void validate() {
        if (signedUrlTtl == null || signedUrlTtl.isNegative() || signedUrlTtl.isZero()) {
            throw new IllegalArgumentException("sharehub.thumbnail.signed-url-ttl must be > 0. Current value: " + signedUrlTtl);
        }
        if (staleJobAfter == null || staleJobAfter.isNegative() || staleJobAfter.isZero()) {
            throw new IllegalArgumentException("sharehub.thumbnail.stale-job-after must be > 0. Current value: " + staleJobAfter);
        }
        if (sweep.getLookBackDays() <= 0) {
            throw new IllegalArgumentException("sharehub.thumbnail.sweep.look-back-days must be > 0. Current value: " + sweep.getLookBackDays());
        }
        if (sweep.getMaxPerTenant() <= 0 || sweep.getMaxPerRun() <= 0) {
            throw new IllegalArgumentException("sharehub.thumbnail.sweep.max-per-tenant and max-per-run must be > 0");
        }
        if (sweep.getDelay() == null || sweep.getDelay().isNegative()) {
            throw new IllegalArgumentException("sharehub.thumbnail.sweep.delay must be >= 0. Current value: " + sweep.getDelay());
        }
        if (failure.getWindowHours() <= 0) {
            throw new IllegalArgumentException("sharehub.thumbnail.failure.window-hours must be > 0. Current value: " + failure.getWindowHours());
        }
        if (failure.getNotificationThreshold() <= 0) {
            throw new IllegalArgumentException("sharehub.thumbnail.failure.notification-threshold must be > 0. Current value: " + failure.getNotificationThreshold());
        }
        log.info("Thumbnail sweep: up to {} files per run, {} per tenant, look-back {} days",
                sweep.getMaxPerRun(), sweep.getMaxPerTenant(), sweep.getLookBackDays());
    }

    public Duration failureWindow() {
        return Duration.ofHours(failure.getWindowHours());
    }

    /**
     * Object key of the thumbnail generated for a slide.
     */
    public String thumbnailKey(UUID tenantId, UUID eventId, UUID slideId) {
        return "tenants/" + tenantId + "/events/" + eventId + "/thumbnails/" + outputFilename(slideId);
    }

    public String outputFilename(UUID slideId) {
        return slideId + "-thumbnail.jpg";
    }
}
