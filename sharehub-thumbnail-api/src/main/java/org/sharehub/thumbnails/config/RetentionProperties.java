package org.sharehub.thumbnails.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the uploaded file retention sweep.
 * Maps to sharehub.retention.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sharehub.retention")
public class RetentionProperties {

    /**
     * Enable or disable the scheduled retention sweep.
     * The HTTP trigger stays available either way.
     */
    private boolean enabled = true;

    /**
     * Cron expression for the sweep (default: every 6 hours).
     */
    private String cleanupCron = "0 0 */6 * * ?";

    /**
     * Age after which an uploaded file is removed.
     */
    private int retentionHours = 48;

    /**
     * Maximum number of files handled by one run.
     */
    private int batchSize = 1000;

    /**
     * Interval announced as the next run in the sweep summary.
     */
    private int intervalHours = 6;

    @PostConstruct
    public void validate() {
        if (retentionHours <= 0) {
            throw new IllegalArgumentException("sharehub.retention.retention-hours must be > 0. Current value: " + retentionHours);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("sharehub.retention.batch-size must be > 0. Current value: " + batchSize);
        }
        if (intervalHours <= 0) {
            throw new IllegalArgumentException("sharehub.retention.interval-hours must be > 0. Current value: " + intervalHours);
        }
    }
}
