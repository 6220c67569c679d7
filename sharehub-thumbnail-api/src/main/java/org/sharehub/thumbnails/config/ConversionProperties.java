package org.sharehub.thumbnails.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * CloudConvert API configuration.
 * Maps to sharehub.conversion.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "sharehub.conversion")
public class ConversionProperties {

    /**
     * Base URL of the CloudConvert REST API.
     */
    private String apiUrl = "https://api.cloudconvert.com";

    private String apiKey;

    /**
     * Shared secret used to sign webhook payloads.
     */
    private String webhookSecret;

    /**
     * Timeout for job creation requests in seconds.
     */
    private int submitTimeoutSeconds = 30;

    /**
     * Timeout for downloading a converted thumbnail in seconds.
     */
    private int downloadTimeoutSeconds = 60;

    /**
     * Retries on a failed thumbnail download.
     */
    private int downloadRetries = 3;

    private Output output = new Output();

    @Data
    public static class Output {
        private int quality = 85;
        private int width = 1920;
        private int height = 1080;
    }

    @PostConstruct
    public void validate() {
        if (submitTimeoutSeconds <= 0 || downloadTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("sharehub.conversion timeouts must be > 0");
        }
        if (downloadRetries < 0) {
            throw new IllegalArgumentException("sharehub.conversion.download-retries must be >= 0. Current value: " + downloadRetries);
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("sharehub.conversion.api-key is not set, job submissions will be rejected by CloudConvert");
        }
        if (webhookSecret == null || webhookSecret.isBlank()) {
            log.warn("sharehub.conversion.webhook-secret is not set, every webhook will be rejected");
        }
    }
}
