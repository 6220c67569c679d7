package org.sharehub.thumbnails.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for MinIO/S3 storage.
 * Maps to storage.minio.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "storage.minio")
public class MinioProperties {

    /**
     * MinIO endpoint URL.
     */
    private String endpoint = "http://localhost:9000";

    private String accessKey = "minioadmin";

    private String secretKey = "minioadmin";

    /**
     * Bucket holding uploaded slides and their thumbnails.
     */
    private String bucketName = "sharehub-slides";

    /**
     * Create the bucket at startup when it is missing.
     */
    private boolean createBucket = true;
}
