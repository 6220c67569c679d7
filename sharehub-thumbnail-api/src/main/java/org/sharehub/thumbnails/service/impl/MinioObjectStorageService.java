package org.sharehub.thumbnails.service.impl;

import io.minio.*;
import io.minio.errors.ErrorResponseException;
import io.minio.http.Method;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.MinioProperties;
import org.sharehub.thumbnails.exception.StorageException;
import org.sharehub.thumbnails.service.ObjectStorageService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.time.Duration;

/**
 * MinIO/S3 implementation of ObjectStorageService.
 * The MinIO client is blocking, every call runs on the bounded elastic scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MinioObjectStorageService implements ObjectStorageService {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioProperties minioProperties;

    private MinioClient minioClient;
    private String bucketName;

    @PostConstruct
    public void init() {
        this.bucketName = minioProperties.getBucketName();
        this.minioClient = MinioClient.builder()
                .endpoint(minioProperties.getEndpoint())
                .credentials(minioProperties.getAccessKey(), minioProperties.getSecretKey())
                .build();
        if (minioProperties.isCreateBucket()) {
            ensureBucketExists();
        }
        log.info("MinIO storage initialized with bucket: {}", bucketName);
    }

    private void ensureBucketExists() {
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
            if (!found) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                log.info("Bucket '{}' created successfully.", bucketName);
            }
        } catch (Exception e) {
            log.error("Error ensuring bucket '{}' exists", bucketName, e);
            throw new StorageException("Could not initialize storage bucket " + bucketName, e);
        }
    }

    @Override
    public Mono<String> signDownloadUrl(String key, Duration ttl) {
        return Mono.fromCallable(() -> {
            try {
                return minioClient.getPresignedObjectUrl(
                        GetPresignedObjectUrlArgs.builder()
                                .method(Method.GET)
                                .bucket(bucketName)
                                .object(key)
                                .expiry((int) ttl.getSeconds())
                                .build());
            } catch (Exception e) {
                log.error("Failed to sign download URL for object: {}", key, e);
                throw new StorageException("Failed to sign download URL for " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> objectExists(String key) {
        return Mono.fromCallable(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucketName)
                        .object(key)
                        .build());
                return true;
            } catch (ErrorResponseException e) {
                if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                    return false;
                }
                throw new StorageException("Failed to check object " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to check object " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> deleteObject(String key) {
        return Mono.fromRunnable(() -> {
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucketName)
                        .object(key)
                        .build());
                log.debug("Object deleted: {}", key);
            } catch (ErrorResponseException e) {
                if (!NO_SUCH_KEY.equals(e.errorResponse().code())) {
                    throw new StorageException("Failed to delete object " + key, e);
                }
                log.debug("Object already absent: {}", key);
            } catch (Exception e) {
                throw new StorageException("Failed to delete object " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> putObject(String key, byte[] content, String contentType) {
        return Mono.fromRunnable(() -> {
            try {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucketName)
                        .object(key)
                        .stream(new ByteArrayInputStream(content), content.length, -1)
                        .contentType(contentType)
                        .build());
                log.debug("Object stored: {} ({} bytes)", key, content.length);
            } catch (Exception e) {
                log.error("Failed to store object: {}", key, e);
                throw new StorageException("Failed to store object " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
