package org.sharehub.thumbnails.service;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Object storage holding uploaded slides and generated thumbnails.
 */
public interface ObjectStorageService {

    /**
     * Creates a time-limited GET URL for the object.
     */
    Mono<String> signDownloadUrl(String key, Duration ttl);

    Mono<Boolean> objectExists(String key);

    /**
     * Removes the object. A missing object counts as removed.
     */
    Mono<Void> deleteObject(String key);

    Mono<Void> putObject(String key, byte[] content, String contentType);
}
