package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.FailureNotification;
import reactor.core.publisher.Mono;

/**
 * Delivers failure escalations to the tenant administrators.
 */
public interface FailureNotifier {

    Mono<Void> send(FailureNotification notification);
}
