package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.RetentionSweepResult;
import reactor.core.publisher.Mono;

/**
 * Removes uploaded slide files once they are past the retention window.
 */
public interface RetentionSweepService {

    Mono<RetentionSweepResult> run();
}
