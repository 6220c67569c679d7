package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.RetroactiveSweepResult;
import reactor.core.publisher.Mono;

/**
 * Generates missing thumbnails for recently uploaded slides, a bounded batch per run.
 */
public interface RetroactiveThumbnailSweepService {

    Mono<RetroactiveSweepResult> run();
}
