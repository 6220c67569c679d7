package org.sharehub.thumbnails.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.service.RetroactiveThumbnailSweepService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for the retroactive thumbnail sweep
 * Runs on a configurable cron schedule (default: daily at 2 AM)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sharehub.thumbnail.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetroactiveThumbnailScheduler {

    private final RetroactiveThumbnailSweepService sweepService;

    @Scheduled(cron = "${sharehub.thumbnail.sweep.cron:0 0 2 * * ?}")
    public void generateMissingThumbnails() {
        log.info("Starting scheduled retroactive thumbnail sweep");
        sweepService.run()
                .doOnError(e -> log.error("Error during retroactive thumbnail sweep", e))
                .subscribe(); // Non-blocking subscription
    }
}
