package org.sharehub.thumbnails.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.service.RetentionSweepService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for the uploaded slide retention sweep
 * Runs on a configurable cron schedule (default: every 6 hours)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sharehub.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionCleanupScheduler {

    private final RetentionSweepService retentionSweepService;

    @Scheduled(cron = "${sharehub.retention.cleanup-cron:0 0 */6 * * ?}")
    public void purgeExpiredSlides() {
        retentionSweepService.run()
                .doOnError(e -> log.error("Error during retention sweep", e))
                .subscribe();
    }
}
