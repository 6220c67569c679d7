package org.sharehub.thumbnails.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.dto.response.RetentionSweepResult;
import org.sharehub.thumbnails.dto.response.RetroactiveSweepResult;
import org.sharehub.thumbnails.service.RetentionSweepService;
import org.sharehub.thumbnails.service.RetroactiveThumbnailSweepService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * HTTP triggers for the sweeps, for deployments driven by an external timer.
 */
@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_MAINTENANCE)
@RequiredArgsConstructor
@Tag(name = "Maintenance", description = "Thumbnail and retention sweeps")
public class MaintenanceController {

    private final RetroactiveThumbnailSweepService retroactiveThumbnailSweepService;
    private final RetentionSweepService retentionSweepService;

    @PostMapping(value = "/thumbnails/sweep", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run the retroactive thumbnail sweep")
    public Mono<RetroactiveSweepResult> runThumbnailSweep() {
        log.info("Retroactive thumbnail sweep triggered over HTTP");
        return retroactiveThumbnailSweepService.run();
    }

    @PostMapping(value = "/retention/sweep", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run the retention sweep")
    public Mono<RetentionSweepResult> runRetentionSweep() {
        log.info("Retention sweep triggered over HTTP");
        return retentionSweepService.run();
    }
}
