package org.sharehub.thumbnails.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.dto.request.GenerateThumbnailRequest;
import org.sharehub.thumbnails.dto.request.RetryThumbnailRequest;
import org.sharehub.thumbnails.dto.response.ThumbnailGenerationResult;
import org.sharehub.thumbnails.service.ThumbnailGenerationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_THUMBNAILS)
@RequiredArgsConstructor
@Tag(name = "Thumbnails", description = "Thumbnail generation for uploaded slides")
public class ThumbnailController {

    private final ThumbnailGenerationService thumbnailGenerationService;

    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Generate a thumbnail",
            description = "Reserves one unit of the tenant thumbnail quota and submits the slide for conversion. " +
                    "The thumbnail is stored when the conversion service calls back.")
    public Mono<ResponseEntity<ThumbnailGenerationResult>> generate(@Valid @RequestBody GenerateThumbnailRequest request) {
        log.info("Thumbnail generation requested for slide {}", request.slideId());
        return thumbnailGenerationService.submit(request.slideId(), request.tenantId(), request.eventId())
                .map(ThumbnailController::toResponse);
    }

    @PostMapping(value = "/retry", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Retry a thumbnail", description = "Submits the slide again, consuming quota again. Rejected while a conversion is in flight.")
    public Mono<ResponseEntity<ThumbnailGenerationResult>> retry(@Valid @RequestBody RetryThumbnailRequest request) {
        log.info("Thumbnail retry requested for slide {}", request.slideId());
        return thumbnailGenerationService.retry(request.slideId())
                .map(ThumbnailController::toResponse);
    }

    static ResponseEntity<ThumbnailGenerationResult> toResponse(ThumbnailGenerationResult result) {
        HttpStatus status = switch (result.status()) {
            case PROCESSING -> HttpStatus.ACCEPTED;
            case COMPLETED -> HttpStatus.OK;
            case QUOTA_EXHAUSTED -> HttpStatus.FORBIDDEN;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case DISABLED -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(result);
    }
}
