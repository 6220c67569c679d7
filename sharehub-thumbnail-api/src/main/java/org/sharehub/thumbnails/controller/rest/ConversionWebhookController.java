package org.sharehub.thumbnails.controller.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.dto.response.WebhookResult;
import org.sharehub.thumbnails.service.ConversionWebhookService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Callback endpoint for the conversion service.
 * The body is bound as raw bytes: the signature is computed over the exact bytes received.
 */
@Slf4j
@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_WEBHOOKS)
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Conversion service callbacks")
public class ConversionWebhookController {

    public static final String SIGNATURE_HEADER = "X-CloudConvert-Signature";

    private final ConversionWebhookService conversionWebhookService;

    @PostMapping(value = "/conversion", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Conversion callback",
            description = "Signed CloudConvert job notification. Duplicate deliveries are acknowledged without side effects.")
    public Mono<WebhookResult> handleConversionCallback(
            @RequestBody byte[] payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestParam(value = "slideId", required = false) UUID slideId,
            @RequestParam(value = "tenantId", required = false) UUID tenantId) {
        log.debug("Conversion callback received (slide {}, tenant {})", slideId, tenantId);
        return conversionWebhookService.handle(payload, signature, slideId);
    }
}
