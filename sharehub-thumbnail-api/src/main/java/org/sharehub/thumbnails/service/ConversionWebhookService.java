package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.WebhookResult;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Applies conversion service callbacks to the job and slide records.
 */
public interface ConversionWebhookService {

    /**
     * Verifies and processes one webhook delivery. A job reaches its terminal state at most once;
     * later deliveries for the same job are reported as already processed and write nothing.
     *
     * @param rawPayload      request body exactly as received
     * @param signature       value of the signature header
     * @param callbackSlideId slide id carried by the callback URL, may be null
     */
    Mono<WebhookResult> handle(byte[] rawPayload, String signature, UUID callbackSlideId);
}
