package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.request.ConversionRequest;
import reactor.core.publisher.Mono;

/**
 * Client of the external document conversion service.
 */
public interface ConversionClient {

    /**
     * Creates a conversion job.
     *
     * @return the external job id
     */
    Mono<String> submit(ConversionRequest request);

    /**
     * Downloads a converted file from the URL reported in the job result.
     */
    Mono<byte[]> downloadResult(String url);
}
