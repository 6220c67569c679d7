package org.sharehub.thumbnails.dto.request;

import org.sharehub.thumbnails.enums.InputFormat;

import java.util.UUID;

/**
 * Everything the conversion service needs to render the first page of a slide.
 */
public record ConversionRequest(
        UUID slideId,
        UUID tenantId,
        String sourceUrl,
        InputFormat inputFormat,
        String outputFilename,
        String callbackUrl
) {
}
