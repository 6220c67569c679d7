package org.sharehub.thumbnails.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record RetryThumbnailRequest(@NotNull @Schema(description = "Slide whose thumbnail should be generated again") UUID slideId) {
}
