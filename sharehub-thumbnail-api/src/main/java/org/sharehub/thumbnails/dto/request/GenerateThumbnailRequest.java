package org.sharehub.thumbnails.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record GenerateThumbnailRequest(
        @NotNull @Schema(description = "Slide to render") UUID slideId,
        @NotNull @Schema(description = "Tenant owning the slide and charged for the conversion") UUID tenantId,
        @NotNull @Schema(description = "Event the slide belongs to") UUID eventId) {
}
