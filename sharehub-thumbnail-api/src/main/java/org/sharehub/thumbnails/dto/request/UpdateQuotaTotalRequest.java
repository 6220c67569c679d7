package org.sharehub.thumbnails.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpdateQuotaTotalRequest(@NotNull @Min(0) @Schema(description = "New thumbnail quota for the tenant") Integer total) {
}
