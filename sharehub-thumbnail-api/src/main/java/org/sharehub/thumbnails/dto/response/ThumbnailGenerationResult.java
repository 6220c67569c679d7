package org.sharehub.thumbnails.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.sharehub.thumbnails.enums.GenerationStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThumbnailGenerationResult(
        boolean success,
        GenerationStatus status,
        String jobId,
        QuotaStatus quota,
        String message,
        String upgradeUrl
) {

    public static ThumbnailGenerationResult processing(String jobId, QuotaStatus quota) {
        return new ThumbnailGenerationResult(true, GenerationStatus.PROCESSING, jobId, quota,
                "Thumbnail generation started", null);
    }

    public static ThumbnailGenerationResult completed(QuotaStatus quota) {
        return new ThumbnailGenerationResult(true, GenerationStatus.COMPLETED, null, quota,
                "Thumbnail already exists", null);
    }

    public static ThumbnailGenerationResult quotaExhausted(QuotaStatus quota, String upgradeUrl) {
        return new ThumbnailGenerationResult(false, GenerationStatus.QUOTA_EXHAUSTED, null, quota,
                "Thumbnail quota exhausted", upgradeUrl);
    }

    public static ThumbnailGenerationResult disabled() {
        return new ThumbnailGenerationResult(false, GenerationStatus.DISABLED, null, null,
                "Thumbnail generation is disabled for this event", null);
    }

    public static ThumbnailGenerationResult failed(String message) {
        return failed(message, null);
    }

    public static ThumbnailGenerationResult failed(String message, QuotaStatus quota) {
        return new ThumbnailGenerationResult(false, GenerationStatus.FAILED, null, quota, message, null);
    }
}
