package org.sharehub.thumbnails.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.sharehub.thumbnails.enums.ThumbnailStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResult(
        boolean processed,
        boolean alreadyProcessed,
        ThumbnailStatus thumbnailStatus,
        String jobId,
        String message
) {

    public static WebhookResult processed(String jobId, ThumbnailStatus status) {
        return new WebhookResult(true, false, status, jobId, "Webhook processed");
    }

    public static WebhookResult alreadyProcessed(String jobId) {
        return new WebhookResult(false, true, null, jobId, "Already processed");
    }

    public static WebhookResult acknowledged(String jobId, String event) {
        return new WebhookResult(false, false, null, jobId, "Event " + event + " acknowledged, no action needed");
    }
}
