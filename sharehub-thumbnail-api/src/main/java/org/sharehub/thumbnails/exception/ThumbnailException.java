package org.sharehub.thumbnails.exception;

public interface ThumbnailException {

    String CONVERSION_JOB_NOT_FOUND = "ConversionJobNotFound";
    String CONVERSION_SUBMISSION = "ConversionSubmission";
    String EVENT_NOT_FOUND = "EventNotFound";
    String INVALID_WEBHOOK_PAYLOAD = "InvalidWebhookPayload";
    String INVALID_WEBHOOK_SIGNATURE = "InvalidWebhookSignature";
    String RETRY_CONFLICT = "RetryConflict";
    String SLIDE_NOT_FOUND = "SlideNotFound";
    String STORAGE = "Storage";
    String TENANT_NOT_FOUND = "TenantNotFound";
}
