package org.sharehub.thumbnails.exception;

public class InvalidWebhookPayloadException extends AbstractThumbnailException {

    public InvalidWebhookPayloadException(String message) {
        super(message);
    }

    public InvalidWebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return ThumbnailException.INVALID_WEBHOOK_PAYLOAD;
    }
}
