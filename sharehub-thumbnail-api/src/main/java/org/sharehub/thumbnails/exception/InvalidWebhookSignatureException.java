package org.sharehub.thumbnails.exception;

public class InvalidWebhookSignatureException extends AbstractThumbnailException {

    public InvalidWebhookSignatureException() {
        super("Webhook signature verification failed");
    }

    @Override
    public String getError() {
        return ThumbnailException.INVALID_WEBHOOK_SIGNATURE;
    }
}
