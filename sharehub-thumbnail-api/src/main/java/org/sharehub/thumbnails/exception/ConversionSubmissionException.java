package org.sharehub.thumbnails.exception;

public class ConversionSubmissionException extends AbstractThumbnailException {

    public ConversionSubmissionException(String message) {
        super(message);
    }

    public ConversionSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return ThumbnailException.CONVERSION_SUBMISSION;
    }
}
