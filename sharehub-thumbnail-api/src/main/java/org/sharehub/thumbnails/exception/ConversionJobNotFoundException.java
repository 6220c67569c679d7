package org.sharehub.thumbnails.exception;

public class ConversionJobNotFoundException extends AbstractThumbnailException {

    public ConversionJobNotFoundException(String externalJobId) {
        super("Conversion job not found : " + externalJobId);
    }

    @Override
    public String getError() {
        return ThumbnailException.CONVERSION_JOB_NOT_FOUND;
    }
}
