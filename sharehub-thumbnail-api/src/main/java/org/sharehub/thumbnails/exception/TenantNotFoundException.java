package org.sharehub.thumbnails.exception;

import java.util.UUID;

public class TenantNotFoundException extends AbstractThumbnailException {

    public TenantNotFoundException(UUID tenantId) {
        super("Tenant not found : " + tenantId);
    }

    @Override
    public String getError() {
        return ThumbnailException.TENANT_NOT_FOUND;
    }
}
