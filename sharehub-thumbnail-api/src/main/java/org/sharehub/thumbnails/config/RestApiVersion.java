package org.sharehub.thumbnails.config;

public interface RestApiVersion {

    String API_VERSION = "v1";
    String API_PREFIX = "/api/" + API_VERSION;

    String ENDPOINT_THUMBNAILS = "/thumbnails";
    String ENDPOINT_QUOTA = ENDPOINT_THUMBNAILS + "/quota";
    String ENDPOINT_WEBHOOKS = "/webhooks";
    String ENDPOINT_MAINTENANCE = "/maintenance";
}
