package org.sharehub.thumbnails.entity;

public interface SqlTableMapping {
    String TENANTS = "tenants";
    String EVENTS = "events";
    String SLIDES = "slides";
    String CONVERSION_JOBS = "conversion_jobs";
    String THUMBNAIL_FAILURE_LOG = "thumbnail_failure_log";
}
