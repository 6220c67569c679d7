package org.sharehub.thumbnails.entity;

public interface SqlColumnMapping {
    String ID = "id";
    String NAME = "name";
    String TENANT_ID = "tenant_id";
    String EVENT_ID = "event_id";
    String SLIDE_ID = "slide_id";
    String CREATED_AT = "created_at";
    String UPDATED_AT = "updated_at";

    String THUMBNAIL_QUOTA_TOTAL = "thumbnail_quota_total";
    String THUMBNAIL_QUOTA_USED = "thumbnail_quota_used";

    String THUMBNAIL_GENERATION_ENABLED = "thumbnail_generation_enabled";

    String FILENAME = "filename";
    String STORAGE_KEY = "storage_key";
    String MIME_TYPE = "mime_type";
    String THUMBNAIL_STATUS = "thumbnail_status";
    String THUMBNAIL_KEY = "thumbnail_key";
    String THUMBNAIL_GENERATED_AT = "thumbnail_generated_at";
    String UPLOADED_AT = "uploaded_at";
    String DELETED_AT = "deleted_at";
    String PURGE_FAILED_AT = "purge_failed_at";

    String EXTERNAL_JOB_ID = "external_job_id";
    String STATUS = "status";
    String ERROR_MESSAGE = "error_message";
    String IDEMPOTENCY_KEY = "idempotency_key";
    String STARTED_AT = "started_at";
    String COMPLETED_AT = "completed_at";
    String WEBHOOK_RECEIVED_AT = "webhook_received_at";

    String ERROR_TYPE = "error_type";
    String OCCURRED_AT = "occurred_at";
}
