package org.sharehub.thumbnails.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.sharehub.thumbnails.enums.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.CONVERSION_JOBS;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(CONVERSION_JOBS)
public class ConversionJob {

    @Id
    @Column(ID)
    private UUID id;

    @Column(TENANT_ID)
    private UUID tenantId;

    @Column(SLIDE_ID)
    private UUID slideId;

    @Column(EXTERNAL_JOB_ID)
    private String externalJobId;

    @Column(STATUS)
    private JobStatus status;

    @Column(ERROR_MESSAGE)
    private String errorMessage;

    @Column(IDEMPOTENCY_KEY)
    private String idempotencyKey;

    @Column(STARTED_AT)
    private OffsetDateTime startedAt;

    @Column(COMPLETED_AT)
    private OffsetDateTime completedAt;

    @Column(WEBHOOK_RECEIVED_AT)
    private OffsetDateTime webhookReceivedAt;

    public boolean isWebhookReceived() {
        return webhookReceivedAt != null;
    }
}
