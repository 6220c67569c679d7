package org.sharehub.thumbnails.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.sharehub.thumbnails.enums.FailureType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.THUMBNAIL_FAILURE_LOG;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(THUMBNAIL_FAILURE_LOG)
public class ThumbnailFailureLog {

    @Id
    @Column(ID)
    private UUID id;

    @Column(TENANT_ID)
    private UUID tenantId;

    @Column(EVENT_ID)
    private UUID eventId;

    @Column(SLIDE_ID)
    private UUID slideId;

    @Column(ERROR_TYPE)
    private FailureType errorType;

    @Column(ERROR_MESSAGE)
    private String errorMessage;

    @Column(OCCURRED_AT)
    private OffsetDateTime occurredAt;
}
