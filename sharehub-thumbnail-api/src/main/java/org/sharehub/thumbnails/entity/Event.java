package org.sharehub.thumbnails.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.EVENTS;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(EVENTS)
public class Event {

    @Id
    @Column(ID)
    private UUID id;

    @Column(TENANT_ID)
    private UUID tenantId;

    @Column(NAME)
    private String name;

    @Column(THUMBNAIL_GENERATION_ENABLED)
    private boolean thumbnailGenerationEnabled;

    @Column(CREATED_AT)
    private OffsetDateTime createdAt;
}
