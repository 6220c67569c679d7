package org.sharehub.thumbnails.repository.impl;

import lombok.RequiredArgsConstructor;
import org.sharehub.thumbnails.entity.ConversionJob;
import org.sharehub.thumbnails.enums.JobStatus;
import org.sharehub.thumbnails.repository.ConversionJobDAO;
import org.sharehub.thumbnails.repository.ConversionJobRepository;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.CONVERSION_JOBS;

@Service
@RequiredArgsConstructor
public class ConversionJobDAOImpl implements ConversionJobDAO {

    // webhook_received_at doubles as the terminal flag: only the first caller updates a row
    public static final String MARK_TERMINAL = "UPDATE " + CONVERSION_JOBS +
            " SET " + STATUS + " = :status, " + ERROR_MESSAGE + " = :error, " +
            COMPLETED_AT + " = :at, " + WEBHOOK_RECEIVED_AT + " = :at" +
            " WHERE " + ID + " = :id AND " + WEBHOOK_RECEIVED_AT + " IS NULL";

    private final ConversionJobRepository conversionJobRepository;
    private final DatabaseClient databaseClient;

    @Override
    public Mono<ConversionJob> create(ConversionJob job) {
        return conversionJobRepository.save(job);
    }

    @Override
    public Mono<ConversionJob> findByExternalId(String externalJobId) {
        return conversionJobRepository.findByExternalJobId(externalJobId);
    }

    @Override
    public Mono<ConversionJob> findOpenBySlideId(UUID slideId) {
        return conversionJobRepository.findBySlideIdOrderByStartedAtDesc(slideId)
                .filter(job -> !job.isWebhookReceived())
                .next();
    }

    @Override
    public Mono<Boolean> markTerminal(UUID jobId, JobStatus status, String errorMessage, OffsetDateTime at) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(MARK_TERMINAL)
                .bind("status", status.name())
                .bind("at", at)
                .bind(ID, jobId);
        spec = errorMessage == null ? spec.bindNull("error", String.class) : spec.bind("error", errorMessage);
        return spec.fetch()
                .rowsUpdated()
                .map(rows -> rows > 0);
    }
}
