package org.sharehub.thumbnails.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sharehub.thumbnails.config.ThumbnailProperties;
import org.sharehub.thumbnails.entity.ThumbnailFailureLog;
import org.sharehub.thumbnails.enums.FailureType;
import org.sharehub.thumbnails.repository.FailureLogRepository;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FailureLogServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private FailureLogRepository failureLogRepository;

    private ThumbnailProperties thumbnailProperties;
    private FailureLogServiceImpl service;

    @BeforeEach
    void setUp() {
        thumbnailProperties = new ThumbnailProperties();
        service = new FailureLogServiceImpl(failureLogRepository, thumbnailProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_savesEntryStampedWithCurrentTime() {
        UUID tenantId = UUID.randomUUID();
        UUID eventId = UUID.randomUUID();
        UUID slideId = UUID.randomUUID();
        when(failureLogRepository.save(any(ThumbnailFailureLog.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(service.record(tenantId, eventId, slideId, FailureType.EXTERNAL_CONVERSION_ERROR, "Corrupt file"))
                .verifyComplete();

        ArgumentCaptor<ThumbnailFailureLog> captor = ArgumentCaptor.forClass(ThumbnailFailureLog.class);
        verify(failureLogRepository).save(captor.capture());
        ThumbnailFailureLog saved = captor.getValue();
        assertEquals(tenantId, saved.getTenantId());
        assertEquals(eventId, saved.getEventId());
        assertEquals(slideId, saved.getSlideId());
        assertEquals(FailureType.EXTERNAL_CONVERSION_ERROR, saved.getErrorType());
        assertEquals("Corrupt file", saved.getErrorMessage());
        assertEquals(NOW_UTC, saved.getOccurredAt());
    }

    @Test
    void record_withoutMessage_storesPlaceholder() {
        when(failureLogRepository.save(any(ThumbnailFailureLog.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        service.record(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), FailureType.THUMBNAIL_STORAGE_ERROR, null).block();

        ArgumentCaptor<ThumbnailFailureLog> captor = ArgumentCaptor.forClass(ThumbnailFailureLog.class);
        verify(failureLogRepository).save(captor.capture());
        assertEquals("Unknown error", captor.getValue().getErrorMessage());
    }

    @Test
    void record_whenWriteFails_completesWithoutError() {
        when(failureLogRepository.save(any(ThumbnailFailureLog.class))).thenReturn(Mono.error(new RuntimeException("db down")));

        StepVerifier.create(service.record(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                        FailureType.EXTERNAL_SUBMISSION_ERROR, "timeout"))
                .verifyComplete();
    }

    @Test
    void consecutiveFailureCount_countsOverTrailingWindow() {
        UUID eventId = UUID.randomUUID();
        when(failureLogRepository.countByEventIdAndOccurredAtGreaterThanEqual(eventId, NOW_UTC.minusHours(24)))
                .thenReturn(Mono.just(4L));

        StepVerifier.create(service.consecutiveFailureCount(eventId))
                .expectNext(4L)
                .verifyComplete();
    }

    @Test
    void countSince_withNoRows_returnsZero() {
        UUID eventId = UUID.randomUUID();
        when(failureLogRepository.countByEventIdAndOccurredAtGreaterThanEqual(eventId, NOW_UTC)).thenReturn(Mono.empty());

        StepVerifier.create(service.countSince(eventId, NOW_UTC))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    void isNotificationThresholdReached_usesConfiguredThreshold() {
        assertFalse(service.isNotificationThresholdReached(2));
        assertTrue(service.isNotificationThresholdReached(3));
        assertTrue(service.isNotificationThresholdReached(7));

        thumbnailProperties.getFailure().setNotificationThreshold(5);
        assertFalse(service.isNotificationThresholdReached(4));
    }
}
