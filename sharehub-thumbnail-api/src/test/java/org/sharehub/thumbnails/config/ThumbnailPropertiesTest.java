package org.sharehub.thumbnails.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ThumbnailPropertiesTest {

    @Test
    void defaults_matchDocumentedValues() {
        ThumbnailProperties props = new ThumbnailProperties();

        assertEquals(Duration.ofHours(1), props.getSignedUrlTtl());
        assertEquals("/admin/settings/billing?upgrade=thumbnail-quota", props.getUpgradeUrl());
        assertEquals(30, props.getSweep().getLookBackDays());
        assertEquals(10, props.getSweep().getMaxPerTenant());
        assertEquals(50, props.getSweep().getMaxPerRun());
        assertEquals(Duration.ofSeconds(2), props.getSweep().getDelay());
        assertEquals(24, props.getFailure().getWindowHours());
        assertEquals(3, props.getFailure().getNotificationThreshold());
    }

    @Test
    void validate_withDefaultValues_noException() {
        assertDoesNotThrow(new ThumbnailProperties()::validate);
    }

    @Test
    void validate_withZeroTtl_throwsException() {
        ThumbnailProperties props = new ThumbnailProperties();
        props.setSignedUrlTtl(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_withZeroMaxPerRun_throwsException() {
        ThumbnailProperties props = new ThumbnailProperties();
        props.getSweep().setMaxPerRun(0);
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_withNegativeDelay_throwsException() {
        ThumbnailProperties props = new ThumbnailProperties();
        props.getSweep().setDelay(Duration.ofSeconds(-1));
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_withZeroDelay_noException() {
        ThumbnailProperties props = new ThumbnailProperties();
        props.getSweep().setDelay(Duration.ZERO);
        assertDoesNotThrow(props::validate);
    }

    @Test
    void validate_withZeroThreshold_throwsException() {
        ThumbnailProperties props = new ThumbnailProperties();
        props.getFailure().setNotificationThreshold(0);
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void thumbnailKey_isScopedByTenantAndEvent() {
        ThumbnailProperties props = new ThumbnailProperties();
        UUID tenantId = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID eventId = UUID.fromString("00000000-0000-0000-0000-000000000002");
        UUID slideId = UUID.fromString("00000000-0000-0000-0000-000000000003");

        assertEquals("tenants/" + tenantId + "/events/" + eventId + "/thumbnails/" + slideId + "-thumbnail.jpg",
                props.thumbnailKey(tenantId, eventId, slideId));
    }
}
