package com.roomsnap.collab.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SessionSettingsTest {
    @Test
    void defaults() {
        SessionSettings settings = SessionSettings.defaults();

        assertTrue(settings.isAllowEditing());
        assertFalse(settings.isRequireApproval());
        assertTrue(settings.isAutoSync());
        assertEquals(10, settings.getMaxParticipants());
        assertEquals(120, settings.getExpiresIn());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> SessionSettings.builder().maxParticipants(0));
        assertThrows(IllegalArgumentException.class, () -> SessionSettings.builder().expiresIn(-5));
    }

    @Test
    void annotationStyleFallsBackToParticipantDefaults() {
        AnnotationStyle custom = new AnnotationStyle(null, 20, null);

        AnnotationStyle merged = custom.withDefaults(AnnotationStyle.defaultFor("#96CEB4"));

        assertEquals(new AnnotationStyle("#96CEB4", 20, AnnotationStyle.DEFAULT_STROKE_WIDTH), merged);
    }

    @Test
    void identityNeedsAUserId() {
        assertEquals("participant_u1", new UserIdentity("u1", "Ann").participantId());
        assertThrows(IllegalArgumentException.class, () -> new UserIdentity("", "Ann"));
    }
}
