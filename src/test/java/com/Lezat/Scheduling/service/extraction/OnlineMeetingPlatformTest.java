package com.Lezat.Scheduling.service.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OnlineMeetingPlatformTest {

    @Test
    void detectsPlatformNames() {
        assertEquals(OnlineMeetingPlatform.GOOGLE_MEET, OnlineMeetingPlatform.detect("google_meet"));
        assertEquals(OnlineMeetingPlatform.GOOGLE_MEET, OnlineMeetingPlatform.detect("Agendar por Meet de Google"));
        assertEquals(OnlineMeetingPlatform.GOOGLE_MEET, OnlineMeetingPlatform.detect("link: https://meet.google.com/abc"));
        assertEquals(OnlineMeetingPlatform.MICROSOFT_TEAMS, OnlineMeetingPlatform.detect("Set up a MS Teams call"));
        assertEquals(OnlineMeetingPlatform.MICROSOFT_TEAMS, OnlineMeetingPlatform.detect("microsoft_teams"));
        assertEquals(OnlineMeetingPlatform.AUTO, OnlineMeetingPlatform.detect("auto"));
    }

    @Test
    void ordinaryTextHasNoPlatform() {
        assertNull(OnlineMeetingPlatform.detect("Send the proposal"));
        assertNull(OnlineMeetingPlatform.detect("Meet the marketing targets"));
        assertNull(OnlineMeetingPlatform.detect(null));
        assertNull(OnlineMeetingPlatform.detect("  "));
    }

    @Test
    void onlyNamedPlatformsAreExplicit() {
        assertTrue(OnlineMeetingPlatform.GOOGLE_MEET.isExplicit());
        assertTrue(OnlineMeetingPlatform.MICROSOFT_TEAMS.isExplicit());
        assertFalse(OnlineMeetingPlatform.AUTO.isExplicit());
        assertFalse(new ExtractedTask("x", null, null, null, null, null).isExplicitOnlineMeeting());
    }
}
