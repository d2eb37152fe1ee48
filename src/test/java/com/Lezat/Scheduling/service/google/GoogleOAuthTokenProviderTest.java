package com.Lezat.Scheduling.service.google;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class GoogleOAuthTokenProviderTest {

    private final GoogleOAuthTokenProvider provider = new GoogleOAuthTokenProvider();

    @Test
    void storedAccessTokenIsUsedAsIs() {
        var settings = new IntegrationSettings.GoogleCalendarSettings("stored", "refresh", "primary", null, null);

        assertEquals("stored", provider.accessToken(settings));
    }

    @Test
    void refreshNeedsTokenAndClientCredentials() {
        var noRefresh = new IntegrationSettings.GoogleCalendarSettings(null, " ", "primary", "id", "secret");
        var ownClient = new IntegrationSettings.GoogleCalendarSettings(null, "refresh", "primary", "id", "secret");
        var appClient = new IntegrationSettings.GoogleCalendarSettings(null, "refresh", "primary", null, null);

        assertFalse(provider.canRefresh(noRefresh));
        assertTrue(provider.canRefresh(ownClient));
        assertFalse(provider.canRefresh(appClient));

        ReflectionTestUtils.setField(provider, "clientId", "app-id");
        ReflectionTestUtils.setField(provider, "clientSecret", "app-secret");
        assertTrue(provider.canRefresh(appClient));
    }

    @Test
    void missingAccessTokenWithoutRefreshFlowFails() {
        var settings = new IntegrationSettings.GoogleCalendarSettings(null, null, "primary", null, null);

        DispatchException ex = assertThrows(DispatchException.class, () -> provider.accessToken(settings));
        assertTrue(ex.getMessage().contains("not configured"));
    }
}
