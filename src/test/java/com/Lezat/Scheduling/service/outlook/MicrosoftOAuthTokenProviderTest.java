package com.Lezat.Scheduling.service.outlook;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class MicrosoftOAuthTokenProviderTest {

    private final MicrosoftOAuthTokenProvider provider = new MicrosoftOAuthTokenProvider();

    @BeforeEach
    void configure() {
        ReflectionTestUtils.setField(provider, "authority", "https://login.microsoftonline.com/");
        ReflectionTestUtils.setField(provider, "tenantId", "common");
    }

    @Test
    void storedAccessTokenIsUsedAsIs() {
        var settings = new IntegrationSettings.OutlookCalendarSettings("stored", "refresh", null, null, null);

        assertEquals("stored", provider.accessToken(settings));
    }

    @Test
    void tokenEndpointUsesTheUsersTenant() {
        var own = new IntegrationSettings.OutlookCalendarSettings(null, "r", null, null, "contoso.onmicrosoft.com");
        var none = new IntegrationSettings.OutlookCalendarSettings(null, "r", null, null, " ");

        assertEquals("https://login.microsoftonline.com/contoso.onmicrosoft.com/oauth2/v2.0/token", provider.tokenUri(own));
        assertEquals("https://login.microsoftonline.com/common/oauth2/v2.0/token", provider.tokenUri(none));
    }

    @Test
    void refreshNeedsTokenAndClientCredentials() {
        var appClient = new IntegrationSettings.OutlookCalendarSettings(null, "refresh", null, null, null);

        assertFalse(provider.canRefresh(appClient));
        assertTrue(provider.canRefresh(new IntegrationSettings.OutlookCalendarSettings(null, "refresh", "id", "secret", null)));

        ReflectionTestUtils.setField(provider, "clientId", "app-id");
        ReflectionTestUtils.setField(provider, "clientSecret", "app-secret");
        assertTrue(provider.canRefresh(appClient));
    }

    @Test
    void missingAccessTokenWithoutRefreshFlowFails() {
        var settings = new IntegrationSettings.OutlookCalendarSettings(null, null, null, null, null);

        DispatchException e = assertThrows(DispatchException.class, () -> provider.accessToken(settings));
        assertTrue(e.getMessage().contains("not configured"));
        assertTrue(MicrosoftOAuthTokenProvider.SCOPE.contains("Calendars.ReadWrite"));
    }
}
