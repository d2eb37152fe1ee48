package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.service.google.TokenProvider;
import com.Lezat.Scheduling.service.outlook.OutlookCalendarClient;
import com.Lezat.Scheduling.service.outlook.OutlookTokenProvider;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class DestinationResolverTest {

    private final DestinationResolver resolver = new DestinationResolver(mock(TokenProvider.class),
            mock(OutlookTokenProvider.class));

    @BeforeEach
    void configure() {
        ReflectionTestUtils.setField(resolver, "notionApiBase", "https://api.notion.com/v1/");
        ReflectionTestUtils.setField(resolver, "notionApiVersion", "2022-06-28");
        ReflectionTestUtils.setField(resolver, "mondayApiUrl", "https://api.monday.com/v2");
        ReflectionTestUtils.setField(resolver, "googleCalendarApiBase", "https://www.googleapis.com/calendar/v3");
        ReflectionTestUtils.setField(resolver, "outlookApiBase", "https://graph.microsoft.com/v1.0");
    }

    @Test
    void buildsOnlyConfiguredDestinations() {
        var notion = new IntegrationSettings.NotionSettings("t", "db", null, "Status", "Due date", "Details", "Meeting ID", "Por hacer");
        var calendar = new IntegrationSettings.GoogleCalendarSettings("a", null, "primary", null, null);
        var settings = new IntegrationSettings("u1", true, ZoneId.of("UTC"), null, null, notion, null, calendar, null);

        ResolvedDestinations resolved = resolver.resolve(settings);

        assertEquals(1, resolved.kanban().size());
        assertEquals(ActionItemCreation.DestinationKind.NOTION, resolved.kanban().get(0).kind());
        assertEquals(1, resolved.calendars().size());
        assertTrue(resolved.canDispatch());
    }

    @Test
    void calendarAloneCannotDispatch() {
        var calendar = new IntegrationSettings.GoogleCalendarSettings("a", null, "primary", null, null);
        var settings = new IntegrationSettings("u1", true, ZoneId.of("UTC"), null, null, null, null, calendar, null);

        assertFalse(resolver.resolve(settings).canDispatch());
        assertFalse(resolver.resolve(IntegrationSettings.defaults("u1", ZoneId.of("UTC"))).canDispatch());
        assertFalse(resolver.resolve(null).canDispatch());
    }

    @Test
    void outlookCalendarIsAddedNextToGoogle() {
        var monday = new IntegrationSettings.MondaySettings("t", "b", null, null, null, null, null, null);
        var google = new IntegrationSettings.GoogleCalendarSettings("a", null, "primary", null, null);
        var outlook = new IntegrationSettings.OutlookCalendarSettings("o", null, null, null, null);
        var settings = new IntegrationSettings("u1", true, ZoneId.of("UTC"), null, null, null, monday, google, outlook);

        ResolvedDestinations resolved = resolver.resolve(settings);

        assertEquals(2, resolved.calendars().size());
        assertEquals(OutlookCalendarClient.NAME, resolved.calendars().get(1).name());
    }
}
