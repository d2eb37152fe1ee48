package com.Lezat.Scheduling.service.outlook;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.extraction.OnlineMeetingPlatform;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OutlookCalendarClientTest {

    private final OutlookTokenProvider tokenProvider = mock(OutlookTokenProvider.class);
    private final IntegrationSettings.OutlookCalendarSettings settings =
            new IntegrationSettings.OutlookCalendarSettings("access", null, null, null, null);
    private final OutlookCalendarClient client = new OutlookCalendarClient(HttpClient.newHttpClient(), settings,
            tokenProvider, "https://graph.microsoft.com/v1.0/", Duration.ofSeconds(10));

    @Test
    void morningSlotOnDueDate() {
        ExtractedTask task = new ExtractedTask("Send deck", "v2", null, "Ana", LocalDate.parse("2024-01-10"), null);

        ObjectNode event = client.eventPayload(task, "m1", ZoneId.of("America/Bogota"), Set.of());

        assertEquals("Send deck", event.get("subject").asText());
        assertEquals("text", event.at("/body/contentType").asText());
        assertTrue(event.at("/body/content").asText().contains("Assignee: Ana"));
        assertEquals("2024-01-10T09:00:00", event.at("/start/dateTime").asText());
        assertEquals("2024-01-10T10:00:00", event.at("/end/dateTime").asText());
        assertEquals("America/Bogota", event.at("/end/timeZone").asText());
        assertFalse(event.has("attendees"));
        assertFalse(event.has("isOnlineMeeting"));
        assertEquals("outlook_calendar", client.name());
    }

    @Test
    void teamsItemIsAnOnlineMeetingWithRequiredAttendees() {
        ExtractedTask task = new ExtractedTask("Demo " + "x".repeat(300), null, null, null, LocalDate.parse("2024-01-12"), null,
                OnlineMeetingPlatform.MICROSOFT_TEAMS);

        ObjectNode event = client.eventPayload(task, "m1", ZoneId.of("UTC"), Set.of("bob@x.com", "ana@x.com"));

        assertEquals(255, event.get("subject").asText().length());
        assertTrue(event.get("isOnlineMeeting").asBoolean());
        assertEquals("ana@x.com", event.at("/attendees/0/emailAddress/address").asText());
        assertEquals("required", event.at("/attendees/0/type").asText());
        assertEquals("bob@x.com", event.at("/attendees/1/emailAddress/address").asText());
    }

    @Test
    void googleMeetItemIsNotATeamsMeeting() {
        ExtractedTask task = new ExtractedTask("Sync", null, null, null, LocalDate.parse("2024-01-12"), null,
                OnlineMeetingPlatform.GOOGLE_MEET);

        assertFalse(client.eventPayload(task, "m1", ZoneId.of("UTC"), Set.of()).has("isOnlineMeeting"));
    }

    @Test
    void teamsLinkFromJoinUrlOrLegacyField() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("https://teams.microsoft.com/l/a", OutlookCalendarClient.teamsLink(
                mapper.readTree("{\"onlineMeeting\":{\"joinUrl\":\"https://teams.microsoft.com/l/a\"}}")));
        assertEquals("https://teams.microsoft.com/l/b", OutlookCalendarClient.teamsLink(
                mapper.readTree("{\"onlineMeeting\":null,\"onlineMeetingUrl\":\"https://teams.microsoft.com/l/b\"}")));
        assertNull(OutlookCalendarClient.teamsLink(mapper.readTree("{\"id\":\"AAMk\"}")));
    }

    @Test
    void refusesTasksWithoutDueDate() {
        assertThrows(DispatchException.class, () -> client.createEvent(
                new ExtractedTask("x", null, null, null, null, null), "m1", ZoneId.of("UTC"), Set.of()));
        verifyNoInteractions(tokenProvider);
    }

    @Test
    void malformedApiBaseIsADispatchFailure() {
        when(tokenProvider.accessToken(settings)).thenReturn("access");
        OutlookCalendarClient broken = new OutlookCalendarClient(HttpClient.newHttpClient(), settings,
                tokenProvider, "http://bad host/v1.0", Duration.ofSeconds(10));
        ExtractedTask task = new ExtractedTask("Send deck", null, null, null, LocalDate.parse("2024-01-10"), null);

        DispatchException e = assertThrows(DispatchException.class,
                () -> broken.createEvent(task, "m1", ZoneId.of("UTC"), Set.of()));
        assertTrue(e.getMessage().startsWith("Outlook Calendar request is invalid"));
    }
}
