package com.Lezat.Scheduling.service.google;

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

class GoogleCalendarClientTest {

    private final TokenProvider tokenProvider = mock(TokenProvider.class);
    private final GoogleCalendarClient client = new GoogleCalendarClient(HttpClient.newHttpClient(),
            new IntegrationSettings.GoogleCalendarSettings("access", null, "primary", null, null),
            tokenProvider, "https://www.googleapis.com/calendar/v3", Duration.ofSeconds(10));

    @Test
    void allDayEventOnDueDate() {
        ExtractedTask task = new ExtractedTask("Send deck", "v2", "ana@x.com", null, LocalDate.parse("2024-01-10"), "Ana: by Wednesday");

        ObjectNode event = client.eventPayload(task, "m1", ZoneId.of("America/Bogota"), Set.of());

        assertEquals("Send deck", event.get("summary").asText());
        assertEquals("2024-01-10", event.at("/start/date").asText());
        assertEquals("2024-01-11", event.at("/end/date").asText());
        assertEquals("America/Bogota", event.at("/start/timeZone").asText());
        String description = event.get("description").asText();
        assertTrue(description.contains("Evidence: Ana: by Wednesday"));
        assertTrue(description.contains("Assignee: ana@x.com"));
        assertTrue(description.endsWith("Meeting ID: m1"));
        assertFalse(event.has("attendees"));
        assertFalse(event.has("conferenceData"));
        assertEquals("", GoogleCalendarClient.eventsQuery(task, Set.of()));
    }

    @Test
    void googleMeetItemRequestsConferenceAndInvitesAttendees() {
        ExtractedTask task = new ExtractedTask("Weekly sync", null, null, null, LocalDate.parse("2024-01-12"), null,
                OnlineMeetingPlatform.GOOGLE_MEET);
        Set<String> attendees = Set.of("bob@x.com", "ana@x.com");

        ObjectNode event = client.eventPayload(task, "m1", ZoneId.of("UTC"), attendees);

        assertEquals("ana@x.com", event.at("/attendees/0/email").asText());
        assertEquals("bob@x.com", event.at("/attendees/1/email").asText());
        assertEquals("hangoutsMeet", event.at("/conferenceData/createRequest/conferenceSolutionKey/type").asText());
        assertTrue(event.at("/conferenceData/createRequest/requestId").asText().startsWith("lezat-"));
        assertEquals("?conferenceDataVersion=1&sendUpdates=all", GoogleCalendarClient.eventsQuery(task, attendees));
    }

    @Test
    void teamsItemGetsNoMeetConference() {
        ExtractedTask task = new ExtractedTask("Demo", null, null, null, LocalDate.parse("2024-01-12"), null,
                OnlineMeetingPlatform.MICROSOFT_TEAMS);

        assertFalse(client.eventPayload(task, "m1", ZoneId.of("UTC"), Set.of()).has("conferenceData"));
    }

    @Test
    void meetLinkFromHangoutOrEntryPoints() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("https://meet.google.com/aaa",
                GoogleCalendarClient.meetLink(mapper.readTree("{\"hangoutLink\":\"https://meet.google.com/aaa\"}")));
        assertEquals("https://meet.google.com/bbb", GoogleCalendarClient.meetLink(mapper.readTree(
                "{\"conferenceData\":{\"entryPoints\":[{\"entryPointType\":\"video\",\"uri\":\"https://meet.google.com/bbb\"}]}}")));
        assertNull(GoogleCalendarClient.meetLink(mapper.readTree("{\"id\":\"e1\"}")));
    }

    @Test
    void refusesTasksWithoutDueDate() {
        assertThrows(DispatchException.class, () -> client.createEvent(
                new ExtractedTask("x", null, null, null, null, null), "m1", ZoneId.of("UTC"), Set.of()));
        verifyNoInteractions(tokenProvider);
        assertEquals("google_calendar", client.name());
    }

    @Test
    void malformedApiBaseIsADispatchFailure() {
        GoogleCalendarClient broken = new GoogleCalendarClient(HttpClient.newHttpClient(),
                new IntegrationSettings.GoogleCalendarSettings("access", null, "primary", null, null),
                tokenProvider, "http://bad host/calendar/v3", Duration.ofSeconds(10));
        ExtractedTask task = new ExtractedTask("Send deck", null, null, null, LocalDate.parse("2024-01-10"), null);

        assertThrows(DispatchException.class, () -> broken.createEvent(task, "m1", ZoneId.of("UTC"), Set.of()));
    }
}
