package com.Lezat.Scheduling.service.google;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.dispatch.CalendarDestination;
import com.Lezat.Scheduling.service.dispatch.CalendarEvent;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.extraction.OnlineMeetingPlatform;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.util.JsonPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Google Calendar for one user. Built per request by the destination resolver.
 */
@Slf4j
public class GoogleCalendarClient implements CalendarDestination {

    public static final String NAME = "google_calendar";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http;
    private final IntegrationSettings.GoogleCalendarSettings settings;
    private final TokenProvider tokenProvider;
    private final String apiBase;
    private final Duration timeout;
    private String accessToken;

    public GoogleCalendarClient(HttpClient http, IntegrationSettings.GoogleCalendarSettings settings,
                                TokenProvider tokenProvider, String apiBase, Duration timeout) {
        this.http = http;
        this.settings = settings;
        this.tokenProvider = tokenProvider;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CalendarEvent createEvent(ExtractedTask task, String meetingId, ZoneId zone, Set<String> attendeeEmails) {
        if (task.dueDate() == null) {
            throw new DispatchException("Action item has no due date");
        }
        Set<String> attendees = attendeeEmails == null ? Set.of() : attendeeEmails;
        String query = eventsQuery(task, attendees);
        String body;
        try {
            body = mapper.writeValueAsString(eventPayload(task, meetingId, zone, attendees));
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not serialize calendar event", e);
        }
        if (accessToken == null) {
            accessToken = tokenProvider.accessToken(settings);
        }
        HttpResponse<String> resp = post(query, body);
        if (resp.statusCode() == 401 && tokenProvider.canRefresh(settings)) {
            accessToken = tokenProvider.refreshAccessToken(settings);
            resp = post(query, body);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("Google Calendar HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            JsonNode node = mapper.readTree(resp.body());
            String id = JsonPaths.blankToNull(node.path("id").asText(null));
            if (id == null) throw new DispatchException("Google Calendar response missing event id");
            String link = meetLink(node);
            if (link == null && wantsMeet(task)) {
                log.warn("Google Calendar: event {} for meeting {} has no Meet link", id, meetingId);
            }
            return new CalendarEvent(id, link);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Google Calendar returned invalid JSON", e);
        }
    }

    ObjectNode eventPayload(ExtractedTask task, String meetingId, ZoneId zone, Set<String> attendeeEmails) {
        LocalDate due = task.dueDate();
        ObjectNode event = mapper.createObjectNode();
        event.put("summary", truncate(task.title(), 500));
        event.put("description", description(task, meetingId));
        ObjectNode start = event.putObject("start");
        start.put("date", due.toString());
        start.put("timeZone", zone.getId());
        ObjectNode end = event.putObject("end");
        end.put("date", due.plusDays(1).toString());
        end.put("timeZone", zone.getId());
        if (!attendeeEmails.isEmpty()) {
            ArrayNode attendees = event.putArray("attendees");
            attendeeEmails.stream().sorted().forEach(email -> attendees.addObject().put("email", email));
        }
        if (wantsMeet(task)) {
            ObjectNode createRequest = event.putObject("conferenceData").putObject("createRequest");
            createRequest.put("requestId", "lezat-" + UUID.randomUUID());
            createRequest.putObject("conferenceSolutionKey").put("type", "hangoutsMeet");
        }
        return event;
    }

    static String eventsQuery(ExtractedTask task, Set<String> attendeeEmails) {
        List<String> params = new ArrayList<>();
        if (wantsMeet(task)) params.add("conferenceDataVersion=1");
        if (!attendeeEmails.isEmpty()) params.add("sendUpdates=all");
        return params.isEmpty() ? "" : "?" + String.join("&", params);
    }

    static String meetLink(JsonNode event) {
        String hangout = JsonPaths.blankToNull(event.path("hangoutLink").asText(null));
        if (hangout != null) return hangout;
        for (JsonNode entryPoint : event.path("conferenceData").path("entryPoints")) {
            String uri = JsonPaths.blankToNull(entryPoint.path("uri").asText(null));
            if (uri != null) return uri;
        }
        return null;
    }

    private static boolean wantsMeet(ExtractedTask task) {
        return task.onlineMeetingPlatform() == OnlineMeetingPlatform.GOOGLE_MEET
                || task.onlineMeetingPlatform() == OnlineMeetingPlatform.AUTO;
    }

    private String description(ExtractedTask task, String meetingId) {
        List<String> lines = new ArrayList<>();
        if (task.details() != null) lines.add(task.details());
        if (task.sourceSentence() != null) lines.add("Evidence: " + task.sourceSentence());
        String assignee = task.assigneeName() != null ? task.assigneeName() : task.assigneeEmail();
        if (assignee != null) lines.add("Assignee: " + assignee);
        lines.add("Meeting ID: " + meetingId);
        return truncate(String.join("\n", lines), 8000);
    }

    private HttpResponse<String> post(String query, String body) {
        String calendarId = URLEncoder.encode(settings.calendarId(), StandardCharsets.UTF_8);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/calendars/" + calendarId + "/events" + query))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + accessToken)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Google Calendar request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("Google Calendar connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Google Calendar call interrupted", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
