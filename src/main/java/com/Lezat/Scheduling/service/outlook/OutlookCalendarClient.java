package com.Lezat.Scheduling.service.outlook;

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
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Outlook calendar for one user through Microsoft Graph. Events take the 09:00-10:00 slot of the
 * due date in the user's time zone.
 */
@Slf4j
public class OutlookCalendarClient implements CalendarDestination {

    public static final String NAME = "outlook_calendar";

    static final LocalTime SLOT_START = LocalTime.of(9, 0);
    static final LocalTime SLOT_END = LocalTime.of(10, 0);

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http;
    private final IntegrationSettings.OutlookCalendarSettings settings;
    private final OutlookTokenProvider tokenProvider;
    private final String apiBase;
    private final Duration timeout;
    private String accessToken;

    public OutlookCalendarClient(HttpClient http, IntegrationSettings.OutlookCalendarSettings settings,
                                 OutlookTokenProvider tokenProvider, String apiBase, Duration timeout) {
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
        String body;
        try {
            body = mapper.writeValueAsString(eventPayload(task, meetingId, zone,
                    attendeeEmails == null ? Set.of() : attendeeEmails));
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not serialize calendar event", e);
        }
        JsonNode created = call("POST", "/me/events", body);
        String id = JsonPaths.blankToNull(created.path("id").asText(null));
        if (id == null) throw new DispatchException("Outlook Calendar response missing event id");

        String link = teamsLink(created);
        if (link == null && wantsTeams(task)) {
            // Graph sometimes attaches the Teams meeting after the create call returns
            link = teamsLink(call("GET", "/me/events/" + URLEncoder.encode(id, StandardCharsets.UTF_8), null));
            if (link == null) {
                log.warn("Outlook Calendar: event {} for meeting {} has no Teams link", id, meetingId);
            }
        }
        return new CalendarEvent(id, link);
    }

    ObjectNode eventPayload(ExtractedTask task, String meetingId, ZoneId zone, Set<String> attendeeEmails) {
        ObjectNode event = mapper.createObjectNode();
        event.put("subject", truncate(task.title(), 255));
        ObjectNode body = event.putObject("body");
        body.put("contentType", "text");
        body.put("content", description(task, meetingId));
        ObjectNode start = event.putObject("start");
        start.put("dateTime", task.dueDate().atTime(SLOT_START).toString() + ":00");
        start.put("timeZone", zone.getId());
        ObjectNode end = event.putObject("end");
        end.put("dateTime", task.dueDate().atTime(SLOT_END).toString() + ":00");
        end.put("timeZone", zone.getId());
        if (!attendeeEmails.isEmpty()) {
            ArrayNode attendees = event.putArray("attendees");
            attendeeEmails.stream().sorted().forEach(email -> {
                ObjectNode attendee = attendees.addObject();
                attendee.putObject("emailAddress").put("address", email);
                attendee.put("type", "required");
            });
        }
        if (wantsTeams(task)) {
            event.put("isOnlineMeeting", true);
            event.put("onlineMeetingProvider", "teamsForBusiness");
        }
        return event;
    }

    static String teamsLink(JsonNode event) {
        String joinUrl = JsonPaths.blankToNull(event.path("onlineMeeting").path("joinUrl").asText(null));
        if (joinUrl != null) return joinUrl;
        return JsonPaths.blankToNull(event.path("onlineMeetingUrl").asText(null));
    }

    private static boolean wantsTeams(ExtractedTask task) {
        return task.onlineMeetingPlatform() == OnlineMeetingPlatform.MICROSOFT_TEAMS
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

    private JsonNode call(String method, String path, String body) {
        if (accessToken == null) {
            accessToken = tokenProvider.accessToken(settings);
        }
        HttpResponse<String> resp = send(method, path, body);
        if (resp.statusCode() == 401 && tokenProvider.canRefresh(settings)) {
            accessToken = tokenProvider.refreshAccessToken(settings);
            resp = send(method, path, body);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("Outlook Calendar HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            return mapper.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new DispatchException("Outlook Calendar returned invalid JSON", e);
        }
    }

    private HttpResponse<String> send(String method, String path, String body) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + path))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + accessToken)
                    .header("Content-Type", "application/json");
            if (body == null) {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                builder.method(method, HttpRequest.BodyPublishers.ofString(body));
            }
            return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Outlook Calendar request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("Outlook Calendar connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Outlook Calendar call interrupted", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
