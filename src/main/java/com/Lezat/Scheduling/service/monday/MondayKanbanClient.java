package com.Lezat.Scheduling.service.monday;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.service.dispatch.KanbanDestination;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.util.JsonPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Creates one item per task on a monday.com board through the GraphQL API. */
public class MondayKanbanClient implements KanbanDestination {

    static final String CREATE_ITEM = """
            mutation ($board_id: ID!, $group_id: String, $item_name: String!, $column_values: JSON) {
              create_item(board_id: $board_id, group_id: $group_id, item_name: $item_name, column_values: $column_values) {
                id
              }
            }
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http;
    private final IntegrationSettings.MondaySettings settings;
    private final String apiUrl;
    private final Duration timeout;

    public MondayKanbanClient(HttpClient http, IntegrationSettings.MondaySettings settings, String apiUrl, Duration timeout) {
        this.http = http;
        this.settings = settings;
        this.apiUrl = apiUrl;
        this.timeout = timeout;
    }

    @Override
    public ActionItemCreation.DestinationKind kind() {
        return ActionItemCreation.DestinationKind.MONDAY;
    }

    @Override
    public String createCard(ExtractedTask task, String meetingId) {
        ObjectNode variables = mapper.createObjectNode();
        variables.put("board_id", settings.boardId());
        if (settings.groupId() != null) variables.put("group_id", settings.groupId());
        variables.put("item_name", truncate(task.title(), 255));
        try {
            variables.put("column_values", mapper.writeValueAsString(columnValues(task, meetingId)));
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not serialize monday column values", e);
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("query", CREATE_ITEM);
        body.set("variables", variables);

        JsonNode data = post(body);
        String id = JsonPaths.blankToNull(data.path("create_item").path("id").asText(null));
        if (id == null) throw new DispatchException("monday create_item response missing id");
        return id;
    }

    ObjectNode columnValues(ExtractedTask task, String meetingId) {
        ObjectNode values = mapper.createObjectNode();
        if (settings.statusColumnId() != null && settings.todoLabel() != null) {
            values.putObject(settings.statusColumnId()).put("label", settings.todoLabel());
        }
        if (settings.dateColumnId() != null && task.dueDate() != null) {
            values.putObject(settings.dateColumnId()).put("date", task.dueDate().toString());
        }
        String details = details(task);
        if (settings.detailsColumnId() != null && details != null) {
            values.putObject(settings.detailsColumnId()).put("text", truncate(details, 2000));
        }
        if (settings.meetingIdColumnId() != null) {
            values.put(settings.meetingIdColumnId(), meetingId);
        }
        return values;
    }

    private JsonNode post(JsonNode body) {
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Authorization", settings.token())
                    .header("API-Version", "2024-01")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("monday request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("monday connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("monday call interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("monday HTTP " + resp.statusCode() + ": " + resp.body());
        }
        JsonNode root;
        try {
            root = mapper.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new DispatchException("monday returned invalid JSON", e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new DispatchException("monday GraphQL error: " + errors);
        }
        return root.path("data");
    }

    private static String details(ExtractedTask task) {
        List<String> parts = new ArrayList<>();
        if (task.details() != null) parts.add(task.details());
        String assignee = task.assigneeName() != null ? task.assigneeName() : task.assigneeEmail();
        if (assignee != null) parts.add("Assignee: " + assignee);
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
