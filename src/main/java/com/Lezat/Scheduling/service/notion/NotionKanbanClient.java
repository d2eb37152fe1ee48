package com.Lezat.Scheduling.service.notion;

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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Creates one page per task in a Notion database. Only properties that exist in the database
 * schema are written, using whatever type the schema declares for them.
 */
public class NotionKanbanClient implements KanbanDestination {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http;
    private final IntegrationSettings.NotionSettings settings;
    private final String apiBase;
    private final String apiVersion;
    private final Duration timeout;
    private JsonNode databaseProperties;

    public NotionKanbanClient(HttpClient http, IntegrationSettings.NotionSettings settings,
                              String apiBase, String apiVersion, Duration timeout) {
        this.http = http;
        this.settings = settings;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.apiVersion = apiVersion;
        this.timeout = timeout;
    }

    @Override
    public ActionItemCreation.DestinationKind kind() {
        return ActionItemCreation.DestinationKind.NOTION;
    }

    @Override
    public String createCard(ExtractedTask task, String meetingId) {
        ObjectNode body = mapper.createObjectNode();
        body.putObject("parent").put("database_id", settings.databaseId());
        body.set("properties", pageProperties(task, meetingId, databaseProperties()));

        JsonNode created = send("POST", "/pages", body);
        String id = JsonPaths.blankToNull(created.path("id").asText(null));
        if (id == null) throw new DispatchException("Notion response missing page id");
        return id;
    }

    ObjectNode pageProperties(ExtractedTask task, String meetingId, JsonNode schema) {
        ObjectNode props = mapper.createObjectNode();
        String titleProperty = titlePropertyName(schema);
        if (titleProperty == null) {
            throw new DispatchException("Notion database has no title property");
        }
        props.putObject(titleProperty).set("title", richText(truncate(task.title(), 2000)));

        String statusType = schema.path(settings.statusProperty()).path("type").asText("");
        if (statusType.equals("status") || statusType.equals("select")) {
            props.putObject(settings.statusProperty()).putObject(statusType).put("name", settings.todoStatus());
        }
        if (task.dueDate() != null) {
            String dueType = schema.path(settings.dueDateProperty()).path("type").asText("");
            if (dueType.equals("date")) {
                props.putObject(settings.dueDateProperty()).putObject("date").put("start", task.dueDate().toString());
            } else if (dueType.equals("rich_text")) {
                props.putObject(settings.dueDateProperty()).set("rich_text", richText(task.dueDate().toString()));
            }
        }
        setRichText(props, schema, settings.detailsProperty(), details(task));
        setRichText(props, schema, settings.meetingIdProperty(), meetingId);
        return props;
    }

    private String titlePropertyName(JsonNode schema) {
        if (settings.titleProperty() != null && schema.path(settings.titleProperty()).path("type").asText("").equals("title")) {
            return settings.titleProperty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = schema.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if ("title".equals(f.getValue().path("type").asText())) return f.getKey();
        }
        return null;
    }

    private void setRichText(ObjectNode props, JsonNode schema, String property, String value) {
        if (value == null || property == null) return;
        if ("rich_text".equals(schema.path(property).path("type").asText())) {
            props.putObject(property).set("rich_text", richText(truncate(value, 2000)));
        }
    }

    private JsonNode richText(String content) {
        return mapper.createArrayNode().add(mapper.createObjectNode().set("text", mapper.createObjectNode().put("content", content)));
    }

    private static String details(ExtractedTask task) {
        List<String> parts = new ArrayList<>();
        if (task.details() != null) parts.add(task.details());
        String assignee = task.assigneeName() != null ? task.assigneeName() : task.assigneeEmail();
        if (assignee != null) parts.add("Assignee: " + assignee);
        if (task.sourceSentence() != null) parts.add("Evidence: " + task.sourceSentence());
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private JsonNode databaseProperties() {
        if (databaseProperties == null) {
            databaseProperties = send("GET", databasePath(settings.databaseId()), null).path("properties");
        }
        return databaseProperties;
    }

    static String databasePath(String databaseId) {
        return "/databases/" + URLEncoder.encode(databaseId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode send(String method, String path, JsonNode body) {
        HttpResponse<String> resp;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + path))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + settings.token())
                    .header("Notion-Version", apiVersion)
                    .header("Content-Type", "application/json");
            if (body == null) {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                builder.method(method, HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
            }
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Notion request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("Notion connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Notion call interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("Notion HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            return mapper.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new DispatchException("Notion returned invalid JSON", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
