package com.Lezat.Scheduling.service.notion;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class NotionKanbanClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final IntegrationSettings.NotionSettings settings = new IntegrationSettings.NotionSettings(
            "token", "db-1", null, "Status", "Due date", "Details", "Meeting ID", "Por hacer");
    private final NotionKanbanClient client = new NotionKanbanClient(HttpClient.newHttpClient(), settings,
            "https://api.notion.com/v1", "2022-06-28", Duration.ofSeconds(10));

    private final ExtractedTask task = new ExtractedTask("Send deck", "v2 with pricing", "ana@x.com", "Ana",
            LocalDate.parse("2024-01-10"), "Ana: I'll send it");

    @Test
    void writesOnlyPropertiesTheDatabaseHas() throws Exception {
        JsonNode schema = mapper.readTree("{\"Task name\":{\"type\":\"title\"},\"Status\":{\"type\":\"select\"},"
                + "\"Due date\":{\"type\":\"date\"},\"Details\":{\"type\":\"rich_text\"}}");

        ObjectNode props = client.pageProperties(task, "m1", schema);

        assertEquals("Send deck", props.at("/Task name/title/0/text/content").asText());
        assertEquals("Por hacer", props.at("/Status/select/name").asText());
        assertEquals("2024-01-10", props.at("/Due date/date/start").asText());
        assertTrue(props.at("/Details/rich_text/0/text/content").asText().contains("Assignee: Ana"));
        assertFalse(props.has("Meeting ID"));
        assertEquals(ActionItemCreation.DestinationKind.NOTION, client.kind());
    }

    @Test
    void statusTypeAndMeetingIdFollowSchema() throws Exception {
        JsonNode schema = mapper.readTree("{\"Name\":{\"type\":\"title\"},\"Status\":{\"type\":\"status\"},"
                + "\"Meeting ID\":{\"type\":\"rich_text\"}}");

        ObjectNode props = client.pageProperties(task, "m1", schema);

        assertEquals("Por hacer", props.at("/Status/status/name").asText());
        assertEquals("m1", props.at("/Meeting ID/rich_text/0/text/content").asText());
        assertFalse(props.has("Due date"));
    }

    @Test
    void databaseWithoutTitleIsRejected() throws Exception {
        assertThrows(DispatchException.class,
                () -> client.pageProperties(task, "m1", mapper.readTree("{\"Status\":{\"type\":\"status\"}}")));
    }

    @Test
    void databaseIdIsEncodedIntoThePath() {
        assertEquals("/databases/abc%20def", NotionKanbanClient.databasePath("abc def"));
        assertEquals("/databases/1f2e3d4c-aaaa", NotionKanbanClient.databasePath("1f2e3d4c-aaaa"));
    }

    @Test
    void malformedRequestUrlIsADispatchFailure() {
        NotionKanbanClient broken = new NotionKanbanClient(HttpClient.newHttpClient(), settings,
                "http://bad host/v1", "2022-06-28", Duration.ofSeconds(10));

        DispatchException e = assertThrows(DispatchException.class, () -> broken.createCard(task, "m1"));
        assertTrue(e.getMessage().startsWith("Notion request is invalid"));
    }
}
