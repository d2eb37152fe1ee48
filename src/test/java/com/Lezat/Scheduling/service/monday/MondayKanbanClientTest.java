package com.Lezat.Scheduling.service.monday;

import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class MondayKanbanClientTest {

    private final IntegrationSettings.MondaySettings settings = new IntegrationSettings.MondaySettings(
            "token", "123", "topics", "status", "date", "long_text", "text", "Working on it");
    private final MondayKanbanClient client = new MondayKanbanClient(HttpClient.newHttpClient(), settings,
            "https://api.monday.com/v2", Duration.ofSeconds(10));

    @Test
    void buildsColumnValues() {
        ExtractedTask task = new ExtractedTask("Send deck", "v2", null, "Ana", LocalDate.parse("2024-01-10"), null);

        ObjectNode values = client.columnValues(task, "m1");

        assertEquals("Working on it", values.at("/status/label").asText());
        assertEquals("2024-01-10", values.at("/date/date").asText());
        assertEquals("v2\nAssignee: Ana", values.at("/long_text/text").asText());
        assertEquals("m1", values.get("text").asText());
    }

    @Test
    void skipsDateWithoutDueDate() {
        ObjectNode values = client.columnValues(new ExtractedTask("Plan", null, null, null, null, null), "m1");

        assertFalse(values.has("date"));
        assertFalse(values.has("long_text"));
        assertTrue(MondayKanbanClient.CREATE_ITEM.contains("create_item"));
    }
}
