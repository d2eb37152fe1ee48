package com.Lezat.Scheduling.service.gemini;

import com.Lezat.Scheduling.exception.ExtractionException;
import com.Lezat.Scheduling.model.TranscriptSentence;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.extraction.OnlineMeetingPlatform;
import com.Lezat.Scheduling.service.extraction.TaskExtractor;
import com.Lezat.Scheduling.util.JsonPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
public class GeminiTaskExtractor implements TaskExtractor {

    static final int MAX_PROMPT_SENTENCES = 200;

    private static final String SYSTEM_PROMPT = "You are a meeting analyst. Extract only actionable tasks assigned to people. Answer with valid JSON.";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.model:gemini-2.0-flash}")
    private String model;

    @Value("${app.gemini.api-base:https://generativelanguage.googleapis.com/v1beta}")
    private String apiBase;

    @Value("${app.gemini.timeout-seconds:20}")
    private long timeoutSeconds;

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<ExtractedTask> extractTasks(String meetingId, String transcriptText,
                                            List<TranscriptSentence> sentences, Set<String> participantEmails) {
        if (!isConfigured()) throw new ExtractionException("Gemini API key not configured");
        if (transcriptText == null || transcriptText.isBlank()) return List.of();

        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        ObjectNode root = mapper.createObjectNode();
        root.putObject("system_instruction").putArray("parts").addObject().put("text", SYSTEM_PROMPT);
        ArrayNode contents = root.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", buildPrompt(meetingId, today, transcriptText, sentences, participantEmails));
        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", 0.1);
        generation.put("responseMimeType", "application/json");

        String base = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        String url = base + "/models/" + model + ":generateContent?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 20))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(root)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ExtractionException("Gemini API request timed out", e);
        } catch (IOException e) {
            throw new ExtractionException("Gemini API connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Gemini API call interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            throw new ExtractionException("Gemini API HTTP " + resp.statusCode() + ": " + resp.body());
        }
        List<ExtractedTask> tasks = parseTasks(responseText(resp.body()));
        log.info("Gemini: meeting {} yielded {} action items", meetingId, tasks.size());
        return tasks;
    }

    String buildPrompt(String meetingId, LocalDate today, String transcriptText,
                       List<TranscriptSentence> sentences, Set<String> participantEmails) {
        ArrayNode compact = mapper.createArrayNode();
        if (sentences != null) {
            for (TranscriptSentence s : sentences.subList(0, Math.min(sentences.size(), MAX_PROMPT_SENTENCES))) {
                ObjectNode n = compact.addObject();
                n.put("speaker", s.getSpeaker());
                n.put("text", s.getText());
            }
        }
        ArrayNode emails = mapper.createArrayNode();
        if (participantEmails != null) participantEmails.forEach(emails::add);

        return "Analyze this meeting and extract ONLY real actionable tasks.\n"
                + "Do not include summaries, opinions, context or general notes.\n"
                + "A valid task implies a concrete action or a verifiable commitment.\n"
                + "If a task has no clear owner, set assignee_email and assignee_name to null.\n"
                + "Date rules:\n"
                + "- current_date: " + today + "\n"
                + "- Convert relative dates (tomorrow, in 1 week, next month) to YYYY-MM-DD using current_date.\n"
                + "- A date without a year uses the current year.\n"
                + "If no date can be inferred, set due_date to null.\n"
                + "Put the exact sentence where the task appears in source_sentence.\n"
                + "If the task is to hold a video meeting, set online_meeting_platform to google_meet or "
                + "microsoft_teams when the platform is named, auto when it is not; otherwise null.\n"
                + "Return JSON in exactly this format:\n"
                + "{\"action_items\": [{\"title\": \"string\", \"assignee_email\": \"string|null\", "
                + "\"assignee_name\": \"string|null\", \"due_date\": \"YYYY-MM-DD|null\", "
                + "\"details\": \"string|null\", \"source_sentence\": \"string|null\", "
                + "\"online_meeting_platform\": \"google_meet|microsoft_teams|auto|null\"}]}\n\n"
                + "meeting_id: " + (meetingId == null ? "null" : meetingId) + "\n"
                + "participant_emails: " + emails + "\n"
                + "sentences: " + compact + "\n"
                + "transcript:\n" + transcriptText.trim();
    }

    String responseText(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Gemini API returned invalid JSON", e);
        }
        JsonNode parts = node.path("candidates").path(0).path("content").path("parts");
        List<String> chunks = new ArrayList<>();
        for (JsonNode part : parts) {
            String text = JsonPaths.toText(part.get("text"));
            if (text != null) chunks.add(text);
        }
        if (chunks.isEmpty()) {
            throw new ExtractionException("Gemini API response did not include text output");
        }
        return String.join("\n", chunks);
    }

    List<ExtractedTask> parseTasks(String content) {
        JsonNode json = readObject(content);
        if (json == null) {
            String stripped = content.replaceAll("(?s)```json|```", "").trim();
            int start = stripped.indexOf('{');
            int end = stripped.lastIndexOf('}');
            if (start >= 0 && end > start) {
                json = readObject(stripped.substring(start, end + 1));
            }
        }
        if (json == null) {
            throw new ExtractionException("Gemini output could not be parsed as JSON");
        }
        List<ExtractedTask> tasks = new ArrayList<>();
        for (JsonNode it : json.path("action_items")) {
            if (!it.isObject()) continue;
            String title = JsonPaths.firstText(it, "title");
            if (title == null) continue;
            String details = JsonPaths.firstText(it, "details");
            String sourceSentence = JsonPaths.firstText(it, "source_sentence");
            tasks.add(new ExtractedTask(
                    title,
                    details,
                    email(JsonPaths.firstText(it, "assignee_email")),
                    JsonPaths.firstText(it, "assignee_name"),
                    dueDate(JsonPaths.firstText(it, "due_date")),
                    sourceSentence,
                    meetingPlatform(it, title, details, sourceSentence)));
        }
        return tasks;
    }

    private JsonNode readObject(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Gemini: output is not a bare JSON object: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static LocalDate dueDate(String raw) {
        if (raw == null || !raw.matches("\\d{4}-\\d{2}-\\d{2}")) return null;
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Gemini: ignoring impossible due date {}", raw);
            return null;
        }
    }

    /** The declared platform wins; otherwise the task's own wording may name one. */
    static OnlineMeetingPlatform meetingPlatform(JsonNode item, String title, String details, String sourceSentence) {
        OnlineMeetingPlatform declared = OnlineMeetingPlatform.detect(JsonPaths.firstText(item, "online_meeting_platform"));
        if (declared != null) return declared;
        for (String text : new String[]{sourceSentence, details, title}) {
            OnlineMeetingPlatform inferred = OnlineMeetingPlatform.detect(text);
            if (inferred != null && inferred.isExplicit()) return inferred;
        }
        JsonNode requires = item.get("requires_online_meeting");
        if (requires != null && (requires.asBoolean(false) || "true".equalsIgnoreCase(requires.asText()))) {
            return OnlineMeetingPlatform.AUTO;
        }
        return null;
    }

    private static String email(String raw) {
        if (raw == null || !raw.contains("@")) return null;
        return raw.trim().toLowerCase();
    }
}
