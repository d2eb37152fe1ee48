package com.Lezat.Scheduling.service.readai;

import com.Lezat.Scheduling.exception.ProviderFetchException;
import com.Lezat.Scheduling.model.TranscriptSentence;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.transcript.FetchedTranscript;
import com.Lezat.Scheduling.service.transcript.TranscriptFetcher;
import com.Lezat.Scheduling.util.JsonPaths;
import com.Lezat.Scheduling.util.ParticipantEmails;
import com.Lezat.Scheduling.util.TranscriptSentences;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.time.Duration;
import java.util.List;

@Component
public class ReadAiClient implements TranscriptFetcher {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.read-ai.api-url:https://api.read.ai/v1}")
    private String apiUrl;

    @Value("${app.read-ai.api-key:}")
    private String apiKey;

    @Value("${app.read-ai.timeout-seconds:10}")
    private long timeoutSeconds;

    @Override
    public boolean isConfigured(IntegrationSettings settings) {
        return resolveKey(settings) != null;
    }

    @Override
    public FetchedTranscript fetchTranscript(String meetingId, IntegrationSettings settings) {
        String key = resolveKey(settings);
        if (key == null) throw new ProviderFetchException("Read AI API key not configured");

        String base = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(base + "/meetings/" + URLEncoder.encode(meetingId, StandardCharsets.UTF_8)))
                    .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 10))
                    .header("Authorization", "Bearer " + key)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderFetchException("Read AI API timed out after " + timeoutSeconds + "s", e);
        } catch (IOException e) {
            throw new ProviderFetchException("Read AI API connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchException("Read AI API call interrupted", e);
        }
        if (resp.statusCode() == 404) {
            throw new ProviderFetchException("Read AI meeting " + meetingId + " not found");
        }
        if (resp.statusCode() >= 300) {
            throw new ProviderFetchException("Read AI API HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            return toTranscript(mapper.readTree(resp.body()));
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException("Read AI API returned invalid JSON", e);
        }
    }

    FetchedTranscript toTranscript(JsonNode meeting) {
        List<TranscriptSentence> sentences = TranscriptSentences.parse(
                JsonPaths.firstPresent(meeting, "transcript.speaker_blocks", "transcript.sentences", "sentences"));
        String text = JsonPaths.firstFlattenedText(meeting, "transcript.text", "transcript.full_text", "full_transcript");
        if (text == null) {
            text = TranscriptSentences.toText(sentences);
        }
        return new FetchedTranscript(
                JsonPaths.firstText(meeting, "id", "session_id"),
                text,
                JsonPaths.firstText(meeting, "url", "join_url", "meeting.url"),
                sentences,
                ParticipantEmails.collect(meeting, "participants", "attendees", "owner")
        );
    }

    private String resolveKey(IntegrationSettings settings) {
        String own = settings == null ? null : JsonPaths.blankToNull(settings.readAiApiKey());
        return own != null ? own : JsonPaths.blankToNull(apiKey);
    }
}
