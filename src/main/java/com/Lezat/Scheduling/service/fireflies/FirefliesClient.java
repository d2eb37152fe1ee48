package com.Lezat.Scheduling.service.fireflies;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fireflies GraphQL API. Accounts on older plans reject some transcript fields, so the query is
 * retried with narrower field sets when the API answers with a GraphQL error.
 */
@Slf4j
@Component
public class FirefliesClient implements TranscriptFetcher {

    private static final String GRAPHQL_ERROR = "GraphQL error";

    static final List<String> TRANSCRIPT_QUERIES = List.of(
            """
            query TranscriptById($id: String!) {
              transcript(id: $id) {
                id title date meeting_link transcript_url organizer_email host_email
                participants fireflies_users
                user { email }
                meeting_attendees { email name displayName }
                sentences { index speaker_name speaker_id text start_time end_time }
              }
            }
            """,
            """
            query TranscriptById($id: String!) {
              transcript(id: $id) {
                id title date meeting_link transcript_url organizer_email participants
                meeting_attendees { email }
                sentences { index speaker_name speaker_id text start_time end_time }
              }
            }
            """,
            """
            query TranscriptById($id: String!) {
              transcript(id: $id) {
                id title date meeting_link transcript_url
                sentences { text }
              }
            }
            """
    );

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.fireflies.api-url:https://api.fireflies.ai/graphql}")
    private String apiUrl;

    @Value("${app.fireflies.api-key:}")
    private String apiKey;

    @Value("${app.fireflies.timeout-seconds:10}")
    private long timeoutSeconds;

    @Value("${app.fireflies.user-agent:scheduling-sync/1.0}")
    private String userAgent;

    @Override
    public boolean isConfigured(IntegrationSettings settings) {
        return resolveKey(settings) != null;
    }

    @Override
    public FetchedTranscript fetchTranscript(String meetingId, IntegrationSettings settings) {
        String key = resolveKey(settings);
        if (key == null) throw new ProviderFetchException("Fireflies API key not configured");

        ProviderFetchException graphqlError = null;
        for (String query : TRANSCRIPT_QUERIES) {
            try {
                return toTranscript(fetchWithQuery(meetingId, query, key));
            } catch (ProviderFetchException e) {
                if (!e.getMessage().contains(GRAPHQL_ERROR)) throw e;
                log.warn("Fireflies: meeting {} query rejected, trying narrower field set: {}", meetingId, e.getMessage());
                graphqlError = e;
            }
        }
        throw graphqlError != null ? graphqlError : new ProviderFetchException("Fireflies transcript query failed");
    }

    private JsonNode fetchWithQuery(String meetingId, String query, String key) {
        ObjectNode body = mapper.createObjectNode();
        body.put("query", query);
        body.putObject("variables").put("id", meetingId);

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 10))
                    .header("Authorization", "Bearer " + key)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header("User-Agent", userAgent)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderFetchException("Fireflies API timed out after " + timeoutSeconds + "s", e);
        } catch (IOException e) {
            throw new ProviderFetchException("Fireflies API connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchException("Fireflies API call interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            String text = resp.body() == null || resp.body().isBlank() ? "empty response body" : resp.body();
            throw new ProviderFetchException("Fireflies API HTTP " + resp.statusCode() + ": " + text);
        }
        return parseTranscriptNode(resp.body());
    }

    JsonNode parseTranscriptNode(String responseBody) {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException("Fireflies API returned invalid JSON", e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new ProviderFetchException("Fireflies API " + GRAPHQL_ERROR + ": " + errors);
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new ProviderFetchException("Fireflies API response missing data");
        }
        JsonNode transcript = data.path("transcript");
        if (!transcript.isObject()) {
            throw new ProviderFetchException("Fireflies transcript not found for provided meeting id");
        }
        return transcript;
    }

    FetchedTranscript toTranscript(JsonNode transcript) {
        List<TranscriptSentence> sentences = TranscriptSentences.parse(transcript.path("sentences"));

        Set<String> emails = new TreeSet<>();
        ParticipantEmails.add(transcript.path("organizer_email").asText(null), emails);
        ParticipantEmails.add(transcript.path("host_email").asText(null), emails);
        ParticipantEmails.add(transcript.path("user").path("email").asText(null), emails);
        ParticipantEmails.addFrom(transcript.get("participants"), emails);
        ParticipantEmails.addFrom(transcript.get("fireflies_users"), emails);
        ParticipantEmails.addFrom(transcript.get("meeting_attendees"), emails);

        return new FetchedTranscript(
                JsonPaths.blankToNull(transcript.path("id").asText(null)),
                TranscriptSentences.toText(sentences),
                JsonPaths.blankToNull(transcript.path("meeting_link").asText(null)),
                sentences,
                emails
        );
    }

    private String resolveKey(IntegrationSettings settings) {
        String own = settings == null ? null : JsonPaths.blankToNull(settings.firefliesApiKey());
        return own != null ? own : JsonPaths.blankToNull(apiKey);
    }
}
