package com.Lezat.Scheduling.service.google;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.util.JsonPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Uses the stored access token when there is one; otherwise exchanges the stored refresh token.
 * Client credentials come from the user's settings, falling back to the app's OAuth client.
 */
@Slf4j
@Component
public class GoogleOAuthTokenProvider implements TokenProvider {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.google.calendar.token-uri:https://oauth2.googleapis.com/token}")
    private String tokenUri;

    @Value("${app.google.calendar.client-id:}")
    private String clientId;

    @Value("${app.google.calendar.client-secret:}")
    private String clientSecret;

    @Value("${app.google.calendar.timeout-seconds:10}")
    private long timeoutSeconds;

    @Override
    public String accessToken(IntegrationSettings.GoogleCalendarSettings settings) {
        String stored = JsonPaths.blankToNull(settings.accessToken());
        if (stored != null) return stored;
        return refreshAccessToken(settings);
    }

    @Override
    public boolean canRefresh(IntegrationSettings.GoogleCalendarSettings settings) {
        return JsonPaths.blankToNull(settings.refreshToken()) != null
                && effectiveClientId(settings) != null
                && effectiveClientSecret(settings) != null;
    }

    @Override
    public String refreshAccessToken(IntegrationSettings.GoogleCalendarSettings settings) {
        if (!canRefresh(settings)) {
            throw new DispatchException("Google Calendar refresh token flow is not configured");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", effectiveClientId(settings));
        form.put("client_secret", effectiveClientSecret(settings));
        form.put("refresh_token", settings.refreshToken());
        form.put("grant_type", "refresh_token");
        String body = form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(tokenUri))
                    .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 10))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Google OAuth token request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("Google OAuth token refresh failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Google OAuth token refresh interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("Google OAuth token refresh HTTP " + resp.statusCode());
        }
        try {
            JsonNode node = mapper.readTree(resp.body());
            String token = JsonPaths.blankToNull(node.path("access_token").asText(null));
            if (token == null) {
                throw new DispatchException("Google OAuth refresh did not include access_token");
            }
            log.debug("Google OAuth: access token refreshed, expires in {}s", node.path("expires_in").asLong(3600));
            return token;
        } catch (JsonProcessingException e) {
            throw new DispatchException("Google OAuth returned invalid JSON", e);
        }
    }

    private String effectiveClientId(IntegrationSettings.GoogleCalendarSettings settings) {
        String own = JsonPaths.blankToNull(settings.clientId());
        return own != null ? own : JsonPaths.blankToNull(clientId);
    }

    private String effectiveClientSecret(IntegrationSettings.GoogleCalendarSettings settings) {
        String own = JsonPaths.blankToNull(settings.clientSecret());
        return own != null ? own : JsonPaths.blankToNull(clientSecret);
    }
}
