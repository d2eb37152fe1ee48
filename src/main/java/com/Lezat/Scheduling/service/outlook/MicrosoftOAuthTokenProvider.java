package com.Lezat.Scheduling.service.outlook;

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
 * Refresh-token flow against the Microsoft identity platform. The tenant and client credentials
 * come from the user's settings, falling back to the app registration.
 */
@Slf4j
@Component
public class MicrosoftOAuthTokenProvider implements OutlookTokenProvider {

    static final String SCOPE = "offline_access https://graph.microsoft.com/User.Read https://graph.microsoft.com/Calendars.ReadWrite";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.outlook.calendar.authority:https://login.microsoftonline.com}")
    private String authority;

    @Value("${app.outlook.calendar.tenant-id:common}")
    private String tenantId;

    @Value("${app.outlook.calendar.client-id:}")
    private String clientId;

    @Value("${app.outlook.calendar.client-secret:}")
    private String clientSecret;

    @Value("${app.outlook.calendar.timeout-seconds:10}")
    private long timeoutSeconds;

    @Override
    public String accessToken(IntegrationSettings.OutlookCalendarSettings settings) {
        String stored = JsonPaths.blankToNull(settings.accessToken());
        if (stored != null) return stored;
        return refreshAccessToken(settings);
    }

    @Override
    public boolean canRefresh(IntegrationSettings.OutlookCalendarSettings settings) {
        return JsonPaths.blankToNull(settings.refreshToken()) != null
                && effective(settings.clientId(), clientId) != null
                && effective(settings.clientSecret(), clientSecret) != null;
    }

    @Override
    public String refreshAccessToken(IntegrationSettings.OutlookCalendarSettings settings) {
        if (!canRefresh(settings)) {
            throw new DispatchException("Outlook Calendar refresh token flow is not configured");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", effective(settings.clientId(), clientId));
        form.put("client_secret", effective(settings.clientSecret(), clientSecret));
        form.put("refresh_token", settings.refreshToken());
        form.put("grant_type", "refresh_token");
        form.put("scope", SCOPE);
        String body = form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(tokenUri(settings)))
                    .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 10))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new DispatchException("Microsoft OAuth token request is invalid: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DispatchException("Microsoft OAuth token refresh failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Microsoft OAuth token refresh interrupted", e);
        }
        if (resp.statusCode() >= 300) {
            throw new DispatchException("Microsoft OAuth token refresh HTTP " + resp.statusCode());
        }
        try {
            JsonNode node = mapper.readTree(resp.body());
            String token = JsonPaths.blankToNull(node.path("access_token").asText(null));
            if (token == null) {
                throw new DispatchException("Microsoft OAuth refresh did not include access_token");
            }
            log.debug("Microsoft OAuth: access token refreshed, expires in {}s", node.path("expires_in").asLong(3600));
            return token;
        } catch (JsonProcessingException e) {
            throw new DispatchException("Microsoft OAuth returned invalid JSON", e);
        }
    }

    String tokenUri(IntegrationSettings.OutlookCalendarSettings settings) {
        String tenant = effective(settings.tenantId(), tenantId);
        String base = authority.endsWith("/") ? authority.substring(0, authority.length() - 1) : authority;
        return base + "/" + URLEncoder.encode(tenant == null ? "common" : tenant, StandardCharsets.UTF_8)
                + "/oauth2/v2.0/token";
    }

    private static String effective(String own, String fallback) {
        String value = JsonPaths.blankToNull(own);
        return value != null ? value : JsonPaths.blankToNull(fallback);
    }
}
