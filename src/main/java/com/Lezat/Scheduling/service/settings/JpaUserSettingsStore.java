package com.Lezat.Scheduling.service.settings;

import com.Lezat.Scheduling.model.UserIntegrationSettings;
import com.Lezat.Scheduling.repository.UserIntegrationSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;

import static com.Lezat.Scheduling.util.JsonPaths.blankToNull;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaUserSettingsStore implements UserSettingsStore {

    private final UserIntegrationSettingsRepository repository;

    @Value("${app.sync.default-timezone:UTC}")
    private String defaultTimezone;

    @Override
    public IntegrationSettings load(String clientReferenceId) {
        return repository.findById(clientReferenceId)
                .map(this::toSnapshot)
                .orElseGet(() -> IntegrationSettings.defaults(clientReferenceId, zone(null, clientReferenceId)));
    }

    private IntegrationSettings toSnapshot(UserIntegrationSettings s) {
        return new IntegrationSettings(
                s.getClientReferenceId(),
                !Boolean.FALSE.equals(s.getAutosyncEnabled()),
                zone(s.getTimezone(), s.getClientReferenceId()),
                blankToNull(s.getFirefliesApiKey()),
                blankToNull(s.getReadAiApiKey()),
                notion(s),
                monday(s),
                googleCalendar(s),
                outlookCalendar(s)
        );
    }

    private IntegrationSettings.NotionSettings notion(UserIntegrationSettings s) {
        String token = blankToNull(s.getNotionToken());
        String databaseId = blankToNull(s.getNotionDatabaseId());
        if (token == null || databaseId == null) return null;
        return new IntegrationSettings.NotionSettings(
                token,
                databaseId,
                blankToNull(s.getNotionTitleProperty()),
                orDefault(s.getNotionStatusProperty(), "Status"),
                orDefault(s.getNotionDueDateProperty(), "Due date"),
                orDefault(s.getNotionDetailsProperty(), "Details"),
                orDefault(s.getNotionMeetingIdProperty(), "Meeting ID"),
                orDefault(s.getNotionTodoStatus(), "Por hacer")
        );
    }

    private IntegrationSettings.MondaySettings monday(UserIntegrationSettings s) {
        String token = blankToNull(s.getMondayToken());
        String boardId = blankToNull(s.getMondayBoardId());
        if (token == null || boardId == null) return null;
        return new IntegrationSettings.MondaySettings(
                token,
                boardId,
                blankToNull(s.getMondayGroupId()),
                orDefault(s.getMondayStatusColumnId(), "status"),
                orDefault(s.getMondayDateColumnId(), "date"),
                orDefault(s.getMondayDetailsColumnId(), "long_text"),
                orDefault(s.getMondayMeetingIdColumnId(), "text"),
                orDefault(s.getMondayTodoLabel(), "Working on it")
        );
    }

    private IntegrationSettings.GoogleCalendarSettings googleCalendar(UserIntegrationSettings s) {
        String access = blankToNull(s.getGoogleAccessToken());
        String refresh = blankToNull(s.getGoogleRefreshToken());
        if (access == null && refresh == null) return null;
        return new IntegrationSettings.GoogleCalendarSettings(
                access,
                refresh,
                orDefault(s.getGoogleCalendarId(), "primary"),
                blankToNull(s.getGoogleClientId()),
                blankToNull(s.getGoogleClientSecret())
        );
    }

    private IntegrationSettings.OutlookCalendarSettings outlookCalendar(UserIntegrationSettings s) {
        String access = blankToNull(s.getOutlookAccessToken());
        String refresh = blankToNull(s.getOutlookRefreshToken());
        if (access == null && refresh == null) return null;
        return new IntegrationSettings.OutlookCalendarSettings(
                access,
                refresh,
                blankToNull(s.getOutlookClientId()),
                blankToNull(s.getOutlookClientSecret()),
                blankToNull(s.getOutlookTenantId())
        );
    }

    private ZoneId zone(String configured, String clientReferenceId) {
        String candidate = blankToNull(configured);
        if (candidate != null) {
            try {
                return ZoneId.of(candidate);
            } catch (DateTimeException e) {
                log.warn("Settings: invalid timezone '{}' for user {}, using {}", candidate, clientReferenceId, defaultTimezone);
            }
        }
        return ZoneId.of(defaultTimezone);
    }

    private static String orDefault(String value, String fallback) {
        String v = blankToNull(value);
        return v == null ? fallback : v;
    }
}
