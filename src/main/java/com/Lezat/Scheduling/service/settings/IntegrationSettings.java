package com.Lezat.Scheduling.service.settings;

import java.time.ZoneId;

/**
 * Immutable snapshot of one user's integration configuration, loaded once per request.
 * A nested settings object is {@code null} when that destination is not (fully) configured.
 */
public record IntegrationSettings(
        String clientReferenceId,
        boolean autosyncEnabled,
        ZoneId timezone,
        String firefliesApiKey,
        String readAiApiKey,
        NotionSettings notion,
        MondaySettings monday,
        GoogleCalendarSettings googleCalendar,
        OutlookCalendarSettings outlookCalendar
) {

    public static IntegrationSettings defaults(String clientReferenceId, ZoneId zone) {
        return new IntegrationSettings(clientReferenceId, true, zone, null, null, null, null, null, null);
    }

    public record NotionSettings(
            String token,
            String databaseId,
            String titleProperty,
            String statusProperty,
            String dueDateProperty,
            String detailsProperty,
            String meetingIdProperty,
            String todoStatus
    ) {
    }

    public record MondaySettings(
            String token,
            String boardId,
            String groupId,
            String statusColumnId,
            String dateColumnId,
            String detailsColumnId,
            String meetingIdColumnId,
            String todoLabel
    ) {
    }

    public record GoogleCalendarSettings(
            String accessToken,
            String refreshToken,
            String calendarId,
            String clientId,
            String clientSecret
    ) {
    }

    public record OutlookCalendarSettings(
            String accessToken,
            String refreshToken,
            String clientId,
            String clientSecret,
            String tenantId
    ) {
    }
}
