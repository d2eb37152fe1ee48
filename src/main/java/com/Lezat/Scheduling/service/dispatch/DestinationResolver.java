package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.service.google.GoogleCalendarClient;
import com.Lezat.Scheduling.service.google.TokenProvider;
import com.Lezat.Scheduling.service.monday.MondayKanbanClient;
import com.Lezat.Scheduling.service.notion.NotionKanbanClient;
import com.Lezat.Scheduling.service.outlook.OutlookCalendarClient;
import com.Lezat.Scheduling.service.outlook.OutlookTokenProvider;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the destination clients for one user from their settings snapshot.
 * Destinations missing from the snapshot are simply not returned.
 */
@Component
@RequiredArgsConstructor
public class DestinationResolver {

    private final TokenProvider tokenProvider;
    private final OutlookTokenProvider outlookTokenProvider;
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Value("${app.notion.api-base:https://api.notion.com/v1}")
    private String notionApiBase;

    @Value("${app.notion.api-version:2022-06-28}")
    private String notionApiVersion;

    @Value("${app.notion.timeout-seconds:10}")
    private long notionTimeoutSeconds;

    @Value("${app.monday.api-url:https://api.monday.com/v2}")
    private String mondayApiUrl;

    @Value("${app.monday.timeout-seconds:10}")
    private long mondayTimeoutSeconds;

    @Value("${app.google.calendar.api-base:https://www.googleapis.com/calendar/v3}")
    private String googleCalendarApiBase;

    @Value("${app.google.calendar.timeout-seconds:10}")
    private long googleTimeoutSeconds;

    @Value("${app.outlook.calendar.api-base:https://graph.microsoft.com/v1.0}")
    private String outlookApiBase;

    @Value("${app.outlook.calendar.timeout-seconds:10}")
    private long outlookTimeoutSeconds;

    public ResolvedDestinations resolve(IntegrationSettings settings) {
        if (settings == null) return ResolvedDestinations.none();
        List<KanbanDestination> kanban = new ArrayList<>();
        List<CalendarDestination> calendars = new ArrayList<>();
        if (settings.notion() != null) {
            kanban.add(new NotionKanbanClient(http, settings.notion(), notionApiBase, notionApiVersion, timeout(notionTimeoutSeconds)));
        }
        if (settings.monday() != null) {
            kanban.add(new MondayKanbanClient(http, settings.monday(), mondayApiUrl, timeout(mondayTimeoutSeconds)));
        }
        if (settings.googleCalendar() != null) {
            calendars.add(new GoogleCalendarClient(http, settings.googleCalendar(), tokenProvider,
                    googleCalendarApiBase, timeout(googleTimeoutSeconds)));
        }
        if (settings.outlookCalendar() != null) {
            calendars.add(new OutlookCalendarClient(http, settings.outlookCalendar(), outlookTokenProvider,
                    outlookApiBase, timeout(outlookTimeoutSeconds)));
        }
        return new ResolvedDestinations(kanban, calendars);
    }

    private static Duration timeout(long seconds) {
        return Duration.ofSeconds(seconds > 0 ? seconds : 10);
    }
}
