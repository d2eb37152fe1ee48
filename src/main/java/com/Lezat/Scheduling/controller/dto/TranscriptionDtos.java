package com.Lezat.Scheduling.controller.dto;

import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.model.DispatchAttempt;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.service.extraction.OnlineMeetingPlatform;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

public class TranscriptionDtos {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WebhookAccepted {
        private String recordId;
        private String provider;
        private String meetingId;
        private String eventType;
        private TranscriptionRecord.MeetingPlatform meetingPlatform;
        private TranscriptionRecord.EnrichmentStatus enrichmentStatus;
        private String enrichmentError;
        private int actionItemsCreated;
        private LocalDateTime receivedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListItem {
        private String id;
        private String provider;
        private String meetingId;
        private String clientReferenceId;
        private String eventType;
        private TranscriptionRecord.MeetingPlatform meetingPlatform;
        private TranscriptionRecord.EnrichmentStatus enrichmentStatus;
        private LocalDateTime receivedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detail {
        private String id;
        private String provider;
        private String meetingId;
        private String clientReferenceId;
        private String eventType;
        private String transcriptId;
        private TranscriptionRecord.MeetingPlatform meetingPlatform;
        private String meetingUrl;
        private TranscriptionRecord.EnrichmentStatus enrichmentStatus;
        private String enrichmentError;
        private String transcriptText;
        private List<SentenceDTO> transcriptSentences;
        private Set<String> participantEmails;
        @JsonRawValue
        private String rawPayload;
        private List<ActionItemDTO> actionItems;
        private List<DispatchResultDTO> dispatchResults;
        private LocalDateTime receivedAt;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SentenceDTO {
        private String speaker;
        private Double startTime;
        private Double endTime;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionItemDTO {
        private Long id;
        private ActionItemCreation.DestinationKind destinationKind;
        private String destinationRef;
        private String title;
        private String assigneeEmail;
        private LocalDate dueDate;
        private OnlineMeetingPlatform onlineMeetingPlatform;
        private ActionItemCreation.CreationSource source;
        private ActionItemCreation.CalendarSyncStatus calendarSyncStatus;
        private String calendarEventRef;
        private String calendarMeetingLink;
        private String calendarError;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DispatchResultDTO {
        private String destination;
        private DispatchAttempt.DestinationType destinationType;
        private String taskTitle;
        private DispatchAttempt.Outcome outcome;
        private String reference;
        private String error;
        private LocalDateTime attemptedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackfillResponse {
        private String meetingId;
        private int updatedCount;
        private Detail record;
    }

    /** Secrets are always null here; only whether they are set is reported. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SettingsView {
        private String clientReferenceId;
        private boolean autosyncEnabled;
        private String timezone;
        private boolean firefliesApiKeyConfigured;
        private boolean readAiApiKeyConfigured;
        private boolean notionConfigured;
        private String notionDatabaseId;
        private String notionToken;
        private boolean mondayConfigured;
        private String mondayBoardId;
        private String mondayToken;
        private boolean googleCalendarConfigured;
        private String googleCalendarId;
        private String googleAccessToken;
        private String googleRefreshToken;
        private boolean outlookCalendarConfigured;
        private String outlookAccessToken;
        private String outlookRefreshToken;
    }
}
