package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.exception.ValidationException;
import com.Lezat.Scheduling.model.TranscriptSentence;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.util.JsonPaths;
import com.Lezat.Scheduling.util.ParticipantEmails;
import com.Lezat.Scheduling.util.TranscriptSentences;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Shared extraction logic. Subclasses only declare where their provider keeps each field.
 */
public abstract class AbstractPayloadNormalizer implements PayloadNormalizer {

    /** Column width of {@code meetingId} on the stored records. */
    static final int MAX_MEETING_ID_LENGTH = 255;

    private static final String[] PLATFORM_PATHS = {"meeting.platform", "meeting.meeting_platform", "platform"};
    private static final String[] URL_PATHS = {"meeting.url", "meeting.join_url", "meeting.link", "join_url", "url"};
    private static final String[] PARTICIPANT_PATHS = {
            "participant_emails", "participants", "attendees",
            "meeting.participants", "meeting.attendees", "meeting_attendees"
    };

    protected abstract String[] meetingIdPaths();

    protected abstract String[] eventTypePaths();

    protected abstract String[] transcriptIdPaths();

    protected abstract String[] inlineTranscriptPaths();

    protected abstract String[] inlineSentencePaths();

    protected abstract Set<String> completionEvents();

    @Override
    public MeetingEvent normalize(JsonNode payload, String rawPayload, String clientReferenceId, Instant receivedAt) {
        if (clientReferenceId == null || clientReferenceId.isBlank()) {
            throw new ValidationException("client reference id is required");
        }
        String meetingId = JsonPaths.firstText(payload, meetingIdPaths());
        if (meetingId == null) {
            throw new ValidationException("Webhook payload is missing a meeting id");
        }
        if (meetingId.length() > MAX_MEETING_ID_LENGTH) {
            throw new ValidationException("Webhook meeting id is longer than " + MAX_MEETING_ID_LENGTH + " characters");
        }
        String eventType = normalizeEventType(JsonPaths.firstText(payload, eventTypePaths()));
        String meetingUrl = JsonPaths.firstText(payload, URL_PATHS);
        String platformHint = JsonPaths.firstText(payload, PLATFORM_PATHS);
        Set<String> emails = ParticipantEmails.collect(payload, PARTICIPANT_PATHS);
        List<TranscriptSentence> sentences = TranscriptSentences.parse(JsonPaths.firstPresent(payload, inlineSentencePaths()));
        String inlineText = JsonPaths.firstFlattenedText(payload, inlineTranscriptPaths());
        if (inlineText == null) {
            inlineText = TranscriptSentences.toText(sentences);
        }

        return new MeetingEvent(
                provider(),
                meetingId,
                detectPlatform(platformHint, meetingUrl),
                eventType,
                rawPayload,
                clientReferenceId.trim(),
                receivedAt,
                JsonPaths.firstText(payload, transcriptIdPaths()),
                meetingUrl,
                eventType != null && completionEvents().contains(eventType),
                inlineText,
                sentences,
                emails
        );
    }

    /** "Transcription completed" and "transcription-completed" both become {@code transcription_completed}. */
    static String normalizeEventType(String raw) {
        if (raw == null) return null;
        String normalized = raw.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return normalized.isEmpty() ? null : normalized;
    }

    static TranscriptionRecord.MeetingPlatform detectPlatform(String platformHint, String meetingUrl) {
        if (platformHint != null) {
            String p = platformHint.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
            if (p.equals("googlemeet") || p.equals("meet") || p.equals("gmeet") || p.equals("hangouts")) {
                return TranscriptionRecord.MeetingPlatform.GOOGLE_MEET;
            }
            return TranscriptionRecord.MeetingPlatform.OTHER;
        }
        if (meetingUrl != null && meetingUrl.toLowerCase(Locale.ROOT).contains("meet.google.com")) {
            return TranscriptionRecord.MeetingPlatform.GOOGLE_MEET;
        }
        return TranscriptionRecord.MeetingPlatform.UNKNOWN;
    }
}
