package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.model.TranscriptSentence;
import com.Lezat.Scheduling.model.TranscriptionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Canonical form of a webhook delivery, whatever provider sent it.
 *
 * @param rawPayload               the request body exactly as received
 * @param completionEvent          whether this event type should trigger transcript enrichment
 * @param inlineTranscriptText     transcript text already carried by the payload, if any
 * @param inlineSentences          sentences carried by the payload, empty when it has none
 * @param payloadParticipantEmails attendee e-mails found in the payload, used when the transcript has none
 */
public record MeetingEvent(
        TranscriptionRecord.Provider provider,
        String meetingId,
        TranscriptionRecord.MeetingPlatform platform,
        String eventType,
        String rawPayload,
        String clientReferenceId,
        Instant receivedAt,
        String transcriptId,
        String meetingUrl,
        boolean completionEvent,
        String inlineTranscriptText,
        List<TranscriptSentence> inlineSentences,
        Set<String> payloadParticipantEmails
) {
    public MeetingEvent {
        inlineSentences = inlineSentences == null ? List.of() : List.copyOf(inlineSentences);
        payloadParticipantEmails = payloadParticipantEmails == null ? Set.of() : Set.copyOf(payloadParticipantEmails);
    }

    public boolean hasInlineTranscript() {
        return inlineTranscriptText != null && !inlineTranscriptText.isBlank();
    }
}
