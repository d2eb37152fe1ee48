package com.Lezat.Scheduling.service.transcript;

import com.Lezat.Scheduling.model.TranscriptSentence;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record FetchedTranscript(
        String transcriptId,
        String text,
        String meetingUrl,
        List<TranscriptSentence> sentences,
        Set<String> participantEmails
) {
    public FetchedTranscript {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        participantEmails = participantEmails == null ? Set.of() : Set.copyOf(new TreeSet<>(participantEmails));
    }

    public static FetchedTranscript inline(String transcriptId, String text, String meetingUrl,
                                           List<TranscriptSentence> sentences) {
        return new FetchedTranscript(transcriptId, text, meetingUrl, sentences, Set.of());
    }

    /** Keeps the transcript's own e-mails; falls back to the given ones when it has none. */
    public FetchedTranscript withFallbackEmails(Set<String> fallback) {
        if (!participantEmails.isEmpty() || fallback == null || fallback.isEmpty()) return this;
        return new FetchedTranscript(transcriptId, text, meetingUrl, sentences, fallback);
    }
}
