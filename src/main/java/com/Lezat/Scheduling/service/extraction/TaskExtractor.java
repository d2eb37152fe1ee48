package com.Lezat.Scheduling.service.extraction;

import com.Lezat.Scheduling.exception.ExtractionException;
import com.Lezat.Scheduling.model.TranscriptSentence;

import java.util.List;
import java.util.Set;

/** Turns a transcript into concrete action items. */
public interface TaskExtractor {

    boolean isConfigured();

    List<ExtractedTask> extractTasks(String meetingId,
                                     String transcriptText,
                                     List<TranscriptSentence> sentences,
                                     Set<String> participantEmails) throws ExtractionException;
}
