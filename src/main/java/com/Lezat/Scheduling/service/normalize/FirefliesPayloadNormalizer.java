package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.model.TranscriptionRecord;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class FirefliesPayloadNormalizer extends AbstractPayloadNormalizer {

    @Override
    public TranscriptionRecord.Provider provider() {
        return TranscriptionRecord.Provider.FIREFLIES;
    }

    @Override
    protected String[] meetingIdPaths() {
        return new String[]{"meetingId", "meeting_id", "meeting.id", "meeting.meeting_id", "meeting.external_id"};
    }

    @Override
    protected String[] eventTypePaths() {
        return new String[]{"eventType", "event_type", "event", "type"};
    }

    @Override
    protected String[] transcriptIdPaths() {
        return new String[]{"transcriptId", "transcript_id", "transcript.id", "transcript.transcript_id"};
    }

    @Override
    protected String[] inlineTranscriptPaths() {
        return new String[]{"transcript.text", "transcript.content", "transcript.full_text"};
    }

    @Override
    protected String[] inlineSentencePaths() {
        return new String[]{"sentences", "transcript.sentences"};
    }

    @Override
    protected Set<String> completionEvents() {
        return Set.of("transcription_completed");
    }
}
