package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.model.TranscriptionRecord;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class ReadAiPayloadNormalizer extends AbstractPayloadNormalizer {

    @Override
    public TranscriptionRecord.Provider provider() {
        return TranscriptionRecord.Provider.READ_AI;
    }

    @Override
    protected String[] meetingIdPaths() {
        return new String[]{"meeting.external_id", "meeting.id", "meeting.meeting_id", "session_id", "meeting_id", "meetingId"};
    }

    @Override
    protected String[] eventTypePaths() {
        return new String[]{"event_type", "eventType", "event", "trigger", "type"};
    }

    @Override
    protected String[] transcriptIdPaths() {
        return new String[]{"transcript.id", "transcript_id", "transcriptId"};
    }

    @Override
    protected String[] inlineTranscriptPaths() {
        return new String[]{"transcript.text", "transcript.content", "transcript", "summary.transcript",
                "data.transcript.text", "data.transcript", "meeting.transcript"};
    }

    @Override
    protected String[] inlineSentencePaths() {
        return new String[]{"transcript.speaker_blocks", "transcript.sentences", "sentences"};
    }

    @Override
    protected Set<String> completionEvents() {
        return Set.of("meeting_completed", "meeting_end");
    }
}
