package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public interface PayloadNormalizer {

    TranscriptionRecord.Provider provider();

    MeetingEvent normalize(JsonNode payload, String rawPayload, String clientReferenceId, Instant receivedAt);
}
