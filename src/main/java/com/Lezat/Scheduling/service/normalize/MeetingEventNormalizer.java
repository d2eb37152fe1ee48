package com.Lezat.Scheduling.service.normalize;

import com.Lezat.Scheduling.exception.ValidationException;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a raw webhook body and hands it to the normalizer registered for the provider.
 */
@Service
public class MeetingEventNormalizer {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<TranscriptionRecord.Provider, PayloadNormalizer> normalizers = new EnumMap<>(TranscriptionRecord.Provider.class);

    public MeetingEventNormalizer(List<PayloadNormalizer> normalizers) {
        for (PayloadNormalizer n : normalizers) {
            this.normalizers.put(n.provider(), n);
        }
    }

    public MeetingEvent normalize(TranscriptionRecord.Provider provider, String rawBody, String clientReferenceId) {
        if (provider == null) {
            throw new ValidationException("Unsupported provider");
        }
        PayloadNormalizer normalizer = normalizers.get(provider);
        if (normalizer == null) {
            throw new ValidationException("Unsupported provider: " + provider.code());
        }
        if (rawBody == null || rawBody.isBlank()) {
            throw new ValidationException("Webhook payload is empty");
        }
        JsonNode payload;
        try {
            payload = mapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Webhook payload is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("Webhook payload must be a JSON object");
        }
        return normalizer.normalize(payload, rawBody, clientReferenceId, Instant.now());
    }
}
