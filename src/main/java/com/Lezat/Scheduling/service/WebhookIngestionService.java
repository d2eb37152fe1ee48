package com.Lezat.Scheduling.service;

import com.Lezat.Scheduling.exception.NotFoundException;
import com.Lezat.Scheduling.exception.ValidationException;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.repository.UserRepository;
import com.Lezat.Scheduling.service.normalize.MeetingEvent;
import com.Lezat.Scheduling.service.normalize.MeetingEventNormalizer;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.settings.UserSettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for provider webhooks. Validation and tenant lookup happen before anything is
 * stored; once the record exists the caller gets an accepted response whatever enrichment does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

    private final MeetingEventNormalizer normalizer;
    private final UserRepository userRepository;
    private final UserSettingsStore settingsStore;
    private final EnrichmentStore store;
    private final EnrichmentOrchestrator orchestrator;

    public TranscriptionRecord accept(String providerSegment, String clientReferenceId, String rawBody) {
        TranscriptionRecord.Provider provider = TranscriptionRecord.Provider.fromPathSegment(providerSegment)
                .orElseThrow(() -> new ValidationException("Unsupported provider: " + providerSegment));
        if (clientReferenceId == null || clientReferenceId.isBlank()) {
            throw new ValidationException("user_id path segment is required");
        }
        if (!userRepository.existsByClientReferenceId(clientReferenceId)) {
            log.warn("Webhook: rejected {} delivery for unknown user {}", provider.code(), clientReferenceId);
            throw new NotFoundException("User not found for webhook URL.");
        }
        MeetingEvent event = normalizer.normalize(provider, rawBody, clientReferenceId);

        TranscriptionRecord record = store.create(event);
        log.info("Webhook: accepted {} event '{}' for meeting {} user {} as record {}", provider.code(),
                event.eventType(), event.meetingId(), clientReferenceId, record.getId());
        try {
            IntegrationSettings settings = settingsStore.load(clientReferenceId);
            return orchestrator.enrich(record, event, settings);
        } catch (RuntimeException e) {
            log.error("Webhook: enrichment of record {} meeting {} failed unexpectedly: {}", record.getId(),
                    event.meetingId(), e.toString(), e);
            return markUnexpectedFailure(record.getId(), e);
        }
    }

    private TranscriptionRecord markUnexpectedFailure(String recordId, RuntimeException cause) {
        TranscriptionRecord current = store.get(recordId);
        TranscriptionRecord.EnrichmentStatus status = switch (current.getEnrichmentStatus()) {
            case RECEIVED, FETCHING_TRANSCRIPT -> TranscriptionRecord.EnrichmentStatus.FAILED;
            default -> TranscriptionRecord.EnrichmentStatus.FAILED_PARTIAL;
        };
        return store.updateStatus(recordId, status, "Unexpected error: " + cause.getMessage());
    }
}
