package com.Lezat.Scheduling.service;

import com.Lezat.Scheduling.exception.NotFoundException;
import com.Lezat.Scheduling.exception.ProviderFetchException;
import com.Lezat.Scheduling.exception.ValidationException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.settings.UserSettingsStore;
import com.Lezat.Scheduling.service.transcript.FetchedTranscript;
import com.Lezat.Scheduling.service.transcript.TranscriptFetcher;
import com.Lezat.Scheduling.service.transcript.TranscriptFetcherRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Re-fetches the transcript of an existing meeting and re-runs extraction and dispatch. Records are
 * updated in place; cards and events already created are not created again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillReconciler {

    private final EnrichmentStore store;
    private final TranscriptFetcherRegistry fetchers;
    private final UserSettingsStore settingsStore;
    private final EnrichmentOrchestrator orchestrator;

    public BackfillResult backfill(String meetingId) {
        List<TranscriptionRecord> records = store.findByMeetingId(meetingId);
        if (records.isEmpty()) {
            throw new NotFoundException("No transcription records found for meeting " + meetingId);
        }
        TranscriptionRecord latest = records.get(0);
        IntegrationSettings settings = settingsStore.load(latest.getClientReferenceId());
        TranscriptFetcher fetcher = fetchers.configuredFor(latest.getProvider(), settings)
                .orElseThrow(() -> new ValidationException("Backfill is not available for provider "
                        + latest.getProvider().code() + ": transcript API not configured"));
        List<String> ids = records.stream().map(TranscriptionRecord::getId).toList();

        log.info("Backfill: meeting {} ({} records) refetching from {}", meetingId, ids.size(), latest.getProvider().code());
        store.updateStatus(ids, TranscriptionRecord.EnrichmentStatus.FETCHING_TRANSCRIPT, null);
        try {
            return refetchAndFanOut(meetingId, ids, latest, fetcher, settings);
        } catch (RuntimeException e) {
            log.error("Backfill: meeting {} aborted", meetingId, e);
            store.updateStatus(ids, TranscriptionRecord.EnrichmentStatus.FAILED_PARTIAL, "Backfill aborted: " + e.getMessage());
            throw e;
        }
    }

    private BackfillResult refetchAndFanOut(String meetingId, List<String> ids, TranscriptionRecord latest,
                                            TranscriptFetcher fetcher, IntegrationSettings settings) {
        FetchedTranscript transcript;
        try {
            transcript = fetcher.fetchTranscript(meetingId, settings);
        } catch (ProviderFetchException e) {
            log.warn("Backfill: meeting {} transcript fetch failed: {}", meetingId, e.getMessage());
            List<TranscriptionRecord> failed = store.updateStatus(ids, TranscriptionRecord.EnrichmentStatus.FAILED, e.getMessage());
            return new BackfillResult(meetingId, failed.size(), pickLatest(failed, latest));
        }

        List<TranscriptionRecord> ready = store.markTranscriptReady(ids, transcript.withFallbackEmails(latest.getParticipantEmails()));
        TranscriptionRecord result = orchestrator.fanOut(ids, pickLatest(ready, latest), settings,
                ActionItemCreation.CreationSource.BACKFILL);
        log.info("Backfill: meeting {} finished with status {}", meetingId, result.getEnrichmentStatus());
        return new BackfillResult(meetingId, ids.size(), result);
    }

    private static TranscriptionRecord pickLatest(List<TranscriptionRecord> updated, TranscriptionRecord latest) {
        return updated.stream().filter(r -> r.getId().equals(latest.getId())).findFirst().orElse(latest);
    }

    public record BackfillResult(String meetingId, int updatedCount, TranscriptionRecord record) {}
}
