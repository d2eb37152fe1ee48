package com.Lezat.Scheduling.service;

import com.Lezat.Scheduling.exception.ExtractionException;
import com.Lezat.Scheduling.exception.ProviderFetchException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.service.dispatch.DestinationDispatcher;
import com.Lezat.Scheduling.service.dispatch.DestinationResolver;
import com.Lezat.Scheduling.service.dispatch.DispatchReport;
import com.Lezat.Scheduling.service.dispatch.ResolvedDestinations;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import com.Lezat.Scheduling.service.extraction.TaskExtractor;
import com.Lezat.Scheduling.service.normalize.MeetingEvent;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.transcript.FetchedTranscript;
import com.Lezat.Scheduling.service.transcript.TranscriptFetcher;
import com.Lezat.Scheduling.service.transcript.TranscriptFetcherRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.Lezat.Scheduling.model.TranscriptionRecord.EnrichmentStatus.*;

/**
 * Drives one record through
 * {@code RECEIVED -> FETCHING_TRANSCRIPT -> TRANSCRIPT_READY -> EXTRACTING_TASKS -> DISPATCHED}.
 *
 * <p>Stopping early is not an error: non-completion events stay at {@code RECEIVED}, and users
 * without autosync, extraction or a Kanban destination stay at {@code TRANSCRIPT_READY}. Nothing is
 * retried inline; backfill is the retry path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentOrchestrator {

    private final EnrichmentStore store;
    private final TranscriptFetcherRegistry fetchers;
    private final TaskExtractor taskExtractor;
    private final DestinationResolver destinationResolver;
    private final DestinationDispatcher dispatcher;

    public TranscriptionRecord enrich(TranscriptionRecord record, MeetingEvent event, IntegrationSettings settings) {
        String recordId = record.getId();
        if (!event.completionEvent()) {
            log.info("Enrichment: record {} meeting {} event '{}' is not a completion event, keeping RECEIVED",
                    recordId, event.meetingId(), event.eventType());
            return record;
        }
        Optional<TranscriptFetcher> fetcher = fetchers.configuredFor(event.provider(), settings);
        if (!event.hasInlineTranscript() && fetcher.isEmpty()) {
            log.info("Enrichment: record {} meeting {} has no transcript source for {}, keeping RECEIVED",
                    recordId, event.meetingId(), event.provider().code());
            return record;
        }

        store.updateStatus(recordId, FETCHING_TRANSCRIPT, null);
        FetchedTranscript transcript;
        if (event.hasInlineTranscript()) {
            transcript = FetchedTranscript.inline(event.transcriptId(), event.inlineTranscriptText(), event.meetingUrl(),
                    event.inlineSentences());
        } else {
            try {
                transcript = fetcher.get().fetchTranscript(event.meetingId(), settings);
            } catch (ProviderFetchException e) {
                log.warn("Enrichment: record {} meeting {} transcript fetch failed: {}", recordId, event.meetingId(), e.getMessage());
                return store.updateStatus(recordId, FAILED, e.getMessage());
            }
        }
        TranscriptionRecord ready = store.markTranscriptReady(recordId, transcript.withFallbackEmails(event.payloadParticipantEmails()));
        return fanOut(List.of(recordId), ready, settings, ActionItemCreation.CreationSource.WEBHOOK);
    }

    /**
     * Extraction and dispatch for a record whose transcript is ready. The resulting status is applied
     * to every id in {@code recordIds}; {@code record} supplies the transcript and identity.
     *
     * @return {@code record} as persisted after this step
     */
    public TranscriptionRecord fanOut(List<String> recordIds, TranscriptionRecord record, IntegrationSettings settings,
                                      ActionItemCreation.CreationSource source) {
        if (!settings.autosyncEnabled()) {
            log.info("Enrichment: meeting {} autosync disabled for user {}, stopping at TRANSCRIPT_READY",
                    record.getMeetingId(), record.getClientReferenceId());
            return record;
        }
        if (!taskExtractor.isConfigured()) {
            log.info("Enrichment: meeting {} has no task extractor configured, stopping at TRANSCRIPT_READY", record.getMeetingId());
            return record;
        }
        ResolvedDestinations destinations = destinationResolver.resolve(settings);
        if (destinations == null || !destinations.canDispatch()) {
            log.info("Enrichment: meeting {} user {} has no Kanban destination, stopping at TRANSCRIPT_READY",
                    record.getMeetingId(), record.getClientReferenceId());
            return record;
        }

        store.updateStatus(recordIds, EXTRACTING_TASKS, null);
        List<ExtractedTask> tasks;
        try {
            tasks = taskExtractor.extractTasks(record.getMeetingId(), record.getTranscriptText(),
                    record.getTranscriptSentences(), record.getParticipantEmails());
        } catch (ExtractionException e) {
            log.warn("Enrichment: meeting {} task extraction failed: {}", record.getMeetingId(), e.getMessage());
            return pick(store.updateStatus(recordIds, FAILED_PARTIAL, "Task extraction failed: " + e.getMessage()), record);
        }

        DispatchReport report = dispatcher.dispatch(record, tasks == null ? List.of() : tasks, destinations,
                settings.timezone(), source);
        if (source == ActionItemCreation.CreationSource.BACKFILL) {
            dispatcher.retryCalendarSync(record, destinations, settings.timezone());
        }
        TranscriptionRecord.EnrichmentStatus status = report.anyKanbanFailed() ? FAILED_PARTIAL : DISPATCHED;
        log.info("Enrichment: meeting {} dispatched {} tasks, status {}", record.getMeetingId(),
                tasks == null ? 0 : tasks.size(), status);
        return pick(store.updateStatus(recordIds, status, report.firstKanbanError()), record);
    }

    private static TranscriptionRecord pick(List<TranscriptionRecord> updated, TranscriptionRecord record) {
        return updated.stream().filter(r -> r.getId().equals(record.getId())).findFirst().orElse(record);
    }
}
