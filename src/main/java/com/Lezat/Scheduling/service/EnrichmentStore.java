package com.Lezat.Scheduling.service;

import com.Lezat.Scheduling.exception.NotFoundException;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.repository.TranscriptionRecordRepository;
import com.Lezat.Scheduling.service.normalize.MeetingEvent;
import com.Lezat.Scheduling.service.transcript.FetchedTranscript;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of transcription records. Every state change is one short transaction that writes the
 * whole row, so readers never see a transcript without its sentences and participants.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentStore {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final TranscriptionRecordRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscriptionRecord create(MeetingEvent event) {
        TranscriptionRecord record = new TranscriptionRecord();
        record.setProvider(event.provider());
        record.setEventType(event.eventType());
        record.setMeetingId(event.meetingId());
        record.setClientReferenceId(event.clientReferenceId());
        record.setTranscriptId(event.transcriptId());
        record.setMeetingPlatform(event.platform());
        record.setMeetingUrl(event.meetingUrl());
        record.setRawPayload(event.rawPayload());
        record.setEnrichmentStatus(TranscriptionRecord.EnrichmentStatus.RECEIVED);
        record.setReceivedAt(LocalDateTime.ofInstant(event.receivedAt(), ZoneOffset.UTC));
        TranscriptionRecord saved = repository.save(record);
        log.info("Store: record {} created for {} meeting {} (event {})", saved.getId(), event.provider().code(),
                event.meetingId(), event.eventType());
        return saved;
    }

    @Transactional(readOnly = true)
    public TranscriptionRecord get(String recordId) {
        return repository.findById(recordId)
                .orElseThrow(() -> new NotFoundException("Transcription record not found: " + recordId));
    }

    @Transactional(readOnly = true)
    public List<TranscriptionRecord> findByMeetingId(String meetingId) {
        return repository.findByMeetingIdOrderByReceivedAtDesc(meetingId);
    }

    @Transactional(readOnly = true)
    public Optional<TranscriptionRecord> latestForMeeting(String meetingId) {
        return repository.findFirstByMeetingIdOrderByReceivedAtDesc(meetingId);
    }

    @Transactional
    public TranscriptionRecord updateStatus(String recordId, TranscriptionRecord.EnrichmentStatus status, String error) {
        return updateStatus(List.of(recordId), status, error).get(0);
    }

    @Transactional
    public List<TranscriptionRecord> updateStatus(List<String> recordIds, TranscriptionRecord.EnrichmentStatus status, String error) {
        List<TranscriptionRecord> updated = new ArrayList<>();
        for (String id : recordIds) {
            TranscriptionRecord record = get(id);
            record.setEnrichmentStatus(status);
            record.setEnrichmentError(truncate(error));
            updated.add(repository.save(record));
            log.info("Store: record {} meeting {} -> {}", id, record.getMeetingId(), status);
        }
        return updated;
    }

    /** Writes transcript, sentences, participants and {@code TRANSCRIPT_READY} in one update. */
    @Transactional
    public TranscriptionRecord markTranscriptReady(String recordId, FetchedTranscript transcript) {
        return markTranscriptReady(List.of(recordId), transcript).get(0);
    }

    @Transactional
    public List<TranscriptionRecord> markTranscriptReady(List<String> recordIds, FetchedTranscript transcript) {
        List<TranscriptionRecord> updated = new ArrayList<>();
        for (String id : recordIds) {
            TranscriptionRecord record = get(id);
            record.setTranscriptText(transcript.text());
            record.setTranscriptSentences(new ArrayList<>(transcript.sentences()));
            record.setParticipantEmails(new LinkedHashSet<>(transcript.participantEmails()));
            if (transcript.transcriptId() != null) record.setTranscriptId(transcript.transcriptId());
            if (record.getMeetingUrl() == null) record.setMeetingUrl(transcript.meetingUrl());
            record.setEnrichmentStatus(TranscriptionRecord.EnrichmentStatus.TRANSCRIPT_READY);
            record.setEnrichmentError(null);
            updated.add(repository.save(record));
            log.info("Store: record {} meeting {} -> TRANSCRIPT_READY ({} sentences, {} participants)", id,
                    record.getMeetingId(), transcript.sentences().size(), transcript.participantEmails().size());
        }
        return updated;
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
