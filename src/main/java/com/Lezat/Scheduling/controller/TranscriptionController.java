package com.Lezat.Scheduling.controller;

import com.Lezat.Scheduling.controller.dto.TranscriptionDtos;
import com.Lezat.Scheduling.exception.NotFoundException;
import com.Lezat.Scheduling.exception.ValidationException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.model.DispatchAttempt;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.repository.ActionItemCreationRepository;
import com.Lezat.Scheduling.repository.DispatchAttemptRepository;
import com.Lezat.Scheduling.repository.TranscriptionRecordRepository;
import com.Lezat.Scheduling.service.BackfillReconciler;
import com.Lezat.Scheduling.service.WebhookIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/transcriptions")
@RequiredArgsConstructor
public class TranscriptionController {

    private final WebhookIngestionService ingestionService;
    private final BackfillReconciler backfillReconciler;
    private final TranscriptionRecordRepository recordRepository;
    private final ActionItemCreationRepository creationRepository;
    private final DispatchAttemptRepository attemptRepository;

    @Value("${app.transcriptions.max-list-limit:200}")
    private int maxListLimit;

    @PostMapping("/webhooks/{provider}/{clientReferenceId}")
    public ResponseEntity<TranscriptionDtos.WebhookAccepted> receiveWebhook(
            @PathVariable("provider") String provider,
            @PathVariable("clientReferenceId") String clientReferenceId,
            @RequestBody(required = false) String body
    ) {
        TranscriptionRecord record = ingestionService.accept(provider, clientReferenceId, body);
        List<DispatchAttempt> attempts = attemptRepository.findByTranscriptionRecordIdOrderByAttemptedAtAscIdAsc(record.getId());
        int created = (int) attempts.stream()
                .filter(a -> a.getDestinationType() == DispatchAttempt.DestinationType.KANBAN
                        && a.getOutcome() == DispatchAttempt.Outcome.CREATED)
                .count();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TranscriptionDtos.WebhookAccepted(
                record.getId(),
                record.getProvider().code(),
                record.getMeetingId(),
                record.getEventType(),
                record.getMeetingPlatform(),
                record.getEnrichmentStatus(),
                record.getEnrichmentError(),
                created,
                record.getReceivedAt()
        ));
    }

    // Webhook URLs without a user are rejected before anything is parsed or stored
    @PostMapping("/webhooks/{provider}")
    public ResponseEntity<TranscriptionDtos.WebhookAccepted> receiveUnscopedWebhook(@PathVariable("provider") String provider) {
        throw new ValidationException("user_id is required in the webhook URL");
    }

    @GetMapping("/received")
    public List<TranscriptionDtos.ListItem> listReceived(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, maxListLimit));
        return recordRepository.findAllByOrderByReceivedAtDesc(PageRequest.of(0, bounded)).stream()
                .map(r -> new TranscriptionDtos.ListItem(
                        r.getId(),
                        r.getProvider().code(),
                        r.getMeetingId(),
                        r.getClientReferenceId(),
                        r.getEventType(),
                        r.getMeetingPlatform(),
                        r.getEnrichmentStatus(),
                        r.getReceivedAt()))
                .toList();
    }

    @GetMapping("/received/{recordId}")
    public TranscriptionDtos.Detail getReceived(@PathVariable("recordId") String recordId) {
        TranscriptionRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new NotFoundException("Transcription record not found: " + recordId));
        return toDetail(record);
    }

    @GetMapping("/received/by-meeting/{meetingId}")
    public TranscriptionDtos.Detail getLatestForMeeting(@PathVariable("meetingId") String meetingId) {
        TranscriptionRecord record = recordRepository.findFirstByMeetingIdOrderByReceivedAtDesc(meetingId)
                .orElseThrow(() -> new NotFoundException("No transcription records found for meeting " + meetingId));
        return toDetail(record);
    }

    @GetMapping("/action-items")
    public List<TranscriptionDtos.ActionItemDTO> listActionItems(@RequestParam("meetingId") String meetingId) {
        return creationRepository.findByMeetingIdOrderByCreatedAtAsc(meetingId).stream()
                .map(TranscriptionController::toActionItem)
                .toList();
    }

    @PostMapping("/backfill/{meetingId}")
    public TranscriptionDtos.BackfillResponse backfill(@PathVariable("meetingId") String meetingId) {
        BackfillReconciler.BackfillResult result = backfillReconciler.backfill(meetingId);
        return new TranscriptionDtos.BackfillResponse(result.meetingId(), result.updatedCount(), toDetail(result.record()));
    }

    private TranscriptionDtos.Detail toDetail(TranscriptionRecord r) {
        List<TranscriptionDtos.SentenceDTO> sentences = new ArrayList<>();
        r.getTranscriptSentences().forEach(s ->
                sentences.add(new TranscriptionDtos.SentenceDTO(s.getSpeaker(), s.getStartTime(), s.getEndTime(), s.getText())));
        List<TranscriptionDtos.ActionItemDTO> actionItems = creationRepository.findByMeetingIdOrderByCreatedAtAsc(r.getMeetingId())
                .stream().map(TranscriptionController::toActionItem).toList();
        List<TranscriptionDtos.DispatchResultDTO> dispatchResults = attemptRepository
                .findByTranscriptionRecordIdOrderByAttemptedAtAscIdAsc(r.getId()).stream()
                .map(a -> new TranscriptionDtos.DispatchResultDTO(a.getDestination(), a.getDestinationType(), a.getTaskTitle(),
                        a.getOutcome(), a.getReference(), a.getError(), a.getAttemptedAt()))
                .toList();
        return new TranscriptionDtos.Detail(
                r.getId(),
                r.getProvider().code(),
                r.getMeetingId(),
                r.getClientReferenceId(),
                r.getEventType(),
                r.getTranscriptId(),
                r.getMeetingPlatform(),
                r.getMeetingUrl(),
                r.getEnrichmentStatus(),
                r.getEnrichmentError(),
                r.getTranscriptText(),
                sentences,
                r.getParticipantEmails(),
                r.getRawPayload(),
                actionItems,
                dispatchResults,
                r.getReceivedAt(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }

    private static TranscriptionDtos.ActionItemDTO toActionItem(ActionItemCreation c) {
        return new TranscriptionDtos.ActionItemDTO(c.getId(), c.getDestinationKind(), c.getDestinationRef(), c.getTitle(),
                c.getAssigneeEmail(), c.getDueDate(), c.getOnlineMeetingPlatform(), c.getSource(), c.getCalendarSyncStatus(),
                c.getCalendarEventRef(), c.getCalendarMeetingLink(), c.getCalendarError());
    }
}
