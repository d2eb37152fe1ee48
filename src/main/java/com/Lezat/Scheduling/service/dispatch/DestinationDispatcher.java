package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.model.DispatchAttempt;
import com.Lezat.Scheduling.model.TranscriptionRecord;
import com.Lezat.Scheduling.repository.ActionItemCreationRepository;
import com.Lezat.Scheduling.repository.DispatchAttemptRepository;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fans extracted tasks out to a user's Kanban and calendar destinations.
 *
 * <p>Every destination call is isolated: a failure is recorded as a FAILED attempt and the next
 * destination is still tried. A Kanban card is never created twice for the same meeting and task
 * key, and a calendar event is never created twice for the same calendar and task key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DestinationDispatcher {

    private final ActionItemCreationRepository creationRepository;
    private final DispatchAttemptRepository attemptRepository;

    public DispatchReport dispatch(TranscriptionRecord record, List<ExtractedTask> tasks, ResolvedDestinations destinations,
                                   ZoneId zone, ActionItemCreation.CreationSource source) {
        List<DestinationResult> results = new ArrayList<>();
        for (ExtractedTask task : tasks) {
            String taskKey = TaskKeys.fingerprint(task);
            for (KanbanDestination kanban : destinations.kanban()) {
                results.add(dispatchKanban(record, task, taskKey, kanban, !destinations.calendars().isEmpty(), source));
            }
            if (task.dueDate() != null && !destinations.calendars().isEmpty()) {
                results.addAll(syncCalendars(record, task, taskKey, destinations.calendars(), zone));
            }
        }
        return new DispatchReport(results);
    }

    /**
     * Retries calendar sync for cards created earlier whose calendar step is still pending or failed.
     */
    public DispatchReport retryCalendarSync(TranscriptionRecord record, ResolvedDestinations destinations, ZoneId zone) {
        if (destinations.calendars().isEmpty()) return new DispatchReport(List.of());
        List<DestinationResult> results = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        var open = creationRepository.findByMeetingIdAndCalendarSyncStatusIn(record.getMeetingId(),
                EnumSet.of(ActionItemCreation.CalendarSyncStatus.PENDING, ActionItemCreation.CalendarSyncStatus.FAILED));
        for (ActionItemCreation creation : open) {
            if (creation.getDueDate() == null || seen.contains(creation.getTaskKey())) continue;
            seen.add(creation.getTaskKey());
            ExtractedTask task = new ExtractedTask(creation.getTitle(), creation.getDetails(), creation.getAssigneeEmail(),
                    creation.getAssigneeName(), creation.getDueDate(), null, creation.getOnlineMeetingPlatform());
            results.addAll(syncCalendars(record, task, creation.getTaskKey(), destinations.calendars(), zone));
        }
        return new DispatchReport(results);
    }

    private DestinationResult dispatchKanban(TranscriptionRecord record, ExtractedTask task, String taskKey,
                                             KanbanDestination kanban, boolean calendarConfigured,
                                             ActionItemCreation.CreationSource source) {
        String name = kanban.kind().name().toLowerCase(Locale.ROOT);
        var existing = creationRepository.findByMeetingIdAndDestinationKindAndTaskKey(record.getMeetingId(), kanban.kind(), taskKey);
        if (existing.isPresent()) {
            log.info("Dispatch: meeting {} task '{}' already on {} as {}", record.getMeetingId(), task.title(), name,
                    existing.get().getDestinationRef());
            return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                    DispatchAttempt.Outcome.ALREADY_SYNCED, existing.get().getDestinationRef(), null);
        }

        String ref;
        try {
            ref = kanban.createCard(task, record.getMeetingId());
        } catch (DispatchException e) {
            log.warn("Dispatch: meeting {} task '{}' failed on {}: {}", record.getMeetingId(), task.title(), name, e.getMessage());
            return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                    DispatchAttempt.Outcome.FAILED, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Dispatch: meeting {} task '{}' hit an unexpected error on {}", record.getMeetingId(), task.title(), name, e);
            return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                    DispatchAttempt.Outcome.FAILED, null, describe(e));
        }

        ActionItemCreation creation = new ActionItemCreation();
        creation.setMeetingId(record.getMeetingId());
        creation.setTranscriptionRecordId(record.getId());
        creation.setClientReferenceId(record.getClientReferenceId());
        creation.setProvider(record.getProvider());
        creation.setSource(source);
        creation.setDestinationKind(kanban.kind());
        creation.setDestinationRef(truncate(ref, 255));
        creation.setTaskKey(taskKey);
        creation.setTitle(truncate(task.title(), 500));
        creation.setDetails(truncate(task.details(), 4000));
        creation.setAssigneeEmail(truncate(task.assigneeEmail(), 320));
        creation.setAssigneeName(truncate(task.assigneeName(), 255));
        creation.setDueDate(task.dueDate());
        creation.setOnlineMeetingPlatform(task.onlineMeetingPlatform());
        creation.setCalendarSyncStatus(task.dueDate() != null && calendarConfigured
                ? ActionItemCreation.CalendarSyncStatus.PENDING
                : ActionItemCreation.CalendarSyncStatus.NOT_APPLICABLE);
        try {
            creationRepository.save(creation);
        } catch (DataIntegrityViolationException e) {
            if (creationRepository.findByMeetingIdAndDestinationKindAndTaskKey(record.getMeetingId(), kanban.kind(), taskKey).isPresent()) {
                // a concurrent delivery for the same meeting got there first
                log.warn("Dispatch: meeting {} task '{}' on {} was recorded concurrently, card {} is a duplicate",
                        record.getMeetingId(), task.title(), name, ref);
                return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                        DispatchAttempt.Outcome.ALREADY_SYNCED, ref, null);
            }
            log.error("Dispatch: meeting {} card {} on {} could not be recorded", record.getMeetingId(), ref, name, e);
            return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                    DispatchAttempt.Outcome.FAILED, ref, "Card created but not recorded: " + describe(e));
        }
        log.info("Dispatch: meeting {} task '{}' created on {} as {}", record.getMeetingId(), task.title(), name, ref);
        return recordAttempt(record, name, DispatchAttempt.DestinationType.KANBAN, taskKey, task.title(),
                DispatchAttempt.Outcome.CREATED, ref, null);
    }

    private List<DestinationResult> syncCalendars(TranscriptionRecord record, ExtractedTask task, String taskKey,
                                                  List<CalendarDestination> calendars, ZoneId zone) {
        List<ActionItemCreation> creations = creationRepository.findByMeetingIdAndTaskKey(record.getMeetingId(), taskKey);
        if (creations.isEmpty()) {
            // no card made it, so there is nothing to hang an event off
            return List.of();
        }
        List<DestinationResult> results = new ArrayList<>();
        String eventRef = null;
        String meetingLink = null;
        String error = null;
        Set<String> attendees = task.isExplicitOnlineMeeting() ? record.getParticipantEmails() : Set.of();
        for (CalendarDestination calendar : calendars) {
            var previous = attemptRepository.findFirstByMeetingIdAndDestinationAndTaskKeyAndOutcome(
                    record.getMeetingId(), calendar.name(), taskKey, DispatchAttempt.Outcome.CREATED);
            if (previous.isPresent()) {
                eventRef = eventRef == null ? previous.get().getReference() : eventRef;
                results.add(recordAttempt(record, calendar.name(), DispatchAttempt.DestinationType.CALENDAR, taskKey,
                        task.title(), DispatchAttempt.Outcome.ALREADY_SYNCED, previous.get().getReference(), null));
                continue;
            }
            try {
                CalendarEvent event = calendar.createEvent(task, record.getMeetingId(), zone,
                        attendees == null ? Set.of() : attendees);
                eventRef = eventRef == null ? event.id() : eventRef;
                meetingLink = meetingLink == null ? event.meetingLink() : meetingLink;
                log.info("Dispatch: meeting {} task '{}' scheduled on {} as {}", record.getMeetingId(), task.title(),
                        calendar.name(), event.id());
                results.add(recordAttempt(record, calendar.name(), DispatchAttempt.DestinationType.CALENDAR, taskKey,
                        task.title(), DispatchAttempt.Outcome.CREATED, event.id(), null));
            } catch (DispatchException e) {
                error = calendar.name() + ": " + e.getMessage();
                log.warn("Dispatch: meeting {} task '{}' calendar sync failed on {}: {}", record.getMeetingId(), task.title(),
                        calendar.name(), e.getMessage());
                results.add(recordAttempt(record, calendar.name(), DispatchAttempt.DestinationType.CALENDAR, taskKey,
                        task.title(), DispatchAttempt.Outcome.FAILED, null, e.getMessage()));
            } catch (RuntimeException e) {
                error = calendar.name() + ": " + describe(e);
                log.error("Dispatch: meeting {} task '{}' hit an unexpected error on {}", record.getMeetingId(), task.title(),
                        calendar.name(), e);
                results.add(recordAttempt(record, calendar.name(), DispatchAttempt.DestinationType.CALENDAR, taskKey,
                        task.title(), DispatchAttempt.Outcome.FAILED, null, describe(e)));
            }
        }

        for (ActionItemCreation creation : creations) {
            if (creation.getCalendarSyncStatus() == ActionItemCreation.CalendarSyncStatus.SYNCED) continue;
            if (error == null) {
                creation.setCalendarSyncStatus(ActionItemCreation.CalendarSyncStatus.SYNCED);
                creation.setCalendarEventRef(truncate(eventRef, 255));
                creation.setCalendarMeetingLink(truncate(meetingLink, 1000));
                creation.setCalendarError(null);
            } else {
                creation.setCalendarSyncStatus(ActionItemCreation.CalendarSyncStatus.FAILED);
                creation.setCalendarError(truncate(error, 2000));
            }
            creationRepository.save(creation);
        }
        return results;
    }

    private DestinationResult recordAttempt(TranscriptionRecord record, String destination, DispatchAttempt.DestinationType type,
                                            String taskKey, String title, DispatchAttempt.Outcome outcome,
                                            String reference, String error) {
        DispatchAttempt attempt = new DispatchAttempt();
        attempt.setTranscriptionRecordId(record.getId());
        attempt.setMeetingId(record.getMeetingId());
        attempt.setDestination(destination);
        attempt.setDestinationType(type);
        attempt.setTaskKey(taskKey);
        attempt.setTaskTitle(truncate(title, 500));
        attempt.setOutcome(outcome);
        attempt.setReference(truncate(reference, 255));
        attempt.setError(truncate(error, 2000));
        attemptRepository.save(attempt);
        return new DestinationResult(destination, type, taskKey, title, outcome, reference, error);
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
