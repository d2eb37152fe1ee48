package com.Lezat.Scheduling.repository;

import com.Lezat.Scheduling.model.ActionItemCreation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ActionItemCreationRepository extends JpaRepository<ActionItemCreation, Long> {
    Optional<ActionItemCreation> findByMeetingIdAndDestinationKindAndTaskKey(
            String meetingId, ActionItemCreation.DestinationKind destinationKind, String taskKey);

    List<ActionItemCreation> findByMeetingIdAndTaskKey(String meetingId, String taskKey);

    List<ActionItemCreation> findByMeetingIdOrderByCreatedAtAsc(String meetingId);

    List<ActionItemCreation> findByMeetingIdAndCalendarSyncStatusIn(
            String meetingId, Collection<ActionItemCreation.CalendarSyncStatus> statuses);
}
