package com.Lezat.Scheduling.repository;

import com.Lezat.Scheduling.model.DispatchAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DispatchAttemptRepository extends JpaRepository<DispatchAttempt, Long> {
    List<DispatchAttempt> findByTranscriptionRecordIdOrderByAttemptedAtAscIdAsc(String transcriptionRecordId);

    Optional<DispatchAttempt> findFirstByMeetingIdAndDestinationAndTaskKeyAndOutcome(
            String meetingId, String destination, String taskKey, DispatchAttempt.Outcome outcome);
}
