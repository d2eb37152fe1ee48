package com.Lezat.Scheduling.repository;

import com.Lezat.Scheduling.model.TranscriptionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TranscriptionRecordRepository extends JpaRepository<TranscriptionRecord, String> {
    List<TranscriptionRecord> findByMeetingIdOrderByReceivedAtDesc(String meetingId);

    Optional<TranscriptionRecord> findFirstByMeetingIdOrderByReceivedAtDesc(String meetingId);

    List<TranscriptionRecord> findAllByOrderByReceivedAtDesc(Pageable pageable);

    long countByMeetingId(String meetingId);
}
