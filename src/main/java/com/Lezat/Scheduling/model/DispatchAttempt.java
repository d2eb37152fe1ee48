package com.Lezat.Scheduling.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Outcome of one call (or skipped call) against one destination for one task. */
@Entity
@Table(name = "dispatch_attempts", indexes = {
        @Index(name = "idx_dispatch_record", columnList = "transcriptionRecordId"),
        @Index(name = "idx_dispatch_meeting_task", columnList = "meetingId,taskKey")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DispatchAttempt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String transcriptionRecordId;

    @Column(nullable = false, length = 255)
    private String meetingId;

    @Column(nullable = false, length = 64)
    private String destination;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DestinationType destinationType;

    @Column(nullable = false, length = 64)
    private String taskKey;

    @Column(length = 500)
    private String taskTitle;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Outcome outcome;

    @Column(length = 255)
    private String reference;

    @Column(length = 2000)
    private String error;

    @Column(nullable = false)
    private LocalDateTime attemptedAt;

    public enum DestinationType {
        KANBAN, CALENDAR
    }

    public enum Outcome {
        CREATED, ALREADY_SYNCED, FAILED
    }

    @PrePersist
    public void prePersist() {
        if (this.attemptedAt == null) {
            this.attemptedAt = LocalDateTime.now();
        }
    }
}
