package com.Lezat.Scheduling.model;

import com.Lezat.Scheduling.service.extraction.OnlineMeetingPlatform;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A task that was successfully created on a Kanban destination. The row is written right after the
 * card exists, before any calendar call, so calendar sync state is tracked separately.
 */
@Entity
@Table(name = "action_item_creations", uniqueConstraints = @UniqueConstraint(
        name = "uk_action_item_meeting_destination_task",
        columnNames = {"meetingId", "destinationKind", "taskKey"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionItemCreation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String meetingId;

    @Column(length = 64)
    private String transcriptionRecordId;

    @Column(nullable = false, length = 255)
    private String clientReferenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TranscriptionRecord.Provider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CreationSource source = CreationSource.WEBHOOK;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DestinationKind destinationKind;

    @Column(nullable = false, length = 255)
    private String destinationRef;

    @Column(nullable = false, length = 64)
    private String taskKey;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 4000)
    private String details;

    @Column(length = 320)
    private String assigneeEmail;

    @Column(length = 255)
    private String assigneeName;

    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private OnlineMeetingPlatform onlineMeetingPlatform;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CalendarSyncStatus calendarSyncStatus = CalendarSyncStatus.NOT_APPLICABLE;

    @Column(length = 255)
    private String calendarEventRef;

    @Column(length = 2000)
    private String calendarError;

    @Column(length = 1000)
    private String calendarMeetingLink;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public enum DestinationKind {
        NOTION, MONDAY
    }

    public enum CalendarSyncStatus {
        NOT_APPLICABLE, PENDING, SYNCED, FAILED
    }

    public enum CreationSource {
        WEBHOOK, BACKFILL
    }

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.calendarSyncStatus == null) {
            this.calendarSyncStatus = CalendarSyncStatus.NOT_APPLICABLE;
        }
        if (this.source == null) {
            this.source = CreationSource.WEBHOOK;
        }
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
