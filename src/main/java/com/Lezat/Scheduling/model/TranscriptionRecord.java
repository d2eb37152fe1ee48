package com.Lezat.Scheduling.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * One accepted webhook delivery plus the enrichment derived from it.
 * Backfill updates these rows in place; it never inserts new ones.
 */
@Entity
@Table(name = "transcription_records", indexes = {
        @Index(name = "idx_transcription_meeting", columnList = "meetingId"),
        @Index(name = "idx_transcription_received", columnList = "receivedAt")
})
@Data
@ToString(exclude = {"rawPayload", "transcriptText", "transcriptSentences"})
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Provider provider;

    @Column(length = 128)
    private String eventType;

    @Column(nullable = false, length = 255)
    private String meetingId;

    @Column(nullable = false, length = 255)
    private String clientReferenceId;

    @Column(length = 255)
    private String transcriptId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MeetingPlatform meetingPlatform = MeetingPlatform.UNKNOWN;

    @Column(length = 1024)
    private String meetingUrl;

    @Lob
    @Column(nullable = false)
    private String rawPayload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EnrichmentStatus enrichmentStatus = EnrichmentStatus.RECEIVED;

    @Column(length = 2000)
    private String enrichmentError;

    @Lob
    private String transcriptText;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "transcription_sentences", joinColumns = @JoinColumn(name = "record_id"))
    @OrderColumn(name = "position")
    private List<TranscriptSentence> transcriptSentences = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "transcription_participants", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "email", length = 320)
    private Set<String> participantEmails = new LinkedHashSet<>();

    @Column(nullable = false)
    private LocalDateTime receivedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public enum Provider {
        FIREFLIES("fireflies"), READ_AI("read_ai");

        private final String code;

        Provider(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        /** Accepts the webhook path segment, e.g. {@code read-ai} or {@code read_ai}. */
        public static Optional<Provider> fromPathSegment(String segment) {
            if (segment == null) return Optional.empty();
            String normalized = segment.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (Provider p : values()) {
                if (p.code.equals(normalized)) return Optional.of(p);
            }
            return Optional.empty();
        }
    }

    public enum MeetingPlatform {
        GOOGLE_MEET, OTHER, UNKNOWN
    }

    public enum EnrichmentStatus {
        RECEIVED, FETCHING_TRANSCRIPT, TRANSCRIPT_READY, EXTRACTING_TASKS, DISPATCHED, FAILED_PARTIAL, FAILED
    }

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (this.receivedAt == null) {
            this.receivedAt = now;
        }
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.enrichmentStatus == null) {
            this.enrichmentStatus = EnrichmentStatus.RECEIVED;
        }
        if (this.meetingPlatform == null) {
            this.meetingPlatform = MeetingPlatform.UNKNOWN;
        }
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
