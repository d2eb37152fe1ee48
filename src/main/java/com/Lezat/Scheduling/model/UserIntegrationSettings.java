package com.Lezat.Scheduling.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Per-user destination credentials. Owned by the settings screens; the sync pipeline only reads it.
 */
@Entity
@Table(name = "user_integration_settings")
@Data
@ToString(of = {"clientReferenceId", "autosyncEnabled", "timezone"})
@NoArgsConstructor
@AllArgsConstructor
public class UserIntegrationSettings {
    @Id
    @Column(length = 255)
    private String clientReferenceId;

    @Column(nullable = false)
    private Boolean autosyncEnabled = Boolean.TRUE;

    @Column(length = 64)
    private String timezone;

    @Column(length = 512)
    private String firefliesApiKey;

    @Column(length = 512)
    private String readAiApiKey;

    // Notion
    @Column(length = 512)
    private String notionToken;
    @Column(length = 128)
    private String notionDatabaseId;
    @Column(length = 128)
    private String notionTitleProperty;
    @Column(length = 128)
    private String notionStatusProperty;
    @Column(length = 128)
    private String notionDueDateProperty;
    @Column(length = 128)
    private String notionDetailsProperty;
    @Column(length = 128)
    private String notionMeetingIdProperty;
    @Column(length = 128)
    private String notionTodoStatus;

    // Monday
    @Column(length = 512)
    private String mondayToken;
    @Column(length = 64)
    private String mondayBoardId;
    @Column(length = 64)
    private String mondayGroupId;
    @Column(length = 64)
    private String mondayStatusColumnId;
    @Column(length = 64)
    private String mondayDateColumnId;
    @Column(length = 64)
    private String mondayDetailsColumnId;
    @Column(length = 64)
    private String mondayMeetingIdColumnId;
    @Column(length = 128)
    private String mondayTodoLabel;

    // Google Calendar
    @Column(length = 2048)
    private String googleAccessToken;
    @Column(length = 1024)
    private String googleRefreshToken;
    @Column(length = 255)
    private String googleCalendarId;
    @Column(length = 255)
    private String googleClientId;
    @Column(length = 255)
    private String googleClientSecret;

    // Outlook Calendar
    @Column(length = 4096)
    private String outlookAccessToken;
    @Column(length = 4096)
    private String outlookRefreshToken;
    @Column(length = 255)
    private String outlookClientId;
    @Column(length = 255)
    private String outlookClientSecret;
    @Column(length = 255)
    private String outlookTenantId;

    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        this.updatedAt = LocalDateTime.now();
        if (this.autosyncEnabled == null) {
            this.autosyncEnabled = Boolean.TRUE;
        }
    }
}
