package com.Lezat.Scheduling.service.extraction;

import java.time.LocalDate;

/**
 * @param onlineMeetingPlatform set when the task is a meeting to hold on a video platform, else null
 */
public record ExtractedTask(
        String title,
        String details,
        String assigneeEmail,
        String assigneeName,
        LocalDate dueDate,
        String sourceSentence,
        OnlineMeetingPlatform onlineMeetingPlatform
) {
    public ExtractedTask(String title, String details, String assigneeEmail, String assigneeName,
                         LocalDate dueDate, String sourceSentence) {
        this(title, details, assigneeEmail, assigneeName, dueDate, sourceSentence, null);
    }

    public boolean isExplicitOnlineMeeting() {
        return onlineMeetingPlatform != null && onlineMeetingPlatform.isExplicit();
    }
}
