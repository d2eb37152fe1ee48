package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;

import java.time.ZoneId;
import java.util.Set;

public interface CalendarDestination {

    /** Stable name used in the dispatch ledger, e.g. {@code google_calendar}. */
    String name();

    /**
     * Creates an event on the task's due date. When the task asks for an online meeting the event
     * also requests a conference link, and {@code attendeeEmails} are invited.
     */
    CalendarEvent createEvent(ExtractedTask task, String meetingId, ZoneId zone, Set<String> attendeeEmails)
            throws DispatchException;
}
