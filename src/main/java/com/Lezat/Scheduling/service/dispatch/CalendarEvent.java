package com.Lezat.Scheduling.service.dispatch;

/**
 * @param meetingLink Meet or Teams join URL when the event carries one
 */
public record CalendarEvent(String id, String meetingLink) {
}
