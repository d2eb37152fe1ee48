package com.Lezat.Scheduling.service.extraction;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Video platform an action item asks for when the task is itself a meeting to schedule.
 * {@code AUTO} means a meeting was requested without naming a platform.
 */
public enum OnlineMeetingPlatform {
    GOOGLE_MEET, MICROSOFT_TEAMS, AUTO;

    private static final Pattern GOOGLE_MEET_TEXT = Pattern.compile("\\b(google\\s+meet|meet\\.google|meet de google)\\b");
    private static final Pattern TEAMS_TEXT = Pattern.compile("\\b(microsoft\\s+teams|ms\\s+teams|teams)\\b");
    private static final Pattern AUTO_TEXT = Pattern.compile("\\bauto\\b");

    /** Reads a platform out of free text such as "by Google Meet" or "google_meet"; null when none is named. */
    public static OnlineMeetingPlatform detect(String text) {
        if (text == null || text.isBlank()) return null;
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replace('_', ' ');
        if (GOOGLE_MEET_TEXT.matcher(normalized).find()) return GOOGLE_MEET;
        if (TEAMS_TEXT.matcher(normalized).find()) return MICROSOFT_TEAMS;
        if (AUTO_TEXT.matcher(normalized).find()) return AUTO;
        return null;
    }

    /** Google Meet and Teams items invite the meeting's participants; {@code AUTO} ones do not. */
    public boolean isExplicit() {
        return this != AUTO;
    }
}
