package com.Lezat.Scheduling.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/** Collects lower-cased, de-duplicated, sorted e-mail addresses out of attendee-like JSON. */
public final class ParticipantEmails {

    private ParticipantEmails() {
    }

    public static Set<String> collect(JsonNode root, String... paths) {
        Set<String> emails = new TreeSet<>();
        for (String path : paths) {
            addFrom(JsonPaths.at(root, path), emails);
        }
        return emails;
    }

    public static void addFrom(JsonNode node, Set<String> target) {
        if (node == null || node.isNull()) return;
        if (node.isArray()) {
            for (JsonNode item : node) addFrom(item, target);
        } else if (node.isObject()) {
            add(node.path("email").asText(null), target);
        } else if (node.isTextual()) {
            // Fireflies sends participants as one comma separated string at times
            for (String part : node.asText().split(",")) add(part, target);
        }
    }

    public static void add(String candidate, Set<String> target) {
        if (candidate == null) return;
        String email = candidate.trim().toLowerCase(Locale.ROOT);
        if (email.contains("@")) target.add(email);
    }
}
