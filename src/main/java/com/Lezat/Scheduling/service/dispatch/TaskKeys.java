package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.service.extraction.ExtractedTask;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/** Idempotency key of an extracted task: normalized title plus due date. */
public final class TaskKeys {

    private TaskKeys() {
    }

    public static String fingerprint(ExtractedTask task) {
        String title = task.title() == null ? "" : task.title().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String due = task.dueDate() == null ? "" : task.dueDate().toString();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest((title + "|" + due).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
