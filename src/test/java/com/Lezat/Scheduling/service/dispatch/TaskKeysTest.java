package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.service.extraction.ExtractedTask;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TaskKeysTest {

    @Test
    void ignoresCaseAndSpacingButNotDueDate() {
        LocalDate due = LocalDate.parse("2024-01-10");
        String a = TaskKeys.fingerprint(new ExtractedTask("Send  the Proposal ", "x", null, null, due, null));
        String b = TaskKeys.fingerprint(new ExtractedTask("send the proposal", "other details", "a@x.com", null, due, null));
        String c = TaskKeys.fingerprint(new ExtractedTask("send the proposal", null, null, null, due.plusDays(1), null));
        String d = TaskKeys.fingerprint(new ExtractedTask("send the proposal", null, null, null, null, null));

        assertEquals(a, b);
        assertNotEquals(a, c);
        assertNotEquals(a, d);
        assertEquals(64, a.length());
    }
}
