package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.model.DispatchAttempt;

public record DestinationResult(
        String destination,
        DispatchAttempt.DestinationType type,
        String taskKey,
        String taskTitle,
        DispatchAttempt.Outcome outcome,
        String reference,
        String error
) {
    public boolean failed() {
        return outcome == DispatchAttempt.Outcome.FAILED;
    }
}
