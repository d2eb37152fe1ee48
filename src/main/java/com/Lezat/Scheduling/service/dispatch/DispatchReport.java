package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.model.DispatchAttempt;

import java.util.List;

/** Per-destination results of one fan-out pass. */
public record DispatchReport(List<DestinationResult> results) {

    public DispatchReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean anyKanbanFailed() {
        return results.stream().anyMatch(r -> r.type() == DispatchAttempt.DestinationType.KANBAN && r.failed());
    }

    public long count(DispatchAttempt.DestinationType type, DispatchAttempt.Outcome outcome) {
        return results.stream().filter(r -> r.type() == type && r.outcome() == outcome).count();
    }

    public String firstKanbanError() {
        return results.stream()
                .filter(r -> r.type() == DispatchAttempt.DestinationType.KANBAN && r.failed())
                .map(r -> r.destination() + ": " + r.error())
                .findFirst()
                .orElse(null);
    }
}
