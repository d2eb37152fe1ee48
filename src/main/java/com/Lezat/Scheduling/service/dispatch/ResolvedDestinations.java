package com.Lezat.Scheduling.service.dispatch;

import java.util.List;

public record ResolvedDestinations(List<KanbanDestination> kanban, List<CalendarDestination> calendars) {

    public ResolvedDestinations {
        kanban = kanban == null ? List.of() : List.copyOf(kanban);
        calendars = calendars == null ? List.of() : List.copyOf(calendars);
    }

    public static ResolvedDestinations none() {
        return new ResolvedDestinations(List.of(), List.of());
    }

    /** Calendar events hang off Kanban cards, so a Kanban destination is what makes fan-out possible. */
    public boolean canDispatch() {
        return !kanban.isEmpty();
    }
}
