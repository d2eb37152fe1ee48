package com.Lezat.Scheduling.service.dispatch;

import com.Lezat.Scheduling.exception.DispatchException;
import com.Lezat.Scheduling.model.ActionItemCreation;
import com.Lezat.Scheduling.service.extraction.ExtractedTask;

public interface KanbanDestination {

    ActionItemCreation.DestinationKind kind();

    /** @return the provider's id for the created card or page */
    String createCard(ExtractedTask task, String meetingId) throws DispatchException;
}
