package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.ActionItem;

import java.time.Instant;
import java.util.List;

/**
 * Coaching action items owned by the portal.
 */
public interface ActionItemRepository {

    /**
     * Pending items for a participant, newest first.
     *
     * @param email Participant email (matched case-insensitively)
     * @param limit Max rows
     */
    List<ActionItem> findPending(String email, int limit);

    /**
     * Mark an item completed. No-op if it is already completed.
     *
     * @return true if the item changed state
     */
    boolean markCompleted(String itemId, Instant completedAt);
}
