package com.coachportal.nudge.domain.model;

import java.time.Instant;

/**
 * Coaching action item owned by the portal (action_items row).
 */
public record ActionItem(
        String id,
        String email,
        String text,
        String coachName,
        String status, // pending | completed | dismissed
        Instant createdAt) {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";
}
