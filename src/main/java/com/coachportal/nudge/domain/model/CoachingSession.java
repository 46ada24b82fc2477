package com.coachportal.nudge.domain.model;

import java.time.LocalDate;

/**
 * Projection of a session_tracking row joined with the participant's directory entry.
 */
public record CoachingSession(
        String id,
        String employeeEmail,
        String employeeFirstName,
        String coachName,
        String goals,
        String status, // Upcoming | Completed | ...
        LocalDate sessionDate) {

    public static final String STATUS_UPCOMING = "Upcoming";
    public static final String STATUS_COMPLETED = "Completed";

    public boolean hasGoals() {
        return goals != null && !goals.isBlank();
    }

    public boolean isUpcoming() {
        return STATUS_UPCOMING.equalsIgnoreCase(status);
    }
}
