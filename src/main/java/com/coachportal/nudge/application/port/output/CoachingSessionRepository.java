package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.CoachingSession;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read access to session_tracking joined with the employee directory.
 */
public interface CoachingSessionRepository {

    /**
     * Completed sessions dated within [from, to] that carry a goal statement.
     */
    List<CoachingSession> findCompletedWithGoalsBetween(LocalDate from, LocalDate to);

    /**
     * Upcoming sessions scheduled on the given date.
     */
    List<CoachingSession> findUpcomingOn(LocalDate date);

    Optional<CoachingSession> findById(String sessionId);
}
