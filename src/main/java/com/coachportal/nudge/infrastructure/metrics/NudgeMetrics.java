package com.coachportal.nudge.infrastructure.metrics;

import com.coachportal.nudge.domain.model.NudgeCategory;

import java.time.Duration;

/**
 * Nudge lifecycle metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Nudges sent / failed per category
 * - Skipped candidates per category and reason
 * - Interaction callbacks per action and outcome
 * - Scheduler run duration
 */
public interface NudgeMetrics {

    /**
     * Record a nudge that was sent and written to the ledger.
     *
     * @param category Nudge category
     */
    void recordSent(NudgeCategory category);

    /**
     * Record a per-recipient failure.
     *
     * @param category Nudge category
     */
    void recordError(NudgeCategory category);

    /**
     * Record a candidate that was dropped without sending.
     *
     * @param category Nudge category
     * @param reason   OUT_OF_WINDOW, ALREADY_SENT, NO_CONTENT, IN_FLIGHT, DISABLED
     */
    void recordSkipped(NudgeCategory category, String reason);

    /**
     * Record an interaction callback.
     *
     * @param action  Clicked action id (or "unknown")
     * @param outcome HANDLED, IGNORED, REJECTED, FAILED
     */
    void recordInteraction(String action, String outcome);

    /**
     * Record the wall time of a scheduler run.
     *
     * @param elapsed Run duration
     * @param success Whether the run completed without a fatal error
     */
    void recordRun(Duration elapsed, boolean success);
}
