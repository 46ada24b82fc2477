package com.coachportal.nudge.domain.model;

/**
 * A recipient that survived eligibility and dedup for one category in one run.
 *
 * For session-driven categories {@code session} is the triggering session;
 * for digests it is null.
 */
public record NudgeCandidate(
        NudgeCategory category,
        RecipientPreference preference,
        String referenceId,
        String periodKey,
        CoachingSession session) {

    public String recipientId() {
        return preference.recipientId();
    }

    /**
     * Key that must be unique in the ledger.
     */
    public String dedupKey() {
        return recipientId().toLowerCase() + "|" + category.wireValue() + "|" + periodKey;
    }
}
