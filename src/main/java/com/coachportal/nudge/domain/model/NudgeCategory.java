package com.coachportal.nudge.domain.model;

/**
 * Nudge kinds sent by the scheduler.
 *
 * The wire value is what the ledger and the template table store in {@code nudge_type}.
 */
public enum NudgeCategory {
    DAILY_DIGEST("daily_digest", "action_items"),
    WEEKLY_DIGEST("weekly_digest", "action_items"),
    GOAL_CHECKIN("goal_checkin", "session"),
    SESSION_PREP("session_prep", "session");

    private final String wireValue;
    private final String referenceKind;

    NudgeCategory(String wireValue, String referenceKind) {
        this.wireValue = wireValue;
        this.referenceKind = referenceKind;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Kind of domain object a nudge of this category refers to ({@code reference_type}).
     */
    public String referenceKind() {
        return referenceKind;
    }

    /**
     * Digest categories are driven by the recipient's frequency setting;
     * the others are driven by session data.
     */
    public boolean isDigest() {
        return this == DAILY_DIGEST || this == WEEKLY_DIGEST;
    }

    public static NudgeCategory fromWire(String value) {
        for (NudgeCategory category : values()) {
            if (category.wireValue.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown nudge category: " + value);
    }
}
