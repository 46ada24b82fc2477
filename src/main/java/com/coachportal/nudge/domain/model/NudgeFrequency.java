package com.coachportal.nudge.domain.model;

/**
 * Recipient's digest cadence as chosen in the settings UI.
 */
public enum NudgeFrequency {
    SMART, // event-driven nudges only (goal check-ins, session prep)
    DAILY,
    WEEKLY,
    NONE;

    /**
     * Parse the stored value. Unknown or missing values fall back to SMART,
     * which is the column default.
     */
    public static NudgeFrequency fromDb(String value) {
        if (value == null || value.isBlank()) {
            return SMART;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return SMART;
        }
    }

    public String dbValue() {
        return name().toLowerCase();
    }
}
