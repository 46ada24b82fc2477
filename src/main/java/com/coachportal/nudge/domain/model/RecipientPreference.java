package com.coachportal.nudge.domain.model;

/**
 * A participant's notification settings and chat binding
 * (employee_slack_connections row). Read-only to this service.
 */
public record RecipientPreference(
        String recipientId, // email
        boolean enabled,
        NudgeFrequency frequency,
        String preferredLocalTime, // HH:MM[:SS]
        String timezone, // IANA name, may be malformed
        String workspaceId,
        String chatUserId,
        String channelId) {

    public boolean acceptsEventNudges() {
        return enabled && frequency != NudgeFrequency.NONE;
    }

    public boolean acceptsDigest(NudgeCategory category) {
        if (!enabled) {
            return false;
        }
        return switch (category) {
            case DAILY_DIGEST -> frequency == NudgeFrequency.DAILY;
            case WEEKLY_DIGEST -> frequency == NudgeFrequency.WEEKLY;
            default -> false;
        };
    }
}
