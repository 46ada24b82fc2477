package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.NudgeFrequency;
import com.coachportal.nudge.domain.model.RecipientPreference;

import java.util.List;
import java.util.Optional;

/**
 * Read access to employee_slack_connections. Owned by the settings UI.
 */
public interface RecipientPreferenceRepository {

    /**
     * All enabled recipients with the given digest frequency.
     */
    List<RecipientPreference> findEnabledByFrequency(NudgeFrequency frequency);

    /**
     * Preference for a recipient, matched case-insensitively on email.
     */
    Optional<RecipientPreference> findByRecipient(String recipientId);
}
