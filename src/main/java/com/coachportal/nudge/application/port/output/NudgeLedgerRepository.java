package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.MessageRef;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeLedgerEntry;
import com.coachportal.nudge.domain.model.NudgeResponse;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for the slack_nudges ledger.
 *
 * OWNERSHIP:
 * Rows are appended by the dispatcher and answered by the reconciler. Nothing
 * in this service deletes them.
 *
 * ENFORCEMENT:
 * - Unique key: (lower(employee_email), nudge_type, period_key)
 */
public interface NudgeLedgerRepository {

    /**
     * Check whether a nudge was already recorded for this dedup key.
     *
     * @param recipientId Recipient email (matched case-insensitively)
     * @param category    Nudge category
     * @param periodKey   Day, week or reference id, depending on category
     * @return true if an entry exists
     */
    boolean existsForPeriod(String recipientId, NudgeCategory category, String periodKey);

    /**
     * Append a sent nudge.
     *
     * @param entry Entry to insert
     * @return false if the dedup key was already taken (a concurrent run won it)
     */
    boolean insert(NudgeLedgerEntry entry);

    /**
     * Find the entry for a posted message.
     *
     * @param message Channel + ts of the message
     * @return Entry if this service sent the message
     */
    Optional<NudgeLedgerEntry> findByMessage(MessageRef message);

    /**
     * Attach the recipient's response. Only the first response is kept.
     *
     * @param message     Channel + ts of the answered message
     * @param response    Clicked action
     * @param respondedAt Time of the click
     * @return true if a previously unanswered entry was updated
     */
    boolean recordResponse(MessageRef message, NudgeResponse response, Instant respondedAt);
}
