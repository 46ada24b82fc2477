package com.coachportal.nudge.domain.model;

import java.time.Instant;

/**
 * One dispatched nudge (slack_nudges row).
 *
 * Written once by the dispatcher after a confirmed send, answered at most once
 * by the reconciler. {@code periodKey} together with recipient and category is
 * the dedup key.
 */
public record NudgeLedgerEntry(
        String id,
        String recipientId,
        NudgeCategory category,
        String referenceId, // nullable: digests have no single reference
        String referenceKind,
        String periodKey,
        MessageRef message,
        Instant sentAt,
        NudgeResponse response, // null until answered
        Instant respondedAt) {

    public static NudgeLedgerEntry sent(NudgeCandidate candidate, MessageRef message, Instant sentAt) {
        return new NudgeLedgerEntry(
                null,
                candidate.recipientId(),
                candidate.category(),
                candidate.referenceId(),
                candidate.category().referenceKind(),
                candidate.periodKey(),
                message,
                sentAt,
                null,
                null);
    }

    public boolean isAnswered() {
        return response != null;
    }
}
