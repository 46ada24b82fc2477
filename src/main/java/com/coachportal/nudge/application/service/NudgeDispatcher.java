package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.ChatMessenger;
import com.coachportal.nudge.application.port.output.NudgeLedgerRepository;
import com.coachportal.nudge.application.port.output.WorkspaceCredentialRepository;
import com.coachportal.nudge.domain.model.MessageRef;
import com.coachportal.nudge.domain.model.NudgeCandidate;
import com.coachportal.nudge.domain.model.NudgeLedgerEntry;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Sends one rendered nudge and records it in the ledger.
 *
 * The ledger row is written only after the platform confirmed the post, so a
 * failed send leaves no trace and is retried by the next tick. Exceptions are
 * propagated; the caller owns per-recipient isolation.
 */
public final class NudgeDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NudgeDispatcher.class);

    private final WorkspaceCredentialRepository credentialRepo;
    private final ChatMessenger messenger;
    private final NudgeLedgerRepository ledgerRepo;

    public NudgeDispatcher(
            WorkspaceCredentialRepository credentialRepo,
            ChatMessenger messenger,
            NudgeLedgerRepository ledgerRepo) {
        this.credentialRepo = credentialRepo;
        this.messenger = messenger;
        this.ledgerRepo = ledgerRepo;
    }

    /**
     * Whether the ledger already holds the candidate's dedup key. Checked again
     * after the in-flight claim, since another run may have sent in the meantime.
     */
    public boolean isRecorded(NudgeCandidate candidate) {
        return ledgerRepo.existsForPeriod(candidate.recipientId(), candidate.category(), candidate.periodKey());
    }

    /**
     * @param candidate Recipient and dedup key
     * @param blocks    Rendered blocks
     * @param text      Notification fallback text
     * @param sentAt    Ledger timestamp
     * @return true if a new ledger entry was written; false if another run
     *         recorded the same key first
     * @throws IllegalStateException if the recipient's workspace has no credential
     */
    public boolean dispatch(NudgeCandidate candidate, ArrayNode blocks, String text, Instant sentAt) {
        String workspaceId = candidate.preference().workspaceId();
        String botToken = credentialRepo.findBotToken(workspaceId)
                .orElseThrow(() -> new IllegalStateException("No bot token for workspace " + workspaceId));

        String channel = candidate.preference().channelId();
        if (channel == null || channel.isBlank()) {
            channel = candidate.preference().chatUserId();
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalStateException("No channel binding for " + candidate.recipientId());
        }

        MessageRef message = messenger.postMessage(botToken, channel, blocks, text);

        boolean inserted = ledgerRepo.insert(NudgeLedgerEntry.sent(candidate, message, sentAt));
        if (!inserted) {
            log.warn("[NUDGE] {} for {} period {} was already recorded; message {} is a duplicate",
                    candidate.category().wireValue(), candidate.recipientId(), candidate.periodKey(), message.ts());
            return false;
        }

        log.info("[NUDGE] Sent {} to {} (channel={}, ts={})",
                candidate.category().wireValue(), candidate.recipientId(), message.channelId(), message.ts());
        return true;
    }
}
