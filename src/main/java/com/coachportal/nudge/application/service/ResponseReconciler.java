package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.ActionItemRepository;
import com.coachportal.nudge.application.port.output.ChatMessenger;
import com.coachportal.nudge.application.port.output.NudgeLedgerRepository;
import com.coachportal.nudge.application.port.output.WorkspaceCredentialRepository;
import com.coachportal.nudge.domain.model.MessageRef;
import com.coachportal.nudge.domain.model.NudgeResponse;
import com.coachportal.nudge.infrastructure.metrics.NudgeMetrics;
import com.coachportal.nudge.infrastructure.slack.SlackSignatureVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies a recipient's button click to the system of record and to the live message.
 *
 * FLOW:
 * 1. Verify the request signature (the only step that can answer non-2xx besides a bad payload)
 * 2. Parse the form-encoded payload
 * 3. Resolve the workspace bot token
 * 4. Apply the domain side effect (complete an item)
 * 5. Edit the live message in place
 * 6. Attach the response to the ledger entry, matched by channel + ts
 *
 * Steps 4-6 run in order and stop at the first failure, so a failed side effect
 * or edit leaves the ledger entry unanswered. Failures in steps 3-6 are logged and
 * the callback is still acknowledged: the platform retries unacknowledged callbacks,
 * and a retry cannot fix an internal error.
 *
 * IDEMPOTENCE:
 * Item completion is conditional, the block rewrite is a pure function of the
 * delivered blocks, and the ledger keeps only the first response. A double-delivered
 * callback ends in the same state as a single one.
 */
public final class ResponseReconciler {
    private static final Logger log = LoggerFactory.getLogger(ResponseReconciler.class);

    static final String UPDATE_TEXT = "Action items updated";

    private final SlackSignatureVerifier verifier;
    private final WorkspaceCredentialRepository credentialRepo;
    private final ActionItemRepository actionItemRepo;
    private final NudgeLedgerRepository ledgerRepo;
    private final ChatMessenger messenger;
    private final InteractionBlockRewriter rewriter;
    private final NudgeMetrics metrics;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ResponseReconciler(
            SlackSignatureVerifier verifier,
            WorkspaceCredentialRepository credentialRepo,
            ActionItemRepository actionItemRepo,
            NudgeLedgerRepository ledgerRepo,
            ChatMessenger messenger,
            InteractionBlockRewriter rewriter,
            NudgeMetrics metrics,
            ObjectMapper mapper,
            Clock clock) {
        this.verifier = verifier;
        this.credentialRepo = credentialRepo;
        this.actionItemRepo = actionItemRepo;
        this.ledgerRepo = ledgerRepo;
        this.messenger = messenger;
        this.rewriter = rewriter;
        this.metrics = metrics;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @param rawBody   Request body exactly as received
     * @param signature X-Slack-Signature header (may be null)
     * @param timestamp X-Slack-Request-Timestamp header (may be null)
     */
    public CallbackOutcome reconcile(String rawBody, String signature, String timestamp) {
        if (!verifier.verify(signature, timestamp, rawBody)) {
            log.warn("[RECONCILE] Rejected callback with invalid signature");
            metrics.recordInteraction("unknown", "REJECTED");
            return CallbackOutcome.unauthorized();
        }

        String payloadJson = formField(rawBody, "payload");
        if (payloadJson == null || payloadJson.isBlank()) {
            return CallbackOutcome.badRequest("Missing payload");
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(payloadJson);
        } catch (JsonProcessingException e) {
            log.warn("[RECONCILE] Unparseable payload: {}", e.getOriginalMessage());
            return CallbackOutcome.badRequest("Invalid payload");
        }

        String type = payload.path("type").asText();
        if ("url_verification".equals(type)) {
            return CallbackOutcome.json(mapper.createObjectNode()
                    .put("challenge", payload.path("challenge").asText())
                    .toString());
        }

        JsonNode actions = payload.path("actions");
        if (!"block_actions".equals(type) || !actions.isArray() || actions.isEmpty()) {
            return CallbackOutcome.acknowledged();
        }

        JsonNode action = actions.get(0);
        String actionId = action.path("action_id").asText();
        try {
            handleAction(payload, action, actionId);
        } catch (Exception e) {
            log.error("[RECONCILE] Failed to handle {}: {}", actionId, e.getMessage(), e);
            metrics.recordInteraction(actionId, "FAILED");
        }
        return CallbackOutcome.acknowledged();
    }

    private void handleAction(JsonNode payload, JsonNode action, String actionId) {
        Optional<NudgeResponse> response = NudgeResponse.fromActionId(actionId);
        if (response.isEmpty()) {
            log.info("[RECONCILE] Unknown action: {}", actionId);
            metrics.recordInteraction("unknown", "IGNORED");
            return;
        }

        String teamId = payload.path("team").path("id").asText(null);
        Optional<String> botToken = teamId == null ? Optional.empty() : credentialRepo.findBotToken(teamId);
        if (botToken.isEmpty()) {
            log.error("[RECONCILE] No installation found for team {}", teamId);
            metrics.recordInteraction(actionId, "FAILED");
            return;
        }

        String channelId = payload.path("channel").path("id").asText(null);
        String ts = payload.path("message").path("ts").asText(null);
        if (channelId == null || ts == null) {
            log.warn("[RECONCILE] Callback for {} carries no message identity", actionId);
            metrics.recordInteraction(actionId, "FAILED");
            return;
        }
        MessageRef message = new MessageRef(channelId, ts);
        JsonNode deliveredBlocks = payload.path("message").path("blocks");
        Instant now = clock.instant();

        // side effect, then edit, then ledger; a failed step leaves the rest undone
        boolean ok = switch (response.get()) {
            case COMPLETE_ACTION_ITEM -> {
                String itemId = action.path("value").asText();
                yield completeItem(itemId, now)
                        && rewriteDigest(botToken.get(), message, deliveredBlocks, itemId)
                        && recordResponse(message, response.get(), now);
            }
            case ACTION_DONE -> {
                String itemId = referenceFromBlockId(action.path("block_id").asText(""));
                yield completeItem(itemId, now)
                        && updateMessage(botToken.get(), message, rewriter.doneMessage())
                        && recordResponse(message, response.get(), now);
            }
            case PROGRESS_GREAT, PROGRESS_SLOW, PROGRESS_STUCK ->
                    updateMessage(botToken.get(), message, rewriter.progressAcknowledgement(response.get()))
                            && recordResponse(message, response.get(), now);
        };

        metrics.recordInteraction(actionId, ok ? "HANDLED" : "FAILED");
    }

    private boolean completeItem(String itemId, Instant now) {
        if (itemId == null || itemId.isBlank()) {
            log.warn("[RECONCILE] No item id on completion callback");
            return false;
        }
        try {
            if (!actionItemRepo.markCompleted(itemId, now)) {
                log.info("[RECONCILE] Item {} was already completed", itemId);
            }
            return true;
        } catch (Exception e) {
            log.error("[RECONCILE] Failed to mark item {} completed: {}", itemId, e.getMessage());
            return false;
        }
    }

    private boolean rewriteDigest(String botToken, MessageRef message, JsonNode deliveredBlocks, String itemId) {
        if (!deliveredBlocks.isArray() || deliveredBlocks.isEmpty()) {
            log.warn("[RECONCILE] Callback for {}/{} carries no message blocks, not editing",
                    message.channelId(), message.ts());
            return false;
        }
        return updateMessage(botToken, message, rewriter.markItemCompleted(deliveredBlocks, itemId));
    }

    private boolean updateMessage(String botToken, MessageRef message, ArrayNode blocks) {
        try {
            messenger.updateMessage(botToken, message, blocks, UPDATE_TEXT);
            return true;
        } catch (Exception e) {
            log.error("[RECONCILE] Failed to update message {}/{}: {}",
                    message.channelId(), message.ts(), e.getMessage());
            return false;
        }
    }

    private boolean recordResponse(MessageRef message, NudgeResponse response, Instant now) {
        try {
            if (!ledgerRepo.recordResponse(message, response, now)) {
                log.info("[RECONCILE] No unanswered ledger entry for {}/{}", message.channelId(), message.ts());
            }
            return true;
        } catch (Exception e) {
            log.error("[RECONCILE] Failed to record response for {}/{}: {}",
                    message.channelId(), message.ts(), e.getMessage());
            return false;
        }
    }

    /**
     * Legacy buttons carry the reference id as the second segment of the block id ("action_123").
     */
    static String referenceFromBlockId(String blockId) {
        String[] parts = blockId.split("_");
        return parts.length > 1 ? parts[1] : null;
    }

    static String formField(String body, String name) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
