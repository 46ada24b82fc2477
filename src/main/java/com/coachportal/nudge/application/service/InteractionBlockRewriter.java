package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.NudgeResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Produces the replacement block structure of a message after a recipient acted on it.
 *
 * Rewrites are pure functions of the blocks the callback carried, so a
 * double-delivered callback produces the same message both times.
 */
public final class InteractionBlockRewriter {

    static final String DONE_MARK = "✅";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Mark one item of a digest completed: its section loses the button and is struck
     * through, and the trailing context block is replaced by a pending/completed counter.
     *
     * @param blocks          Blocks of the live message
     * @param completedItemId Id of the item the recipient completed
     * @throws IllegalArgumentException if {@code blocks} is not a non-empty array
     */
    public ArrayNode markItemCompleted(JsonNode blocks, String completedItemId) {
        if (blocks == null || !blocks.isArray() || blocks.isEmpty()) {
            throw new IllegalArgumentException("No message blocks to rewrite");
        }
        ArrayNode updated = NODES.arrayNode();
        int completed = 0;
        int pending = 0;

        for (JsonNode block : blocks) {
            String type = block.path("type").asText();
            String blockId = block.path("block_id").asText("");

            if ("section".equals(type) && blockId.startsWith(BlockTemplateRenderer.ITEM_BLOCK_PREFIX)) {
                String itemId = blockId.substring(BlockTemplateRenderer.ITEM_BLOCK_PREFIX.length());
                String text = block.path("text").path("text").asText("");

                if (text.startsWith(DONE_MARK)) {
                    updated.add(block);
                    completed++;
                } else if (itemId.equals(completedItemId)) {
                    updated.add(completedItemBlock(blockId, text));
                    completed++;
                } else {
                    updated.add(block);
                    pending++;
                }
            } else if (!"context".equals(type)) {
                updated.add(block);
            }
        }

        updated.add(FallbackTemplates.context(counterText(pending, completed)));
        return updated;
    }

    /**
     * Single-section replacement for the legacy "done" button.
     */
    public ArrayNode doneMessage() {
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(FallbackTemplates.section(":white_check_mark: *Done!* Nice work completing your action item."));
        return blocks;
    }

    /**
     * Single-section acknowledgement of a goal progress report.
     */
    public ArrayNode progressAcknowledgement(NudgeResponse response) {
        String line = switch (response) {
            case PROGRESS_GREAT -> ":rocket: *Thanks for checking in!* Awesome! Keep that momentum going!";
            case PROGRESS_SLOW -> ":turtle: *Thanks for checking in!* Progress is progress! Every step counts.";
            case PROGRESS_STUCK -> ":construction: *Thanks for checking in!* "
                    + "That's okay - bring this to your next session. Your coach can help.";
            default -> throw new IllegalArgumentException("Not a progress report: " + response);
        };
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(FallbackTemplates.section(line));
        return blocks;
    }

    static String counterText(int pending, int completed) {
        if (pending > 0) {
            return pending + " pending • " + completed + " completed";
        }
        return "🎉 All done! " + completed + " item" + (completed > 1 ? "s" : "") + " completed";
    }

    private static ObjectNode completedItemBlock(String blockId, String text) {
        String itemText = text.startsWith(BlockTemplateRenderer.PENDING_MARK)
                ? text.substring(BlockTemplateRenderer.PENDING_MARK.length())
                : text;
        ObjectNode block = FallbackTemplates.section(DONE_MARK + " ~" + itemText + "~ Done!");
        block.put("block_id", blockId);
        return block;
    }
}
