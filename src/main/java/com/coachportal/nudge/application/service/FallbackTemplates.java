package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.NudgeCategory;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Built-in block skeletons, used when no template is configured for a category.
 *
 * Skeletons use the same {{placeholder}} tokens as stored templates. A block of
 * type {@value BlockTemplateRenderer#ITEM_SLOT_TYPE} is expanded by the renderer
 * into one interactive section per open action item.
 */
public final class FallbackTemplates {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FallbackTemplates() {}

    /**
     * Fresh copy of the skeleton for a category; callers may mutate it.
     */
    public static ArrayNode forCategory(NudgeCategory category) {
        return switch (category) {
            case DAILY_DIGEST -> dailyDigest();
            case WEEKLY_DIGEST -> weeklyDigest();
            case GOAL_CHECKIN -> goalCheckin();
            case SESSION_PREP -> sessionPrep();
        };
    }

    private static ArrayNode dailyDigest() {
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(section("*Good morning, {{first_name}}!* :sun_small_cloud:\n\n"
                + "Here's your coaching action items for today:"));
        blocks.add(itemSlot());
        blocks.add(context("{{action_count}} pending item{{action_plural}} • <{{portal_url}}|Open Portal>"));
        return blocks;
    }

    private static ArrayNode weeklyDigest() {
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(section("*Happy Monday, {{first_name}}!* :wave:\n\n"
                + "Here's your coaching focus for the week:"));
        blocks.add(itemSlot());
        blocks.add(context("{{action_count}} action item{{action_plural}} to work on this week"));
        return blocks;
    }

    private static ArrayNode goalCheckin() {
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(section("*Hey {{first_name}}!* :wave:\n\n"
                + "A few days ago you set this goal with {{coach_name}}:\n\n"
                + "_\"{{goals}}\"_\n\nHow's it going?"));

        ObjectNode actions = NODES.objectNode();
        actions.put("type", "actions");
        actions.put("block_id", "goal_{{session_id}}");
        ArrayNode elements = actions.putArray("elements");
        elements.add(button(":rocket: Going great", "progress_great", "{{session_id}}"));
        elements.add(button(":turtle: Slow but steady", "progress_slow", "{{session_id}}"));
        elements.add(button(":construction: Feeling stuck", "progress_stuck", "{{session_id}}"));
        blocks.add(actions);
        return blocks;
    }

    private static ArrayNode sessionPrep() {
        ArrayNode blocks = NODES.arrayNode();
        blocks.add(section("*Hey {{first_name}}!* :calendar:\n\n"
                + "You have a coaching session with {{coach_name}} tomorrow!\n\n"
                + "Take a moment to think about what you want to focus on."));

        ObjectNode actions = NODES.objectNode();
        actions.put("type", "actions");
        ArrayNode elements = actions.putArray("elements");
        ObjectNode prepare = button("Prepare for Session", "prepare_session", "{{session_id}}");
        prepare.put("url", "{{portal_url}}");
        elements.add(prepare);
        blocks.add(actions);
        return blocks;
    }

    static ObjectNode section(String mrkdwn) {
        ObjectNode block = NODES.objectNode();
        block.put("type", "section");
        ObjectNode text = block.putObject("text");
        text.put("type", "mrkdwn");
        text.put("text", mrkdwn);
        return block;
    }

    static ObjectNode context(String mrkdwn) {
        ObjectNode block = NODES.objectNode();
        block.put("type", "context");
        ObjectNode element = block.putArray("elements").addObject();
        element.put("type", "mrkdwn");
        element.put("text", mrkdwn);
        return block;
    }

    static ObjectNode button(String label, String actionId, String value) {
        ObjectNode button = NODES.objectNode();
        button.put("type", "button");
        ObjectNode text = button.putObject("text");
        text.put("type", "plain_text");
        text.put("text", label);
        text.put("emoji", true);
        button.put("action_id", actionId);
        button.put("value", value);
        return button;
    }

    private static ObjectNode itemSlot() {
        ObjectNode slot = NODES.objectNode();
        slot.put("type", BlockTemplateRenderer.ITEM_SLOT_TYPE);
        return slot;
    }
}
