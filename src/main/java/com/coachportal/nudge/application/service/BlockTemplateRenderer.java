package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.ActionItem;
import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeContent;
import com.coachportal.nudge.domain.model.NudgeResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a block skeleton into a sendable block structure.
 *
 * Two passes over the tree:
 * 1. every string leaf has its {{name}} tokens replaced (unknown or null values become "");
 *    field names and non-string leaves are left alone, so any block shape works.
 * 2. top-level item slots ({"type": "action_items"}) are replaced by one section per
 *    open item, each carrying a completion button.
 *
 * The skeleton is deep-copied first; templates are shared across a run.
 */
public final class BlockTemplateRenderer {

    public static final String ITEM_SLOT_TYPE = "action_items";
    public static final String ITEM_BLOCK_PREFIX = "action_";
    public static final String PENDING_MARK = "☐ ";

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*(\\w+)\\s*\\}\\}");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * @param category  Category being rendered
     * @param content   Assembled values and items
     * @param templates Configured templates of this run (may lack the category)
     */
    public ArrayNode render(NudgeCategory category, NudgeContent content, Map<NudgeCategory, MessageTemplate> templates) {
        MessageTemplate template = templates.get(category);
        ArrayNode skeleton = template != null ? template.blocks().deepCopy() : FallbackTemplates.forCategory(category);

        JsonNode substituted = substitute(skeleton, content.variables());
        return expandItemSlots((ArrayNode) substituted, content.items());
    }

    /**
     * Replace tokens in every string leaf of the tree. Containers are modified in place.
     */
    JsonNode substitute(JsonNode node, Map<String, String> vars) {
        if (node.isTextual()) {
            return TextNode.valueOf(replaceTokens(node.asText(), vars));
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                object.set(name, substitute(object.get(name), vars));
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substitute(array.get(i), vars));
            }
            return array;
        }
        return node;
    }

    static String replaceTokens(String text, Map<String, String> vars) {
        Matcher matcher = TOKEN.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        matcher.reset();
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = vars.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private ArrayNode expandItemSlots(ArrayNode blocks, List<ActionItem> items) {
        ArrayNode expanded = NODES.arrayNode();
        Iterator<JsonNode> it = blocks.elements();
        while (it.hasNext()) {
            JsonNode block = it.next();
            if (ITEM_SLOT_TYPE.equals(block.path("type").asText())) {
                for (ActionItem item : items) {
                    expanded.add(itemBlock(item));
                }
            } else {
                expanded.add(block);
            }
        }
        return expanded;
    }

    static ObjectNode itemBlock(ActionItem item) {
        ObjectNode block = FallbackTemplates.section(PENDING_MARK + item.text());
        block.put("block_id", ITEM_BLOCK_PREFIX + item.id());
        ObjectNode button = FallbackTemplates.button(
                "Done", NudgeResponse.COMPLETE_ACTION_ITEM.actionId(), item.id());
        button.put("style", "primary");
        block.set("accessory", button);
        return block;
    }
}
