package com.coachportal.nudge.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Assembled facts for one message: flat named values for placeholder
 * substitution, the open items backing interactive item slots, and the
 * plain-text notification fallback.
 */
public record NudgeContent(
        Map<String, String> variables,
        List<ActionItem> items,
        String fallbackText) {

    public NudgeContent {
        variables = Map.copyOf(variables);
        items = List.copyOf(items);
    }
}
