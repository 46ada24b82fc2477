package com.coachportal.nudge.domain.model;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Centrally configured block skeleton for a category, with {{placeholder}} tokens
 * in its string leaves.
 */
public record MessageTemplate(NudgeCategory category, ArrayNode blocks) {
}
