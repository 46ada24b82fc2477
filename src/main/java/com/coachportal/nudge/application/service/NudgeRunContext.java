package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeRunResult;

import java.time.Instant;
import java.util.Map;

/**
 * State scoped to one scheduler run: the tick instant, the templates loaded at
 * the start of the run, and the counters. Built once per run and passed down.
 */
public record NudgeRunContext(
        Instant now,
        Map<NudgeCategory, MessageTemplate> templates,
        NudgeRunResult result) {

    public NudgeRunContext {
        templates = Map.copyOf(templates);
    }
}
