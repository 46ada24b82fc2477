package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCategory;

import java.util.Map;

/**
 * Centrally configured message skeletons (nudge_templates, is_default = true).
 */
public interface MessageTemplateRepository {

    /**
     * Load the default template of every category that has one.
     * Categories without a row are absent from the map.
     */
    Map<NudgeCategory, MessageTemplate> loadDefaults();
}
