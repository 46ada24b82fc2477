package com.coachportal.nudge.application.port.output;

import java.util.Optional;

/**
 * Bot credentials of connected chat workspaces (slack_installations).
 */
public interface WorkspaceCredentialRepository {

    Optional<String> findBotToken(String workspaceId);
}
