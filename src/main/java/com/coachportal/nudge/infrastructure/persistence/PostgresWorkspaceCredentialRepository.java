package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.application.port.output.WorkspaceCredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of WorkspaceCredentialRepository (slack_installations).
 * Tokens are never logged.
 */
public final class PostgresWorkspaceCredentialRepository implements WorkspaceCredentialRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresWorkspaceCredentialRepository.class);

    private final DataSource dataSource;

    public PostgresWorkspaceCredentialRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<String> findBotToken(String workspaceId) {
        if (workspaceId == null) {
            return Optional.empty();
        }
        String sql = "SELECT bot_token FROM slack_installations WHERE team_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workspaceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("bot_token")).filter(t -> !t.isBlank());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load installation for team {}: {}", workspaceId, e.getMessage());
            throw new RepositoryException("Failed to load installation", e);
        }
        return Optional.empty();
    }
}
