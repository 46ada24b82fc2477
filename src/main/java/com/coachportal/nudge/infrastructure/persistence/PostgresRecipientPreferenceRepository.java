package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.RecipientPreferenceRepository;
import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.NudgeFrequency;
import com.coachportal.nudge.domain.model.RecipientPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of RecipientPreferenceRepository (employee_slack_connections).
 */
public final class PostgresRecipientPreferenceRepository implements RecipientPreferenceRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRecipientPreferenceRepository.class);

    private static final String COLUMNS = """
            employee_email, nudge_enabled, nudge_frequency, preferred_time::text AS preferred_time,
            timezone, slack_team_id, slack_user_id, slack_dm_channel_id
            """;

    private final DataSource dataSource;

    public PostgresRecipientPreferenceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<RecipientPreference> findEnabledByFrequency(NudgeFrequency frequency) {
        String sql = "SELECT " + COLUMNS + """
                FROM employee_slack_connections
                WHERE nudge_enabled = true AND nudge_frequency = ?
                ORDER BY employee_email
                """;

        List<RecipientPreference> preferences = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, frequency.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    preferences.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load {} recipients: {}", frequency.dbValue(), e.getMessage());
            throw new RepositoryException("Failed to load recipients", e);
        }
        return preferences;
    }

    @Override
    public Optional<RecipientPreference> findByRecipient(String recipientId) {
        String sql = "SELECT " + COLUMNS + """
                FROM employee_slack_connections
                WHERE lower(employee_email) = lower(?)
                ORDER BY connected_at DESC
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, recipientId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find preference for {}: {}", recipientId, e.getMessage());
            throw new RepositoryException("Failed to find preference", e);
        }
        return Optional.empty();
    }

    private RecipientPreference mapRow(ResultSet rs) throws SQLException {
        return new RecipientPreference(
                rs.getString("employee_email"),
                rs.getBoolean("nudge_enabled"),
                NudgeFrequency.fromDb(rs.getString("nudge_frequency")),
                rs.getString("preferred_time"),
                rs.getString("timezone"),
                rs.getString("slack_team_id"),
                rs.getString("slack_user_id"),
                rs.getString("slack_dm_channel_id"));
    }
}
