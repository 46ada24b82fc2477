package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.ActionItemRepository;
import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.ActionItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of ActionItemRepository (action_items).
 */
public final class PostgresActionItemRepository implements ActionItemRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresActionItemRepository.class);

    private final DataSource dataSource;

    public PostgresActionItemRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<ActionItem> findPending(String email, int limit) {
        String sql = """
                SELECT id::text AS id, email, action_text, coach_name, status, created_at
                FROM action_items
                WHERE lower(email) = lower(?) AND status = 'pending'
                ORDER BY created_at DESC
                LIMIT ?
                """;

        List<ActionItem> items = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, email);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Timestamp createdAt = rs.getTimestamp("created_at");
                    items.add(new ActionItem(
                            rs.getString("id"),
                            rs.getString("email"),
                            rs.getString("action_text"),
                            rs.getString("coach_name"),
                            rs.getString("status"),
                            createdAt != null ? createdAt.toInstant() : null));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load pending items for {}: {}", email, e.getMessage());
            throw new RepositoryException("Failed to load pending items", e);
        }
        return items;
    }

    @Override
    public boolean markCompleted(String itemId, Instant completedAt) {
        String sql = """
                UPDATE action_items
                SET status = 'completed', completed_at = ?
                WHERE id::text = ? AND status <> 'completed'
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(completedAt));
            ps.setString(2, itemId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to complete item {}: {}", itemId, e.getMessage());
            throw new RepositoryException("Failed to complete item", e);
        }
    }
}
