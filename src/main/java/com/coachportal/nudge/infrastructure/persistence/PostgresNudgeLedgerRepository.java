package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.NudgeLedgerRepository;
import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.MessageRef;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeLedgerEntry;
import com.coachportal.nudge.domain.model.NudgeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL implementation of NudgeLedgerRepository (slack_nudges).
 *
 * CRITICAL: insert relies on the unique index on
 * (lower(employee_email), nudge_type, period_key); ON CONFLICT DO NOTHING turns a
 * lost race into a zero-row insert instead of an error.
 */
public final class PostgresNudgeLedgerRepository implements NudgeLedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresNudgeLedgerRepository.class);

    private final DataSource dataSource;

    public PostgresNudgeLedgerRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean existsForPeriod(String recipientId, NudgeCategory category, String periodKey) {
        String sql = """
                SELECT 1 FROM slack_nudges
                WHERE lower(employee_email) = lower(?) AND nudge_type = ? AND period_key = ?
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, recipientId);
            ps.setString(2, category.wireValue());
            ps.setString(3, periodKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Failed to check ledger for {} {} {}: {}",
                    recipientId, category.wireValue(), periodKey, e.getMessage());
            throw new RepositoryException("Failed to check ledger", e);
        }
    }

    @Override
    public boolean insert(NudgeLedgerEntry entry) {
        String sql = """
                INSERT INTO slack_nudges (
                    employee_email, nudge_type, reference_id, reference_type, period_key,
                    channel_id, message_ts, status, sent_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, 'sent', ?)
                ON CONFLICT (lower(employee_email), nudge_type, period_key) DO NOTHING
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, entry.recipientId());
            ps.setString(idx++, entry.category().wireValue());
            ps.setString(idx++, entry.referenceId());
            ps.setString(idx++, entry.referenceKind());
            ps.setString(idx++, entry.periodKey());
            ps.setString(idx++, entry.message().channelId());
            ps.setString(idx++, entry.message().ts());
            ps.setTimestamp(idx++, Timestamp.from(entry.sentAt()));

            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            log.error("Failed to insert ledger entry for {} {}: {}",
                    entry.recipientId(), entry.category().wireValue(), e.getMessage());
            throw new RepositoryException("Failed to insert ledger entry", e);
        }
    }

    @Override
    public Optional<NudgeLedgerEntry> findByMessage(MessageRef message) {
        String sql = """
                SELECT id::text AS id, employee_email, nudge_type, reference_id, reference_type, period_key,
                       channel_id, message_ts, sent_at, response, responded_at
                FROM slack_nudges
                WHERE channel_id = ? AND message_ts = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, message.channelId());
            ps.setString(2, message.ts());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find ledger entry {}/{}: {}", message.channelId(), message.ts(), e.getMessage());
            throw new RepositoryException("Failed to find ledger entry", e);
        }
        return Optional.empty();
    }

    @Override
    public boolean recordResponse(MessageRef message, NudgeResponse response, Instant respondedAt) {
        String sql = """
                UPDATE slack_nudges
                SET response = ?, responded_at = ?, status = 'responded'
                WHERE channel_id = ? AND message_ts = ? AND response IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, response.actionId());
            ps.setTimestamp(2, Timestamp.from(respondedAt));
            ps.setString(3, message.channelId());
            ps.setString(4, message.ts());

            int updated = ps.executeUpdate();
            if (updated > 0) {
                log.debug("Recorded response {} for {}/{}", response.actionId(), message.channelId(), message.ts());
            }
            return updated > 0;
        } catch (SQLException e) {
            log.error("Failed to record response for {}/{}: {}", message.channelId(), message.ts(), e.getMessage());
            throw new RepositoryException("Failed to record response", e);
        }
    }

    private NudgeLedgerEntry mapRow(ResultSet rs) throws SQLException {
        Timestamp sentAt = rs.getTimestamp("sent_at");
        Timestamp respondedAt = rs.getTimestamp("responded_at");
        String response = rs.getString("response");

        return new NudgeLedgerEntry(
                rs.getString("id"),
                rs.getString("employee_email"),
                NudgeCategory.fromWire(rs.getString("nudge_type")),
                rs.getString("reference_id"),
                rs.getString("reference_type"),
                rs.getString("period_key"),
                new MessageRef(rs.getString("channel_id"), rs.getString("message_ts")),
                sentAt != null ? sentAt.toInstant() : null,
                response != null ? NudgeResponse.fromActionId(response).orElse(null) : null,
                respondedAt != null ? respondedAt.toInstant() : null);
    }
}
