package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.CoachingSessionRepository;
import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.CoachingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of CoachingSessionRepository.
 *
 * Sessions reach their participant through employee_manager; sessions without a
 * directory entry are not returned.
 */
public final class PostgresCoachingSessionRepository implements CoachingSessionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCoachingSessionRepository.class);

    private static final String SELECT = """
            SELECT s.id::text AS id, e.company_email, e.first_name, s.coach_name, s.goals,
                   s.status, s.session_date
            FROM session_tracking s
            JOIN employee_manager e ON e.id = s.employee_id
            """;

    private final DataSource dataSource;

    public PostgresCoachingSessionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<CoachingSession> findCompletedWithGoalsBetween(LocalDate from, LocalDate to) {
        String sql = SELECT + """
                WHERE s.status = 'Completed'
                  AND s.session_date BETWEEN ? AND ?
                  AND s.goals IS NOT NULL AND btrim(s.goals) <> ''
                ORDER BY s.session_date, s.id
                """;
        return query(sql, "completed sessions " + from + ".." + to, Date.valueOf(from), Date.valueOf(to));
    }

    @Override
    public List<CoachingSession> findUpcomingOn(LocalDate date) {
        String sql = SELECT + """
                WHERE s.status = 'Upcoming' AND s.session_date = ?
                ORDER BY s.id
                """;
        return query(sql, "upcoming sessions on " + date, Date.valueOf(date));
    }

    @Override
    public Optional<CoachingSession> findById(String sessionId) {
        String sql = SELECT + "WHERE s.id::text = ?";
        List<CoachingSession> sessions = query(sql, "session " + sessionId, sessionId);
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(0));
    }

    private List<CoachingSession> query(String sql, String what, Object... params) {
        List<CoachingSession> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sessions.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load {}: {}", what, e.getMessage());
            throw new RepositoryException("Failed to load " + what, e);
        }
        return sessions;
    }

    private CoachingSession mapRow(ResultSet rs) throws SQLException {
        Date sessionDate = rs.getDate("session_date");
        return new CoachingSession(
                rs.getString("id"),
                rs.getString("company_email"),
                rs.getString("first_name"),
                rs.getString("coach_name"),
                rs.getString("goals"),
                rs.getString("status"),
                sessionDate != null ? sessionDate.toLocalDate() : null);
    }
}
