package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.EmployeeDirectory;
import com.coachportal.nudge.application.port.output.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of EmployeeDirectory (employee_manager).
 */
public final class PostgresEmployeeDirectory implements EmployeeDirectory {
    private static final Logger log = LoggerFactory.getLogger(PostgresEmployeeDirectory.class);

    private final DataSource dataSource;

    public PostgresEmployeeDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<String> findFirstName(String email) {
        String sql = """
                SELECT first_name FROM employee_manager
                WHERE lower(company_email) = lower(?)
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("first_name"));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to look up {}: {}", email, e.getMessage());
            throw new RepositoryException("Failed to look up employee", e);
        }
        return Optional.empty();
    }
}
