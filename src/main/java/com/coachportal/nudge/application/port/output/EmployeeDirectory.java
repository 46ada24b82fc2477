package com.coachportal.nudge.application.port.output;

import java.util.Optional;

/**
 * Participant directory (employee_manager).
 */
public interface EmployeeDirectory {

    Optional<String> findFirstName(String email);
}
