package com.coachportal.nudge.application.port.output;

/**
 * Thrown by repository implementations when the relational store cannot serve a request.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
