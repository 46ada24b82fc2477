package com.coachportal.nudge.infrastructure.slack;

/**
 * Exception thrown when a Slack Web API call fails: transport error, HTTP error,
 * or an {@code "ok": false} response.
 */
public class SlackApiException extends RuntimeException {

    private final String method;
    private final String errorCode;

    public SlackApiException(String method, String errorCode, String message) {
        super(String.format("[%s] %s: %s", method, errorCode, message));
        this.method = method;
        this.errorCode = errorCode;
    }

    public SlackApiException(String method, String errorCode, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", method, errorCode, message), cause);
        this.method = method;
        this.errorCode = errorCode;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Slack error code (e.g. {@code channel_not_found}, {@code invalid_auth}),
     * or {@code http_<status>} / {@code transport_error} for non-API failures.
     */
    public String getErrorCode() {
        return errorCode;
    }
}
