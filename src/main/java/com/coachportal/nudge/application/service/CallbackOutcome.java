package com.coachportal.nudge.application.service;

/**
 * HTTP answer to an interaction callback.
 *
 * @param status      HTTP status
 * @param contentType Body media type; null for an empty body
 * @param body        Body text (empty for a plain acknowledgement)
 */
public record CallbackOutcome(int status, String contentType, String body) {

    public static CallbackOutcome acknowledged() {
        return new CallbackOutcome(200, null, "");
    }

    public static CallbackOutcome json(String body) {
        return new CallbackOutcome(200, "application/json", body);
    }

    public static CallbackOutcome unauthorized() {
        return new CallbackOutcome(401, "text/plain", "Invalid signature");
    }

    public static CallbackOutcome badRequest(String reason) {
        return new CallbackOutcome(400, "text/plain", reason);
    }
}
