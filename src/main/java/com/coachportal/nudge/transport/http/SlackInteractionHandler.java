package com.coachportal.nudge.transport.http;

import com.coachportal.nudge.application.service.CallbackOutcome;
import com.coachportal.nudge.application.service.ResponseReconciler;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Slack interaction callback endpoint.
 *
 * Endpoint:
 * - POST /api/slack/interactions (application/x-www-form-urlencoded, payload=...)
 *
 * The body is read raw: the signature covers the exact bytes Slack sent, so it
 * must not go through a form parser first.
 */
public final class SlackInteractionHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(SlackInteractionHandler.class);

    static final HttpString SIGNATURE_HEADER = new HttpString("X-Slack-Signature");
    static final HttpString TIMESTAMP_HEADER = new HttpString("X-Slack-Request-Timestamp");

    private final ResponseReconciler reconciler;

    public SlackInteractionHandler(ResponseReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (!Methods.POST.equals(exchange.getRequestMethod())) {
            send(exchange, new CallbackOutcome(StatusCodes.METHOD_NOT_ALLOWED, "text/plain", "Method not allowed"));
            return;
        }
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        exchange.startBlocking();
        String rawBody = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        String signature = exchange.getRequestHeaders().getFirst(SIGNATURE_HEADER);
        String timestamp = exchange.getRequestHeaders().getFirst(TIMESTAMP_HEADER);

        CallbackOutcome outcome;
        try {
            outcome = reconciler.reconcile(rawBody, signature, timestamp);
        } catch (Exception e) {
            // acknowledged so Slack does not retry
            log.error("[RECONCILE] Interaction handler error", e);
            outcome = CallbackOutcome.acknowledged();
        }
        send(exchange, outcome);
    }

    private static void send(HttpServerExchange exchange, CallbackOutcome outcome) {
        exchange.setStatusCode(outcome.status());
        if (outcome.contentType() != null) {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, outcome.contentType());
        }
        exchange.getResponseSender().send(outcome.body(), StandardCharsets.UTF_8);
    }
}
