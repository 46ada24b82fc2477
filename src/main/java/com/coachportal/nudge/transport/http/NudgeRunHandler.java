package com.coachportal.nudge.transport.http;

import com.coachportal.nudge.application.service.NudgeRunException;
import com.coachportal.nudge.application.service.NudgeSchedulerService;
import com.coachportal.nudge.domain.model.NudgeRunResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP trigger for one scheduler run.
 *
 * Endpoint:
 * - POST|GET /api/nudges/run
 *
 * 200 with per-category counts when the run completes (per-recipient errors
 * included), 500 with the partial counts when the run aborts.
 */
public final class NudgeRunHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(NudgeRunHandler.class);

    private final NudgeSchedulerService schedulerService;
    private final ObjectMapper mapper;

    public NudgeRunHandler(NudgeSchedulerService schedulerService, ObjectMapper mapper) {
        this.schedulerService = schedulerService;
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (!Methods.POST.equals(exchange.getRequestMethod()) && !Methods.GET.equals(exchange.getRequestMethod())) {
            sendText(exchange, StatusCodes.METHOD_NOT_ALLOWED, "Method not allowed");
            return;
        }
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        long start = System.nanoTime();
        try {
            NudgeRunResult result = schedulerService.run();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("results", result.toResponseMap());
            body.put("duration", formatDuration(System.nanoTime() - start));
            sendJson(exchange, StatusCodes.OK, body);

        } catch (NudgeRunException e) {
            log.error("[NUDGE] Scheduler run failed: {}", e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Scheduler failed");
            body.put("details", e.getMessage());
            body.put("results", e.getPartialResult().toResponseMap());
            sendJson(exchange, StatusCodes.INTERNAL_SERVER_ERROR, body);

        } catch (Exception e) {
            log.error("[NUDGE] Scheduler run failed", e);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Scheduler failed");
            body.put("details", String.valueOf(e.getMessage()));
            body.put("results", new NudgeRunResult().toResponseMap());
            sendJson(exchange, StatusCodes.INTERNAL_SERVER_ERROR, body);
        }
    }

    static String formatDuration(long nanos) {
        return String.format(Locale.ROOT, "%.2fs", nanos / 1_000_000_000.0);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) throws Exception {
        String json = mapper.writeValueAsString(data);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private static void sendText(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
