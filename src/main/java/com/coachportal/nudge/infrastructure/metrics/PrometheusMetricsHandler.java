package com.coachportal.nudge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Scrape endpoint for the nudge metrics registry.
 *
 * Endpoint:
 * - GET|HEAD /metrics                              all families, text format 0.0.4
 * - GET /metrics?name[]=nudges_sent_total&name[]=...  only the named families
 *
 * The format follows the Accept header, so an OpenMetrics scraper gets OpenMetrics.
 * Any other method is answered 405.
 *
 * Example output:
 * <pre>
 * # HELP nudges_sent_total Total number of nudges sent and recorded in the ledger
 * # TYPE nudges_sent_total counter
 * nudges_sent_total{category="daily_digest",} 42.0
 * nudges_sent_total{category="goal_checkin",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        boolean head = Methods.HEAD.equals(exchange.getRequestMethod());
        if (!head && !Methods.GET.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
            exchange.getResponseHeaders().put(Headers.ALLOW, "GET, HEAD");
            exchange.getResponseSender().send("Method not allowed", StandardCharsets.UTF_8);
            return;
        }

        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);
        try {
            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, registry.filteredMetricFamilySamples(names));
            String body = writer.toString();

            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            if (head) {
                exchange.endExchange();
            } else {
                exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
            }
            log.debug("[METRICS] Served {} bytes ({} families requested)", body.length(),
                    names.isEmpty() ? "all" : names.size());

        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Empty set means every family.
     */
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
