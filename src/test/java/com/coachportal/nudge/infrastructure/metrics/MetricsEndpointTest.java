package com.coachportal.nudge.infrastructure.metrics;

import com.coachportal.nudge.domain.model.NudgeCategory;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusNudgeMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusNudgeMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsContainExpectedFamilies() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("nudges_sent_total"));
        assertTrue(body.contains("nudge_errors_total"));
        assertTrue(body.contains("nudge_skipped_total"));
        assertTrue(body.contains("nudge_interactions_total"));
        assertTrue(body.contains("nudge_run_duration_seconds"));
        assertTrue(body.contains("# HELP"));
        assertTrue(body.contains("# TYPE"));
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordSent(NudgeCategory.DAILY_DIGEST);
        metrics.recordSent(NudgeCategory.DAILY_DIGEST);
        metrics.recordError(NudgeCategory.GOAL_CHECKIN);
        metrics.recordSkipped(NudgeCategory.WEEKLY_DIGEST, "OUT_OF_WINDOW");
        metrics.recordInteraction("complete_action_item", "HANDLED");
        metrics.recordRun(Duration.ofMillis(1200), true);

        String body = scrape().body();

        assertTrue(body.contains("nudges_sent_total{category=\"daily_digest\",} 2.0"),
            "Should show two sent digests");
        assertTrue(body.contains("category=\"goal_checkin\""));
        assertTrue(body.contains("reason=\"OUT_OF_WINDOW\""));
        assertTrue(body.contains("action=\"complete_action_item\"") && body.contains("outcome=\"HANDLED\""));
        assertTrue(body.contains("nudge_run_duration_seconds_count{status=\"success\",} 1.0"));
    }

    @Test
    public void testNameFilterRestrictsFamilies() throws Exception {
        metrics.recordSent(NudgeCategory.DAILY_DIGEST);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics?name%5B%5D=nudges_sent_total"))
            .GET()
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("nudges_sent_total{category=\"daily_digest\",} 1.0"));
        assertFalse(response.body().contains("nudge_errors_total"), "Unrequested families are left out");
    }

    @Test
    public void testNonGetRejected() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .POST(HttpRequest.BodyPublishers.ofString(""))
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
        assertEquals("GET, HEAD", response.headers().firstValue("Allow").orElse(""));
        assertFalse(response.body().contains("# TYPE"));
    }
}
