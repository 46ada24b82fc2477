package com.coachportal.nudge.infrastructure.metrics;

import com.coachportal.nudge.domain.model.NudgeCategory;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of NudgeMetrics.
 *
 * Key Metrics:
 * - nudges_sent_total{category}
 * - nudge_errors_total{category}
 * - nudge_skipped_total{category, reason}
 * - nudge_interactions_total{action, outcome}
 * - nudge_run_duration_seconds{status}
 *
 * Usage:
 * <pre>
 * PrometheusNudgeMetrics metrics = new PrometheusNudgeMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusNudgeMetrics implements NudgeMetrics {

    private final CollectorRegistry registry;

    private final Counter sentCounter;
    private final Counter errorCounter;
    private final Counter skippedCounter;
    private final Counter interactionCounter;
    private final Histogram runDuration;

    public PrometheusNudgeMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusNudgeMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.sentCounter = Counter.build()
            .name("nudges_sent_total")
            .help("Total number of nudges sent and recorded in the ledger")
            .labelNames("category")
            .register(registry);

        this.errorCounter = Counter.build()
            .name("nudge_errors_total")
            .help("Total number of per-recipient nudge failures")
            .labelNames("category")
            .register(registry);

        this.skippedCounter = Counter.build()
            .name("nudge_skipped_total")
            .help("Total number of candidates skipped without sending")
            .labelNames("category", "reason")
            .register(registry);

        this.interactionCounter = Counter.build()
            .name("nudge_interactions_total")
            .help("Total number of interaction callbacks received")
            .labelNames("action", "outcome")
            .register(registry);

        this.runDuration = Histogram.build()
            .name("nudge_run_duration_seconds")
            .help("Scheduler run duration in seconds")
            .labelNames("status")
            .buckets(0.5, 1.0, 5.0, 15.0, 30.0, 60.0, 120.0, 300.0)
            .register(registry);
    }

    @Override
    public void recordSent(NudgeCategory category) {
        sentCounter.labels(category.wireValue()).inc();
    }

    @Override
    public void recordError(NudgeCategory category) {
        errorCounter.labels(category.wireValue()).inc();
    }

    @Override
    public void recordSkipped(NudgeCategory category, String reason) {
        skippedCounter.labels(category.wireValue(), reason).inc();
    }

    @Override
    public void recordInteraction(String action, String outcome) {
        interactionCounter.labels(action, outcome).inc();
    }

    @Override
    public void recordRun(Duration elapsed, boolean success) {
        runDuration.labels(success ? "success" : "failure").observe(elapsed.toMillis() / 1000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
