package com.coachportal.nudge.bootstrap;

import com.coachportal.nudge.application.service.BlockTemplateRenderer;
import com.coachportal.nudge.application.service.ContentAssembler;
import com.coachportal.nudge.application.service.EligibilityResolver;
import com.coachportal.nudge.application.service.InteractionBlockRewriter;
import com.coachportal.nudge.application.service.NudgeDispatcher;
import com.coachportal.nudge.application.service.NudgePeriods;
import com.coachportal.nudge.application.service.NudgeSchedulerService;
import com.coachportal.nudge.application.service.NudgeTickScheduler;
import com.coachportal.nudge.application.service.ResponseReconciler;
import com.coachportal.nudge.application.service.TimeWindowGate;
import com.coachportal.nudge.infrastructure.metrics.PrometheusMetricsHandler;
import com.coachportal.nudge.infrastructure.metrics.PrometheusNudgeMetrics;
import com.coachportal.nudge.infrastructure.persistence.PostgresActionItemRepository;
import com.coachportal.nudge.infrastructure.persistence.PostgresCoachingSessionRepository;
import com.coachportal.nudge.infrastructure.persistence.PostgresEmployeeDirectory;
import com.coachportal.nudge.infrastructure.persistence.PostgresMessageTemplateRepository;
import com.coachportal.nudge.infrastructure.persistence.PostgresNudgeLedgerRepository;
import com.coachportal.nudge.infrastructure.persistence.PostgresRecipientPreferenceRepository;
import com.coachportal.nudge.infrastructure.persistence.PostgresWorkspaceCredentialRepository;
import com.coachportal.nudge.infrastructure.slack.SlackSignatureVerifier;
import com.coachportal.nudge.infrastructure.slack.SlackWebClient;
import com.coachportal.nudge.transport.http.NudgeRunHandler;
import com.coachportal.nudge.transport.http.SlackInteractionHandler;
import com.coachportal.nudge.util.Env;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int DEFAULT_PORT = 8080;
    static final String DEFAULT_PORTAL_URL = "https://portal.booncoaching.com";

    public static void main(String[] args) {
        StartupConfigValidator.validate();

        int port = Env.getInt("PORT", DEFAULT_PORT);
        ObjectMapper mapper = new ObjectMapper();
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Infrastructure
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        PrometheusNudgeMetrics metrics = new PrometheusNudgeMetrics();

        PostgresNudgeLedgerRepository ledgerRepo = new PostgresNudgeLedgerRepository(dataSource);
        PostgresRecipientPreferenceRepository preferenceRepo = new PostgresRecipientPreferenceRepository(dataSource);
        PostgresWorkspaceCredentialRepository credentialRepo = new PostgresWorkspaceCredentialRepository(dataSource);
        PostgresMessageTemplateRepository templateRepo = new PostgresMessageTemplateRepository(dataSource, mapper);
        PostgresActionItemRepository actionItemRepo = new PostgresActionItemRepository(dataSource);
        PostgresCoachingSessionRepository sessionRepo = new PostgresCoachingSessionRepository(dataSource);
        PostgresEmployeeDirectory directory = new PostgresEmployeeDirectory(dataSource);

        SlackWebClient slack = new SlackWebClient(
            Env.get("SLACK_API_BASE_URL", SlackWebClient.DEFAULT_BASE_URL),
            Env.getSeconds("SLACK_HTTP_TIMEOUT_SECONDS", 10));
        SlackSignatureVerifier verifier = new SlackSignatureVerifier(
            Env.require("SLACK_SIGNING_SECRET"),
            Env.getSeconds("SLACK_SIGNATURE_TOLERANCE_SECONDS", 300),
            clock);
        log.info("✓ Infrastructure initialized");

        // ═══════════════════════════════════════════════════════════════
        // Nudge lifecycle
        // ═══════════════════════════════════════════════════════════════
        NudgePeriods periods = new NudgePeriods(Env.getZone("NUDGE_SERVICE_ZONE", ZoneOffset.UTC));
        NudgeSchedulerService schedulerService = new NudgeSchedulerService(
            templateRepo,
            new EligibilityResolver(preferenceRepo, sessionRepo, ledgerRepo, periods, metrics),
            new TimeWindowGate(),
            new ContentAssembler(actionItemRepo, sessionRepo, directory, Env.get("PORTAL_URL", DEFAULT_PORTAL_URL)),
            new BlockTemplateRenderer(),
            new NudgeDispatcher(credentialRepo, slack, ledgerRepo),
            metrics,
            clock,
            Env.getInt("NUDGE_DISPATCH_CONCURRENCY", 1));

        ResponseReconciler reconciler = new ResponseReconciler(
            verifier, credentialRepo, actionItemRepo, ledgerRepo, slack,
            new InteractionBlockRewriter(), metrics, mapper, clock);
        log.info("✓ Nudge services initialized");

        NudgeTickScheduler tickScheduler = null;
        if (Env.getBool("NUDGE_SCHEDULER_ENABLED", false)) {
            tickScheduler = new NudgeTickScheduler(schedulerService,
                Env.getMinutes("NUDGE_SCHEDULER_INTERVAL_MINUTES", 60));
            tickScheduler.start();
        } else {
            log.info("Built-in tick scheduler disabled; runs are triggered via /api/nudges/run");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        PathHandler routes = Handlers.path()
            .addExactPath("/api/nudges/run", new NudgeRunHandler(schedulerService, mapper))
            .addExactPath("/api/slack/interactions", new SlackInteractionHandler(reconciler))
            .addExactPath("/api/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send("{\"status\":\"UP\"}", StandardCharsets.UTF_8);
            })
            .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ Nudge service started on http://localhost:{}/", port);

        NudgeTickScheduler ticks = tickScheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            if (ticks != null) {
                ticks.stop();
            }
            server.stop();
            schedulerService.shutdown();
            dataSource.close();
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/coaching");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);
        int queryTimeoutSeconds = Env.getInt("DB_QUERY_TIMEOUT_SECONDS", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(Env.getInt("DB_CONNECTION_TIMEOUT_MS", 5000));
        config.addDataSourceProperty("socketTimeout", String.valueOf(queryTimeoutSeconds + 5));
        config.addDataSourceProperty("options", "-c statement_timeout=" + (queryTimeoutSeconds * 1000));
        config.setPoolName("nudge-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
