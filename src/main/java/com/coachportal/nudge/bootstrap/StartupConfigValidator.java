package com.coachportal.nudge.bootstrap;

import com.coachportal.nudge.application.service.NudgeSchedulerService;
import com.coachportal.nudge.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException and the service
 * refuses to start if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate() {
        log.info("Running startup config validation...");

        Env.require("SLACK_SIGNING_SECRET");
        log.info("✓ Signing secret configured");

        int port = Env.requireIntInRange("PORT", App.DEFAULT_PORT, 1, 65535);
        int concurrency = Env.requireIntInRange(
            "NUDGE_DISPATCH_CONCURRENCY", 1, 1, NudgeSchedulerService.MAX_CONCURRENCY);
        ZoneId zone = Env.requireZone("NUDGE_SERVICE_ZONE", ZoneOffset.UTC);

        if (Env.getBool("NUDGE_SCHEDULER_ENABLED", false)) {
            Env.requireIntInRange("NUDGE_SCHEDULER_INTERVAL_MINUTES", 60, 1, 24 * 60);
        }

        log.info("✓ Startup config validation passed (port={}, concurrency={}, zone={})", port, concurrency, zone);
    }
}
