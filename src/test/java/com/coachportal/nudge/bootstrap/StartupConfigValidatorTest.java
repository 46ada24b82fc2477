package com.coachportal.nudge.bootstrap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives the validator through JVM system properties, the fallback source
 * after environment variables.
 */
class StartupConfigValidatorTest {

    private static final String[] KEYS = {
        "SLACK_SIGNING_SECRET", "PORT", "NUDGE_DISPATCH_CONCURRENCY", "NUDGE_SERVICE_ZONE"
    };

    @BeforeEach
    void setUp() {
        System.setProperty("SLACK_SIGNING_SECRET", "test-secret");
    }

    @AfterEach
    void tearDown() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(StartupConfigValidator::validate);
    }

    @Test
    void rejectsConcurrencyAboveLimit() {
        System.setProperty("NUDGE_DISPATCH_CONCURRENCY", "50");

        IllegalStateException e = assertThrows(IllegalStateException.class, StartupConfigValidator::validate);
        assertTrue(e.getMessage().contains("NUDGE_DISPATCH_CONCURRENCY"));
    }

    @Test
    void rejectsUnknownZone() {
        System.setProperty("NUDGE_SERVICE_ZONE", "Mars/Olympus");

        IllegalStateException e = assertThrows(IllegalStateException.class, StartupConfigValidator::validate);
        assertTrue(e.getMessage().contains("NUDGE_SERVICE_ZONE"));
    }

    @Test
    void rejectsPortOutOfRange() {
        System.setProperty("PORT", "70000");

        assertThrows(IllegalStateException.class, StartupConfigValidator::validate);
    }
}
