package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.ActionItem;
import com.coachportal.nudge.domain.model.CoachingSession;
import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeFrequency;
import com.coachportal.nudge.domain.model.NudgeLedgerEntry;
import com.coachportal.nudge.domain.model.NudgeRunResult;
import com.coachportal.nudge.domain.model.RecipientPreference;
import com.coachportal.nudge.infrastructure.metrics.PrometheusNudgeMetrics;
import com.coachportal.nudge.support.InMemoryNudgeStore;
import com.coachportal.nudge.support.RecordingMessenger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("NudgeSchedulerService")
class NudgeSchedulerServiceTest {

    private static final String NEW_YORK = "America/New_York";
    private static final String WORKSPACE = "T-ACME";

    // Wednesday 2026-10-14, 09:59 and 10:05 in New York
    private static final Instant FIRST_TICK = Instant.parse("2026-10-14T13:59:00Z");
    private static final Instant SECOND_TICK = Instant.parse("2026-10-14T14:05:00Z");

    private InMemoryNudgeStore store;
    private RecordingMessenger messenger;
    private NudgeSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryNudgeStore().withBotToken(WORKSPACE, "xoxb-test");
        messenger = new RecordingMessenger();
        scheduler = newScheduler(store, 1);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private NudgeSchedulerService newScheduler(InMemoryNudgeStore source, int concurrency) {
        PrometheusNudgeMetrics metrics = new PrometheusNudgeMetrics(new CollectorRegistry());
        NudgePeriods periods = new NudgePeriods(ZoneOffset.UTC);
        return new NudgeSchedulerService(
                source,
                new EligibilityResolver(source, source, source, periods, metrics),
                new TimeWindowGate(),
                new ContentAssembler(source, source, source, "https://portal.example.com"),
                new BlockTemplateRenderer(),
                new NudgeDispatcher(source, messenger, source),
                metrics,
                Clock.fixed(FIRST_TICK, ZoneOffset.UTC),
                concurrency);
    }

    private static RecipientPreference daily(String email, String time) {
        return new RecipientPreference(email, true, NudgeFrequency.DAILY, time, NEW_YORK, WORKSPACE, "U-" + email, "D-" + email);
    }

    private static ActionItem pending(String id, String email, String text, String createdAt) {
        return new ActionItem(id, email, text, "Coach Kim", ActionItem.STATUS_PENDING, Instant.parse(createdAt));
    }

    @Test
    @DisplayName("Example run: sends to the eligible recipient, skips empty and out-of-window, catches up later")
    void exampleRun() {
        store.withPreference(daily("one@example.com", "09:00"))
                .withPreference(daily("two@example.com", "09:00"))
                .withPreference(daily("three@example.com", "11:00"))
                .withItem(pending("a1", "one@example.com", "Book a 1:1", "2026-10-01T00:00:00Z"))
                .withItem(pending("a2", "one@example.com", "Draft the plan", "2026-10-02T00:00:00Z"))
                .withItem(pending("a3", "three@example.com", "Ask for feedback", "2026-10-03T00:00:00Z"))
                .withFirstName("one@example.com", "Ona");

        NudgeRunResult first = scheduler.run(FIRST_TICK);

        assertEquals(1, first.sent(NudgeCategory.DAILY_DIGEST));
        assertEquals(0, first.errors());
        List<NudgeLedgerEntry> ledger = store.ledger();
        assertEquals(1, ledger.size());
        assertEquals("one@example.com", ledger.get(0).recipientId());
        assertEquals(NudgeCategory.DAILY_DIGEST, ledger.get(0).category());
        assertEquals("2026-10-14", ledger.get(0).periodKey());

        RecordingMessenger.Post post = messenger.posts().get(0);
        assertEquals("D-one@example.com", post.channel());
        assertEquals("xoxb-test", post.botToken());
        assertEquals("You have 2 pending coaching action items", post.text());
        // newest first
        assertEquals("action_a2", post.blocks().get(1).path("block_id").asText());

        NudgeRunResult second = scheduler.run(SECOND_TICK);

        assertEquals(1, second.sent(NudgeCategory.DAILY_DIGEST));
        assertEquals(1, store.ledgerFor("one@example.com").size());
        assertTrue(store.ledgerFor("two@example.com").isEmpty());
        assertEquals(1, store.ledgerFor("three@example.com").size());
        assertEquals(2, messenger.posts().size());
    }

    @Test
    @DisplayName("Running twice never produces two ledger entries for a key")
    void dedupAcrossRuns() {
        store.withPreference(daily("one@example.com", "10:00"))
                .withItem(pending("a1", "one@example.com", "Book a 1:1", "2026-10-01T00:00:00Z"));

        scheduler.run(FIRST_TICK);
        NudgeRunResult again = scheduler.run(FIRST_TICK);

        assertEquals(0, again.totalSent());
        assertEquals(1, store.ledger().size());
        assertEquals(1, messenger.posts().size());
    }

    @Test
    @DisplayName("A failing send for one recipient does not stop the next")
    void failureIsolation() {
        store.withPreference(daily("a@example.com", "10:00"))
                .withPreference(daily("b@example.com", "10:00"))
                .withItem(pending("a1", "a@example.com", "One", "2026-10-01T00:00:00Z"))
                .withItem(pending("b1", "b@example.com", "Two", "2026-10-01T00:00:00Z"));
        messenger.failFor("D-a@example.com");

        NudgeRunResult result = scheduler.run(FIRST_TICK);

        assertEquals(1, result.sent(NudgeCategory.DAILY_DIGEST));
        assertEquals(1, result.errors());
        assertTrue(store.ledgerFor("a@example.com").isEmpty());
        assertEquals(1, store.ledgerFor("b@example.com").size());
        assertEquals(1, messenger.posts().size());
    }

    @Test
    @DisplayName("A workspace without credentials is counted as an error")
    void missingCredential() {
        store.withPreference(new RecipientPreference(
                        "a@example.com", true, NudgeFrequency.DAILY, "10:00", NEW_YORK, "T-GONE", "U1", "D1"))
                .withItem(pending("a1", "a@example.com", "One", "2026-10-01T00:00:00Z"));

        NudgeRunResult result = scheduler.run(FIRST_TICK);

        assertEquals(0, result.totalSent());
        assertEquals(1, result.errors());
        assertTrue(store.ledger().isEmpty());
    }

    @Test
    @DisplayName("Goal check-in and session prep are sent once per session")
    void sessionDrivenCategories() {
        RecipientPreference smart = new RecipientPreference(
                "ann@example.com", true, NudgeFrequency.SMART, "10:00", NEW_YORK, WORKSPACE, "U1", "D1");
        store.withPreference(smart)
                .withSession(new CoachingSession("101", "ann@example.com", "Ann", "Coach Kim",
                        "Delegate more", CoachingSession.STATUS_COMPLETED, LocalDate.parse("2026-10-10")))
                .withSession(new CoachingSession("201", "ann@example.com", "Ann", "Coach Kim",
                        null, CoachingSession.STATUS_UPCOMING, LocalDate.parse("2026-10-15")));

        NudgeRunResult result = scheduler.run(FIRST_TICK);
        scheduler.run(SECOND_TICK);

        assertEquals(1, result.sent(NudgeCategory.GOAL_CHECKIN));
        assertEquals(1, result.sent(NudgeCategory.SESSION_PREP));
        assertEquals(2, store.ledger().size());
        assertEquals(2, messenger.posts().size());

        NudgeLedgerEntry checkin = store.ledger().stream()
                .filter(e -> e.category() == NudgeCategory.GOAL_CHECKIN).findFirst().orElseThrow();
        assertEquals("101", checkin.referenceId());
        assertEquals("session", checkin.referenceKind());
    }

    @Test
    @DisplayName("A configured template replaces the built-in skeleton")
    void configuredTemplate() throws Exception {
        ArrayNode blocks = (ArrayNode) new ObjectMapper().readTree(
                "[{\"type\":\"section\",\"text\":{\"type\":\"mrkdwn\",\"text\":\"{{action_count}} for {{first_name}}\"}},"
                        + "{\"type\":\"action_items\"}]");
        store.withTemplate(new MessageTemplate(NudgeCategory.DAILY_DIGEST, blocks))
                .withPreference(daily("a@example.com", "10:00"))
                .withItem(pending("a1", "a@example.com", "One", "2026-10-01T00:00:00Z"));

        scheduler.run(FIRST_TICK);

        ArrayNode sent = messenger.posts().get(0).blocks();
        assertEquals(2, sent.size());
        assertEquals("1 for there", sent.get(0).path("text").path("text").asText());
        assertEquals("action_a1", sent.get(1).path("block_id").asText());
    }

    @Test
    @DisplayName("A store failure while resolving aborts the run with partial counts")
    void fatalFailureCarriesPartialCounts() {
        InMemoryNudgeStore failing = new InMemoryNudgeStore() {
            @Override
            public List<CoachingSession> findUpcomingOn(LocalDate date) {
                throw new RepositoryException("Failed to load sessions", new SQLException("connection refused"));
            }
        };
        failing.withBotToken(WORKSPACE, "xoxb-test")
                .withPreference(daily("a@example.com", "10:00"))
                .withItem(pending("a1", "a@example.com", "One", "2026-10-01T00:00:00Z"));
        NudgeSchedulerService failingScheduler = newScheduler(failing, 1);

        NudgeRunException e = assertThrows(NudgeRunException.class, () -> failingScheduler.run(FIRST_TICK));

        assertEquals(1, e.getPartialResult().sent(NudgeCategory.DAILY_DIGEST));
        assertTrue(e.getMessage().contains("session_prep"));
        assertEquals(1, failing.ledger().size());
    }

    @Test
    @DisplayName("Template load failure is fatal")
    void templateFailureIsFatal() {
        InMemoryNudgeStore failing = new InMemoryNudgeStore() {
            @Override
            public Map<NudgeCategory, MessageTemplate> loadDefaults() {
                throw new RepositoryException("Failed to load templates", new SQLException("timeout"));
            }
        };
        NudgeSchedulerService failingScheduler = newScheduler(failing, 1);

        NudgeRunException e = assertThrows(NudgeRunException.class, failingScheduler::run);
        assertEquals(0, e.getPartialResult().totalSent());
    }

    @Test
    @DisplayName("Parallel dispatch sends each recipient exactly once")
    void parallelDispatch() {
        for (int i = 0; i < 12; i++) {
            String email = "user" + i + "@example.com";
            store.withPreference(daily(email, "10:00"))
                    .withItem(pending("item" + i, email, "Task " + i, "2026-10-01T00:00:00Z"));
        }
        messenger.failFor("D-user3@example.com");
        NudgeSchedulerService parallel = newScheduler(store, 5);
        try {
            NudgeRunResult result = parallel.run(FIRST_TICK);

            assertEquals(11, result.sent(NudgeCategory.DAILY_DIGEST));
            assertEquals(1, result.errors());
            assertEquals(11, store.ledger().size());
        } finally {
            parallel.shutdown();
        }
    }

    @Test
    @DisplayName("Overlapping runs never send the same key twice")
    void overlappingRuns() throws Exception {
        for (int i = 0; i < 8; i++) {
            String email = "user" + i + "@example.com";
            store.withPreference(daily(email, "10:00"))
                    .withItem(pending("item" + i, email, "Task " + i, "2026-10-01T00:00:00Z"));
        }
        NudgeSchedulerService shared = newScheduler(store, 4);
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Callable<NudgeRunResult>> runs = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                runs.add(() -> shared.run(FIRST_TICK));
            }
            int totalSent = 0;
            for (Future<NudgeRunResult> future : callers.invokeAll(runs)) {
                totalSent += future.get(30, TimeUnit.SECONDS).totalSent();
            }

            assertEquals(8, totalSent);
            assertEquals(8, store.ledger().size());
            assertEquals(8, messenger.posts().size());
        } finally {
            callers.shutdownNow();
            shared.shutdown();
        }
    }
}
