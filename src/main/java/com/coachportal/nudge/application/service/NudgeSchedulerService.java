package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.MessageTemplateRepository;
import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCandidate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeContent;
import com.coachportal.nudge.domain.model.NudgeRunResult;
import com.coachportal.nudge.infrastructure.metrics.NudgeMetrics;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One scheduler tick: every category, every eligible recipient.
 *
 * FLOW (per category, in order):
 * 1. Resolve candidates (eligibility + ledger dedup)
 * 2. Per candidate: window gate, in-flight claim, ledger re-check, assemble, render, dispatch
 *
 * FAILURE CLASSES:
 * - Per-recipient: caught, logged, counted; the loop continues
 * - Fatal (templates or candidate lists not loadable): run aborts with
 *   {@link NudgeRunException} carrying the partial counts
 *
 * CONCURRENCY:
 * Recipients of a category are processed by a bounded pool. An in-process claim on
 * the dedup key keeps two workers (or two overlapping runs) off the same key; the
 * ledger's unique key covers other processes.
 */
public final class NudgeSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(NudgeSchedulerService.class);

    public static final int MAX_CONCURRENCY = 20;

    private final MessageTemplateRepository templateRepo;
    private final EligibilityResolver resolver;
    private final TimeWindowGate gate;
    private final ContentAssembler assembler;
    private final BlockTemplateRenderer renderer;
    private final NudgeDispatcher dispatcher;
    private final NudgeMetrics metrics;
    private final Clock clock;
    private final ExecutorService workers;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public NudgeSchedulerService(
            MessageTemplateRepository templateRepo,
            EligibilityResolver resolver,
            TimeWindowGate gate,
            ContentAssembler assembler,
            BlockTemplateRenderer renderer,
            NudgeDispatcher dispatcher,
            NudgeMetrics metrics,
            Clock clock,
            int concurrency) {
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException("concurrency must be 1.." + MAX_CONCURRENCY + ": " + concurrency);
        }
        this.templateRepo = templateRepo;
        this.resolver = resolver;
        this.gate = gate;
        this.assembler = assembler;
        this.renderer = renderer;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = concurrency == 1 ? null : Executors.newFixedThreadPool(concurrency,
                r -> {
                    Thread t = new Thread(r, "nudge-dispatch-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public NudgeRunResult run() {
        return run(clock.instant());
    }

    /**
     * Run one tick as of the given instant.
     *
     * @throws NudgeRunException on a fatal failure
     */
    public NudgeRunResult run(Instant now) {
        long startNanos = System.nanoTime();
        NudgeRunResult result = new NudgeRunResult();
        log.info("[NUDGE] Run started at {}", now);

        try {
            Map<NudgeCategory, MessageTemplate> templates = loadTemplates(result);
            NudgeRunContext context = new NudgeRunContext(now, templates, result);

            for (NudgeCategory category : NudgeCategory.values()) {
                List<NudgeCandidate> candidates;
                try {
                    candidates = resolver.resolve(category, now, result);
                } catch (RuntimeException e) {
                    throw new NudgeRunException(
                            "Failed to resolve " + category.wireValue() + " candidates: " + e.getMessage(), e, result);
                }
                processAll(candidates, context);
            }
        } catch (NudgeRunException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordRun(elapsed, false);
            log.error("[NUDGE] Run failed after {}ms: {} (partial: {})",
                    elapsed.toMillis(), e.getMessage(), result.toResponseMap());
            throw e;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.recordRun(elapsed, true);
        log.info("[NUDGE] Run complete in {}ms: daily={}, weekly={}, goalCheckins={}, sessionPreps={}, errors={}",
                elapsed.toMillis(),
                result.sent(NudgeCategory.DAILY_DIGEST),
                result.sent(NudgeCategory.WEEKLY_DIGEST),
                result.sent(NudgeCategory.GOAL_CHECKIN),
                result.sent(NudgeCategory.SESSION_PREP),
                result.errors());
        return result;
    }

    /**
     * Stop the dispatch pool. In-progress sends are given a few seconds to finish.
     */
    public void shutdown() {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Map<NudgeCategory, MessageTemplate> loadTemplates(NudgeRunResult result) {
        try {
            Map<NudgeCategory, MessageTemplate> templates = templateRepo.loadDefaults();
            log.debug("[NUDGE] Loaded {} template(s)", templates.size());
            return templates;
        } catch (RuntimeException e) {
            throw new NudgeRunException("Failed to load templates: " + e.getMessage(), e, result);
        }
    }

    private void processAll(List<NudgeCandidate> candidates, NudgeRunContext context) {
        if (workers == null || candidates.size() < 2) {
            for (NudgeCandidate candidate : candidates) {
                processGuarded(candidate, context);
            }
            return;
        }

        List<Future<?>> futures = new ArrayList<>(candidates.size());
        for (NudgeCandidate candidate : candidates) {
            futures.add(workers.submit(() -> processGuarded(candidate, context)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // processGuarded catches everything; only Errors land here
                log.error("[NUDGE] Dispatch worker died", e.getCause());
                context.result().recordError();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NudgeRunException("Run interrupted", e, context.result());
            }
        }
    }

    private void processGuarded(NudgeCandidate candidate, NudgeRunContext context) {
        NudgeCategory category = candidate.category();
        try {
            process(candidate, context);
        } catch (Exception e) {
            log.error("[NUDGE] Failed to send {} to {}: {}",
                    category.wireValue(), candidate.recipientId(), e.getMessage());
            context.result().recordError();
            metrics.recordError(category);
        }
    }

    private void process(NudgeCandidate candidate, NudgeRunContext context) {
        NudgeCategory category = candidate.category();

        if (!gate.isWithinWindow(
                candidate.preference().preferredLocalTime(), candidate.preference().timezone(), context.now())) {
            log.debug("[NUDGE] {} outside window for {}", category.wireValue(), candidate.recipientId());
            metrics.recordSkipped(category, "OUT_OF_WINDOW");
            return;
        }

        String key = candidate.dedupKey();
        if (!inFlight.add(key)) {
            log.debug("[NUDGE] {} already in flight", key);
            metrics.recordSkipped(category, "IN_FLIGHT");
            return;
        }

        try {
            if (dispatcher.isRecorded(candidate)) {
                log.debug("[NUDGE] {} recorded by a concurrent run", key);
                metrics.recordSkipped(category, "ALREADY_SENT");
                return;
            }

            Optional<NudgeContent> content = assembler.assemble(candidate);
            if (content.isEmpty()) {
                log.debug("[NUDGE] Nothing to send for {} ({})", candidate.recipientId(), category.wireValue());
                metrics.recordSkipped(category, "NO_CONTENT");
                return;
            }

            ArrayNode blocks = renderer.render(category, content.get(), context.templates());
            if (dispatcher.dispatch(candidate, blocks, content.get().fallbackText(), context.now())) {
                context.result().recordSent(category);
                metrics.recordSent(category);
            } else {
                metrics.recordSkipped(category, "ALREADY_SENT");
            }
        } finally {
            inFlight.remove(key);
        }
    }
}
