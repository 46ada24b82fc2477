package com.coachportal.nudge.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Built-in periodic trigger for the scheduler run.
 *
 * Fixed rate on a single thread, so two in-process ticks never overlap. A tick
 * that fails is logged and the next one proceeds.
 */
public final class NudgeTickScheduler {
    private static final Logger log = LoggerFactory.getLogger(NudgeTickScheduler.class);

    private final NudgeSchedulerService schedulerService;
    private final Duration interval;
    private final Duration initialDelay;
    private final ScheduledExecutorService scheduler;

    public NudgeTickScheduler(NudgeSchedulerService schedulerService, Duration interval) {
        this(schedulerService, interval, Duration.ofSeconds(30));
    }

    public NudgeTickScheduler(NudgeSchedulerService schedulerService, Duration interval, Duration initialDelay) {
        this.schedulerService = schedulerService;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nudge-tick");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::tick,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[NUDGE] Tick scheduler started: interval={}m", interval.toMinutes());
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void tick() {
        try {
            schedulerService.run();
        } catch (Exception e) {
            log.error("[NUDGE] Scheduled run failed", e);
        }
    }
}
