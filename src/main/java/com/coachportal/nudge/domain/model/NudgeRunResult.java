package com.coachportal.nudge.domain.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run counters. Thread-safe: dispatch workers increment concurrently.
 */
public final class NudgeRunResult {
    private final Map<NudgeCategory, AtomicInteger> sent = new EnumMap<>(NudgeCategory.class);
    private final AtomicInteger errors = new AtomicInteger();

    public NudgeRunResult() {
        for (NudgeCategory category : NudgeCategory.values()) {
            sent.put(category, new AtomicInteger());
        }
    }

    public void recordSent(NudgeCategory category) {
        sent.get(category).incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public int sent(NudgeCategory category) {
        return sent.get(category).get();
    }

    public int errors() {
        return errors.get();
    }

    public int totalSent() {
        int total = 0;
        for (AtomicInteger count : sent.values()) {
            total += count.get();
        }
        return total;
    }

    /**
     * JSON body shape of the scheduler endpoint.
     */
    public Map<String, Integer> toResponseMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("dailyDigestsSent", sent(NudgeCategory.DAILY_DIGEST));
        map.put("weeklyDigestsSent", sent(NudgeCategory.WEEKLY_DIGEST));
        map.put("goalCheckinsSent", sent(NudgeCategory.GOAL_CHECKIN));
        map.put("sessionPrepsSent", sent(NudgeCategory.SESSION_PREP));
        map.put("errors", errors());
        return map;
    }
}
