package com.coachportal.nudge.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Decides whether "now" falls inside a recipient's preferred delivery window.
 *
 * The window is the preferred local hour ±1. Ticks are hourly, so every
 * preference is hit by at least one tick. Any conversion failure (bad zone id,
 * malformed time, missing value) permits the send: a broken preference row must
 * degrade to "always eligible", never to "never notified".
 */
public final class TimeWindowGate {
    private static final Logger log = LoggerFactory.getLogger(TimeWindowGate.class);

    static final int TOLERANCE_HOURS = 1;

    /**
     * @param preferredLocalTime HH:MM or HH:MM:SS
     * @param timezone           IANA zone id
     * @param now                Current instant
     * @return true if eligible now
     */
    public boolean isWithinWindow(String preferredLocalTime, String timezone, Instant now) {
        try {
            int localHour = now.atZone(ZoneId.of(timezone)).getHour();
            int preferredHour = Integer.parseInt(preferredLocalTime.trim().split(":")[0]);
            return Math.abs(localHour - preferredHour) <= TOLERANCE_HOURS;
        } catch (RuntimeException e) {
            log.warn("[NUDGE] Unusable window preference (time={}, zone={}), permitting: {}",
                    preferredLocalTime, timezone, e.getMessage());
            return true;
        }
    }
}
