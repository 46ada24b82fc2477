package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.RecipientPreference;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Dedup period arithmetic.
 *
 * Digest periods are calendar periods in the recipient's own zone, so "today"
 * means the recipient's today. A malformed zone falls back to the service zone.
 */
public final class NudgePeriods {

    private final ZoneId serviceZone;

    public NudgePeriods(ZoneId serviceZone) {
        this.serviceZone = serviceZone;
    }

    public ZoneId serviceZone() {
        return serviceZone;
    }

    public ZoneId zoneOf(RecipientPreference preference) {
        String timezone = preference.timezone();
        if (timezone == null || timezone.isBlank()) {
            return serviceZone;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return serviceZone;
        }
    }

    public LocalDate localDate(RecipientPreference preference, Instant now) {
        return now.atZone(zoneOf(preference)).toLocalDate();
    }

    /**
     * Service-zone calendar date; used for session-date arithmetic.
     */
    public LocalDate serviceDate(Instant now) {
        return now.atZone(serviceZone).toLocalDate();
    }

    public boolean isLocalMonday(RecipientPreference preference, Instant now) {
        return localDate(preference, now).getDayOfWeek() == DayOfWeek.MONDAY;
    }

    /**
     * Period key for a digest category.
     *
     * @return recipient-local ISO date (daily) or ISO date of the local week's Monday (weekly)
     */
    public String digestPeriodKey(NudgeCategory category, RecipientPreference preference, Instant now) {
        LocalDate today = localDate(preference, now);
        return switch (category) {
            case DAILY_DIGEST -> today.toString();
            case WEEKLY_DIGEST -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toString();
            default -> throw new IllegalArgumentException("Not a digest category: " + category);
        };
    }
}
