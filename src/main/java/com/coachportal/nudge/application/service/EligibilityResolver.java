package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.CoachingSessionRepository;
import com.coachportal.nudge.application.port.output.NudgeLedgerRepository;
import com.coachportal.nudge.application.port.output.RecipientPreferenceRepository;
import com.coachportal.nudge.domain.model.CoachingSession;
import com.coachportal.nudge.domain.model.NudgeCandidate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeFrequency;
import com.coachportal.nudge.domain.model.NudgeRunResult;
import com.coachportal.nudge.domain.model.RecipientPreference;
import com.coachportal.nudge.infrastructure.metrics.NudgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the recipients of one category for the current run and drops anyone
 * already recorded in the ledger for the current period.
 *
 * The dedup check is a ledger query, not run-local state: a restarted process
 * must not resend.
 *
 * Loading the candidate list itself is not guarded: if the store is unreachable
 * the whole run fails. Lookups for a single recipient are guarded and counted
 * as errors.
 */
public final class EligibilityResolver {
    private static final Logger log = LoggerFactory.getLogger(EligibilityResolver.class);

    static final int GOAL_CHECKIN_MIN_DAYS = 3;
    static final int GOAL_CHECKIN_MAX_DAYS = 4;

    private final RecipientPreferenceRepository preferenceRepo;
    private final CoachingSessionRepository sessionRepo;
    private final NudgeLedgerRepository ledgerRepo;
    private final NudgePeriods periods;
    private final NudgeMetrics metrics;

    public EligibilityResolver(
            RecipientPreferenceRepository preferenceRepo,
            CoachingSessionRepository sessionRepo,
            NudgeLedgerRepository ledgerRepo,
            NudgePeriods periods,
            NudgeMetrics metrics) {
        this.preferenceRepo = preferenceRepo;
        this.sessionRepo = sessionRepo;
        this.ledgerRepo = ledgerRepo;
        this.periods = periods;
        this.metrics = metrics;
    }

    public List<NudgeCandidate> resolve(NudgeCategory category, Instant now, NudgeRunResult result) {
        List<NudgeCandidate> candidates = switch (category) {
            case DAILY_DIGEST -> resolveDigest(category, NudgeFrequency.DAILY, now, result);
            case WEEKLY_DIGEST -> resolveDigest(category, NudgeFrequency.WEEKLY, now, result);
            case GOAL_CHECKIN -> resolveSessions(category, goalCheckinSessions(now), now, result);
            case SESSION_PREP -> resolveSessions(category, sessionPrepSessions(now), now, result);
        };
        log.info("[NUDGE] {}: {} candidate(s) after dedup", category.wireValue(), candidates.size());
        return candidates;
    }

    private List<NudgeCandidate> resolveDigest(
            NudgeCategory category, NudgeFrequency frequency, Instant now, NudgeRunResult result) {

        List<RecipientPreference> preferences = preferenceRepo.findEnabledByFrequency(frequency);
        Map<String, NudgeCandidate> candidates = new LinkedHashMap<>();

        for (RecipientPreference preference : preferences) {
            try {
                if (!preference.acceptsDigest(category)) {
                    continue;
                }
                if (category == NudgeCategory.WEEKLY_DIGEST && !periods.isLocalMonday(preference, now)) {
                    continue;
                }
                String periodKey = periods.digestPeriodKey(category, preference, now);
                NudgeCandidate candidate = new NudgeCandidate(category, preference, null, periodKey, null);
                addIfNotSent(candidates, candidate);
            } catch (Exception e) {
                log.error("[NUDGE] Eligibility check failed for {} ({}): {}",
                        preference.recipientId(), category.wireValue(), e.getMessage());
                result.recordError();
                metrics.recordError(category);
            }
        }
        return new ArrayList<>(candidates.values());
    }

    private List<NudgeCandidate> resolveSessions(
            NudgeCategory category, List<CoachingSession> sessions, Instant now, NudgeRunResult result) {

        Map<String, NudgeCandidate> candidates = new LinkedHashMap<>();

        for (CoachingSession session : sessions) {
            String email = session.employeeEmail();
            if (email == null || email.isBlank()) {
                continue;
            }
            if (category == NudgeCategory.GOAL_CHECKIN && !session.hasGoals()) {
                continue;
            }
            try {
                Optional<RecipientPreference> preference = preferenceRepo.findByRecipient(email);
                if (preference.isEmpty() || !preference.get().acceptsEventNudges()) {
                    metrics.recordSkipped(category, "DISABLED");
                    continue;
                }
                NudgeCandidate candidate = new NudgeCandidate(
                        category, preference.get(), session.id(), session.id(), session);
                addIfNotSent(candidates, candidate);
            } catch (Exception e) {
                log.error("[NUDGE] Eligibility check failed for session {} ({}): {}",
                        session.id(), category.wireValue(), e.getMessage());
                result.recordError();
                metrics.recordError(category);
            }
        }
        return new ArrayList<>(candidates.values());
    }

    private void addIfNotSent(Map<String, NudgeCandidate> candidates, NudgeCandidate candidate) {
        if (candidates.containsKey(candidate.dedupKey())) {
            return;
        }
        if (ledgerRepo.existsForPeriod(candidate.recipientId(), candidate.category(), candidate.periodKey())) {
            log.debug("[NUDGE] {} already sent to {} for period {}",
                    candidate.category().wireValue(), candidate.recipientId(), candidate.periodKey());
            metrics.recordSkipped(candidate.category(), "ALREADY_SENT");
            return;
        }
        candidates.put(candidate.dedupKey(), candidate);
    }

    /**
     * Completed sessions dated 3 to 4 days ago that carry a goal.
     */
    private List<CoachingSession> goalCheckinSessions(Instant now) {
        LocalDate today = periods.serviceDate(now);
        return sessionRepo.findCompletedWithGoalsBetween(
                today.minusDays(GOAL_CHECKIN_MAX_DAYS),
                today.minusDays(GOAL_CHECKIN_MIN_DAYS));
    }

    private List<CoachingSession> sessionPrepSessions(Instant now) {
        return sessionRepo.findUpcomingOn(periods.serviceDate(now).plusDays(1));
    }
}
