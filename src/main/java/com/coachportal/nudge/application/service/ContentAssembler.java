package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.ActionItemRepository;
import com.coachportal.nudge.application.port.output.CoachingSessionRepository;
import com.coachportal.nudge.application.port.output.EmployeeDirectory;
import com.coachportal.nudge.domain.model.ActionItem;
import com.coachportal.nudge.domain.model.CoachingSession;
import com.coachportal.nudge.domain.model.NudgeCandidate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeContent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls the facts a nudge needs and flattens them into named values.
 *
 * Returns empty when there is nothing worth sending. Values are plain text;
 * markup belongs to the templates.
 */
public final class ContentAssembler {

    static final int MAX_DIGEST_ITEMS = 5;
    static final String DEFAULT_FIRST_NAME = "there";
    static final String DEFAULT_COACH_NAME = "your coach";

    private final ActionItemRepository actionItemRepo;
    private final CoachingSessionRepository sessionRepo;
    private final EmployeeDirectory directory;
    private final String portalUrl;

    public ContentAssembler(
            ActionItemRepository actionItemRepo,
            CoachingSessionRepository sessionRepo,
            EmployeeDirectory directory,
            String portalUrl) {
        this.actionItemRepo = actionItemRepo;
        this.sessionRepo = sessionRepo;
        this.directory = directory;
        this.portalUrl = portalUrl;
    }

    public Optional<NudgeContent> assemble(NudgeCandidate candidate) {
        return switch (candidate.category()) {
            case DAILY_DIGEST, WEEKLY_DIGEST -> assembleDigest(candidate);
            case GOAL_CHECKIN -> assembleGoalCheckin(candidate);
            case SESSION_PREP -> assembleSessionPrep(candidate);
        };
    }

    private Optional<NudgeContent> assembleDigest(NudgeCandidate candidate) {
        List<ActionItem> pending = actionItemRepo.findPending(candidate.recipientId(), MAX_DIGEST_ITEMS);
        if (pending.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder list = new StringBuilder();
        for (int i = 0; i < pending.size(); i++) {
            if (i > 0) {
                list.append('\n');
            }
            list.append(i + 1).append(". ").append(pending.get(i).text());
        }

        int count = pending.size();
        Map<String, String> vars = new HashMap<>();
        vars.put("first_name", firstName(candidate.recipientId(), null));
        vars.put("actions_list", list.toString());
        vars.put("action_count", String.valueOf(count));
        vars.put("action_plural", count == 1 ? "" : "s");
        vars.put("portal_url", portalUrl);

        String text = candidate.category() == NudgeCategory.DAILY_DIGEST
                ? "You have " + count + " pending coaching action item" + (count == 1 ? "" : "s")
                : "Weekly coaching digest: " + count + " action item" + (count == 1 ? "" : "s");

        return Optional.of(new NudgeContent(vars, pending, text));
    }

    private Optional<NudgeContent> assembleGoalCheckin(NudgeCandidate candidate) {
        CoachingSession session = candidate.session();
        if (session == null || !session.hasGoals()) {
            return Optional.empty();
        }

        Map<String, String> vars = new HashMap<>();
        vars.put("first_name", firstName(candidate.recipientId(), session.employeeFirstName()));
        vars.put("coach_name", coachName(session));
        vars.put("goals", session.goals().trim());
        vars.put("session_id", session.id());
        vars.put("portal_url", portalUrl);

        return Optional.of(new NudgeContent(vars, List.of(), "How's progress on your coaching goals?"));
    }

    private Optional<NudgeContent> assembleSessionPrep(NudgeCandidate candidate) {
        // Re-read: the session may have been cancelled or moved since candidates were listed.
        Optional<CoachingSession> current = sessionRepo.findById(candidate.referenceId());
        if (current.isEmpty() || !current.get().isUpcoming()) {
            return Optional.empty();
        }
        CoachingSession session = current.get();

        Map<String, String> vars = new HashMap<>();
        vars.put("first_name", firstName(candidate.recipientId(), session.employeeFirstName()));
        vars.put("coach_name", coachName(session));
        vars.put("session_id", session.id());
        vars.put("portal_url", portalUrl);

        return Optional.of(new NudgeContent(vars, List.of(), "You have a coaching session tomorrow!"));
    }

    private String firstName(String email, String known) {
        if (known != null && !known.isBlank()) {
            return known;
        }
        return directory.findFirstName(email)
                .filter(name -> !name.isBlank())
                .orElse(DEFAULT_FIRST_NAME);
    }

    private static String coachName(CoachingSession session) {
        String coach = session.coachName();
        return coach == null || coach.isBlank() ? DEFAULT_COACH_NAME : coach;
    }
}
