package com.coachportal.nudge.domain.model;

import java.util.Optional;

/**
 * Button actions a recipient can take on a nudge. The wire value is the
 * {@code action_id} of the clicked element and is what the ledger stores.
 */
public enum NudgeResponse {
    COMPLETE_ACTION_ITEM("complete_action_item"),
    ACTION_DONE("action_done"),
    PROGRESS_GREAT("progress_great"),
    PROGRESS_SLOW("progress_slow"),
    PROGRESS_STUCK("progress_stuck");

    private final String actionId;

    NudgeResponse(String actionId) {
        this.actionId = actionId;
    }

    public String actionId() {
        return actionId;
    }

    public boolean isProgressReport() {
        return this == PROGRESS_GREAT || this == PROGRESS_SLOW || this == PROGRESS_STUCK;
    }

    public static Optional<NudgeResponse> fromActionId(String actionId) {
        for (NudgeResponse response : values()) {
            if (response.actionId.equals(actionId)) {
                return Optional.of(response);
            }
        }
        return Optional.empty();
    }
}
