package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.NudgeRunResult;

/**
 * Fatal scheduler run failure. Carries the counts accumulated before the failure.
 */
public class NudgeRunException extends RuntimeException {

    private final NudgeRunResult partialResult;

    public NudgeRunException(String message, Throwable cause, NudgeRunResult partialResult) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public NudgeRunResult getPartialResult() {
        return partialResult;
    }
}
