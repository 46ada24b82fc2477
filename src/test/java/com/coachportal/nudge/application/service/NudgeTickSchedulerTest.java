package com.coachportal.nudge.application.service;

import com.coachportal.nudge.domain.model.NudgeRunResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NudgeTickSchedulerTest {

    @Test
    void failedTickDoesNotEscape() {
        NudgeSchedulerService service = mock(NudgeSchedulerService.class);
        when(service.run()).thenThrow(new NudgeRunException("db down", null, new NudgeRunResult()));

        NudgeTickScheduler ticks = new NudgeTickScheduler(service, Duration.ofMinutes(60));

        assertDoesNotThrow(ticks::tick);
        verify(service).run();
    }

    @Test
    void keepsTickingAfterFailure() {
        NudgeSchedulerService service = mock(NudgeSchedulerService.class);
        when(service.run())
            .thenThrow(new IllegalStateException("first tick fails"))
            .thenReturn(new NudgeRunResult());

        NudgeTickScheduler ticks = new NudgeTickScheduler(service, Duration.ofMillis(50), Duration.ZERO);
        ticks.start();
        try {
            verify(service, timeout(2000).atLeast(2)).run();
        } finally {
            ticks.stop();
        }
    }
}
