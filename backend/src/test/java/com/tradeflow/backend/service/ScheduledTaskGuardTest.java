package com.tradeflow.backend.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ScheduledTaskGuardTest {

    private final AlertService alertService = mock(AlertService.class);
    private final ScheduledTaskGuard guard = new ScheduledTaskGuard(alertService);

    @Test
    void failingTaskRaisesAlertInsteadOfKillingScheduler() {
        assertThatCode(() -> guard.run("trading-cycle", () -> {
            throw new IllegalStateException("boom");
        })).doesNotThrowAnyException();

        verify(alertService).sendAlert(eq("TASK_FAILED"), contains("trading-cycle"));
    }

    @Test
    void successfulTaskRaisesNothing() {
        guard.run("trading-cycle", () -> { });

        verifyNoInteractions(alertService);
    }
}
