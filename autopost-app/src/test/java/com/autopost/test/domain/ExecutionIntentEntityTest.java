package com.autopost.test.domain;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.test.support.IntentFixtures;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

public class ExecutionIntentEntityTest {

    @Test
    public void shouldCreatePendingIntentWithTwoHourWindow() {
        ExecutionIntentEntity intent = IntentFixtures.pending(SchedulerTypeEnum.PLAYWRIGHT, "t1", "2025-03-09", "09:00");

        Assertions.assertEquals(IntentStatusEnum.PENDING, intent.getStatus());
        Assertions.assertEquals(0, intent.getRetryCount());
        Assertions.assertEquals(LocalDateTime.parse("2025-03-09T09:00"), intent.getExecutionWindowStart());
        Assertions.assertEquals(LocalDateTime.parse("2025-03-09T11:00"), intent.getExecutionWindowEnd());
    }

    @Test
    public void shouldCapRetryCountOnRepeatedFailures() {
        ExecutionIntentEntity intent = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, "t1", "2025-03-09", "09:00");
        for (int i = 0; i < Constants.MAX_RETRY_COUNT + 3; i++) {
            intent.fail("boom", Constants.FAIL_REASON_RECOVERY_EXECUTION);
        }

        Assertions.assertEquals(Constants.MAX_RETRY_COUNT, intent.getRetryCount());
        Assertions.assertTrue(intent.isRetryExhausted());
        Assertions.assertFalse(intent.isMissedAt(LocalDateTime.parse("2025-03-10T00:00")));
    }

    @Test
    public void shouldRejectStartFromTerminalState() {
        ExecutionIntentEntity intent = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, "t1", "2025-03-09", "09:00");
        intent.complete("exec-1", LocalDateTime.parse("2025-03-09T09:05"));

        Assertions.assertThrows(IllegalStateException.class,
                () -> intent.start("exec-2", LocalDateTime.parse("2025-03-09T10:00")));
        Assertions.assertThrows(IllegalStateException.class, () -> intent.skip("x"));
        Assertions.assertThrows(IllegalStateException.class, () -> intent.cancel("x"));
        Assertions.assertTrue(intent.isTerminalOrRunning());
    }

    @Test
    public void shouldAllowCancelFromRunningAndFailed() {
        ExecutionIntentEntity running = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, "t1", "2025-03-09", "09:00");
        running.start("exec-1", LocalDateTime.parse("2025-03-09T09:00"));
        running.cancel(Constants.CANCEL_REASON_OPERATOR);
        Assertions.assertEquals(IntentStatusEnum.CANCELLED, running.getStatus());

        ExecutionIntentEntity failed = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, "t2", "2025-03-09", "09:00");
        failed.fail("boom", null);
        failed.cancel(Constants.CANCEL_REASON_OPERATOR);
        Assertions.assertEquals(IntentStatusEnum.CANCELLED, failed.getStatus());
    }

    @Test
    public void shouldRejectIntentWithoutNaturalKey() {
        ExecutionIntentEntity intent = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, "t1", "2025-03-09", "09:00");
        intent.setTaskId(" ");

        Assertions.assertFalse(intent.hasNaturalKey());
        Assertions.assertThrows(IllegalStateException.class, intent::validate);
    }
}
