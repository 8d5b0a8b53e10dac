package com.autopost.test.domain;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.intent.service.StuckIntentReaperDomainService;
import com.autopost.test.support.InMemoryExecutionIntentRepository;
import com.autopost.test.support.IntentFixtures;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

public class StuckIntentReaperDomainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.parse("2025-03-10T10:00");

    private final InMemoryExecutionIntentRepository repository = new InMemoryExecutionIntentRepository();
    private final StuckIntentReaperDomainService service = new StuckIntentReaperDomainService(repository);

    @Test
    public void shouldFailRunningIntentOlderThanOneHour() {
        seedRunning("stale", NOW.minusMinutes(90));
        seedRunning("fresh", NOW.minusMinutes(30));

        int reaped = service.reap(NOW);

        Assertions.assertEquals(1, reaped);
        ExecutionIntentEntity stale = repository.findByNaturalKey(SchedulerTypeEnum.DOCKER, "stale", LocalDate.parse("2025-03-10"));
        Assertions.assertEquals(IntentStatusEnum.FAILED, stale.getStatus());
        Assertions.assertEquals("inferred_crash: running longer than 60 minutes", stale.getErrorMessage());
        Assertions.assertEquals(Constants.FAIL_REASON_INFERRED_CRASH, stale.getSkipReason());
        Assertions.assertEquals(1, stale.getRetryCount());

        ExecutionIntentEntity fresh = repository.findByNaturalKey(SchedulerTypeEnum.DOCKER, "fresh", LocalDate.parse("2025-03-10"));
        Assertions.assertEquals(IntentStatusEnum.RUNNING, fresh.getStatus());
    }

    @Test
    public void shouldReturnZeroWhenNothingIsStuck() {
        Assertions.assertEquals(0, service.reap(NOW));
    }

    private void seedRunning(String taskId, LocalDateTime startedAt) {
        ExecutionIntentEntity intent = IntentFixtures.pending(SchedulerTypeEnum.DOCKER, taskId, "2025-03-10", "08:00");
        intent.setStatus(IntentStatusEnum.RUNNING);
        intent.setActualStartedAt(startedAt);
        repository.seed(intent);
    }
}
