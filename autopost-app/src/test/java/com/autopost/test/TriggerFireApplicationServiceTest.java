package com.autopost.test;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.service.RecurrenceRuleDomainService;
import com.autopost.domain.schedule.service.TaskDispatchDomainService;
import com.autopost.test.support.InMemoryExecutionIntentRepository;
import com.autopost.test.support.InMemoryTaskDefinitionProvider;
import com.autopost.test.support.IntentFixtures;
import com.autopost.test.support.MutableClock;
import com.autopost.test.support.RecordingTaskExecutor;
import com.autopost.trigger.application.command.TriggerFireApplicationService;
import com.autopost.trigger.application.command.TriggerFireApplicationService.FireOutcome;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.FrequencyTypeEnum;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public class TriggerFireApplicationServiceTest {

    private static final LocalDate TODAY = LocalDate.parse("2025-03-10");

    private InMemoryExecutionIntentRepository repository;
    private InMemoryTaskDefinitionProvider provider;
    private RecordingTaskExecutor executor;
    private TriggerFireApplicationService service;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryExecutionIntentRepository();
        provider = new InMemoryTaskDefinitionProvider(SchedulerTypeEnum.SCHEDULED_POSTS)
                .put(InMemoryTaskDefinitionProvider.daily("digest", "09:00"));
        executor = new RecordingTaskExecutor(SchedulerTypeEnum.SCHEDULED_POSTS);
        service = new TriggerFireApplicationService(
                repository,
                new TaskDispatchDomainService(List.of(executor), List.of(provider)),
                new RecurrenceRuleDomainService(),
                new MutableClock(LocalDateTime.parse("2025-03-10T09:00")));
    }

    @Test
    public void shouldCreateAndCompleteTodaysIntent() {
        FireOutcome outcome = service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "digest");

        Assertions.assertEquals(FireOutcome.COMPLETED, outcome);
        ExecutionIntentEntity intent = repository.findByNaturalKey(SchedulerTypeEnum.SCHEDULED_POSTS, "digest", TODAY);
        Assertions.assertEquals(IntentStatusEnum.COMPLETED, intent.getStatus());
        Assertions.assertEquals(LocalDateTime.parse("2025-03-10T11:00"), intent.getExecutionWindowEnd());
        Assertions.assertTrue(intent.getActualExecutionId().startsWith("trigger-"));
        Assertions.assertEquals(List.of("digest:success"), provider.getOutcomes());
    }

    @Test
    public void shouldNotRunTwiceOnSameDay() {
        service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "digest");

        FireOutcome second = service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "digest");

        Assertions.assertEquals(FireOutcome.ALREADY_HANDLED, second);
        Assertions.assertEquals(1, executor.getInvocations().size());
    }

    @Test
    public void shouldReusePlannedIntent() {
        repository.seed(IntentFixtures.pending(SchedulerTypeEnum.SCHEDULED_POSTS, "digest", "2025-03-10", "09:00"));

        FireOutcome outcome = service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "digest");

        Assertions.assertEquals(FireOutcome.COMPLETED, outcome);
        Assertions.assertEquals(1, repository.size());
    }

    @Test
    public void shouldMarkIntentFailedWhenExecutorFails() {
        executor.failWith("digest", "smtp timeout");

        FireOutcome outcome = service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "digest");

        Assertions.assertEquals(FireOutcome.FAILED, outcome);
        ExecutionIntentEntity intent = repository.findByNaturalKey(SchedulerTypeEnum.SCHEDULED_POSTS, "digest", TODAY);
        Assertions.assertEquals(IntentStatusEnum.FAILED, intent.getStatus());
        Assertions.assertEquals("smtp timeout", intent.getErrorMessage());
        Assertions.assertEquals(Constants.FAIL_REASON_SCHEDULED_EXECUTION, intent.getSkipReason());
        Assertions.assertEquals(1, intent.getRetryCount());
    }

    @Test
    public void shouldIgnoreDisabledOrMissingTasks() {
        TaskDefinition disabled = InMemoryTaskDefinitionProvider.daily("paused", "09:00");
        disabled.setEnabled(false);
        provider.put(disabled);

        Assertions.assertEquals(FireOutcome.DISABLED, service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "paused"));
        Assertions.assertEquals(FireOutcome.DEFINITION_MISSING, service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "gone"));
        Assertions.assertEquals(0, repository.size());
    }

    @Test
    public void shouldWaitForCustomInterval() {
        TaskDefinition custom = InMemoryTaskDefinitionProvider.daily("weekly-report", "09:00");
        custom.setFrequencyType(FrequencyTypeEnum.CUSTOM);
        custom.setCustomIntervalDays(7);
        custom.setLastSuccessAt(LocalDateTime.parse("2025-03-07T09:00"));
        provider.put(custom);

        Assertions.assertEquals(FireOutcome.INTERVAL_NOT_REACHED,
                service.fire(SchedulerTypeEnum.SCHEDULED_POSTS, "weekly-report"));
        Assertions.assertTrue(executor.getInvocations().isEmpty());
    }
}
