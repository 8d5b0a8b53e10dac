package com.autopost.trigger.application.command;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.model.valobj.TaskExecutionResult;
import com.autopost.domain.schedule.service.RecurrenceRuleDomainService;
import com.autopost.domain.schedule.service.TaskDispatchDomainService;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * 准点触发应用服务：cron 触发时创建当日意图并执行。
 */
@Slf4j
@Service
public class TriggerFireApplicationService {

    private final IExecutionIntentRepository executionIntentRepository;
    private final TaskDispatchDomainService taskDispatchDomainService;
    private final RecurrenceRuleDomainService recurrenceRuleDomainService;
    private final Clock clock;

    public TriggerFireApplicationService(IExecutionIntentRepository executionIntentRepository,
                                         TaskDispatchDomainService taskDispatchDomainService,
                                         RecurrenceRuleDomainService recurrenceRuleDomainService,
                                         Clock clock) {
        this.executionIntentRepository = executionIntentRepository;
        this.taskDispatchDomainService = taskDispatchDomainService;
        this.recurrenceRuleDomainService = recurrenceRuleDomainService;
        this.clock = clock;
    }

    public FireOutcome fire(SchedulerTypeEnum schedulerType, String taskId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();

        // 每次触发都实时读取定义
        TaskDefinition definition = taskDispatchDomainService.findDefinition(schedulerType, taskId);
        if (definition == null) {
            log.info("Trigger ignored, task definition missing. schedulerType={}, taskId={}", schedulerType, taskId);
            return FireOutcome.DEFINITION_MISSING;
        }
        if (!definition.isEnabled()) {
            log.info("Trigger ignored, task disabled. schedulerType={}, taskId={}", schedulerType, taskId);
            return FireOutcome.DISABLED;
        }
        if (!recurrenceRuleDomainService.isIntervalReached(definition, now)) {
            log.debug("Trigger ignored, custom interval not reached. schedulerType={}, taskId={}, lastSuccessAt={}",
                    schedulerType, taskId, definition.getLastSuccessAt());
            return FireOutcome.INTERVAL_NOT_REACHED;
        }
        if (executionIntentRepository.hasTerminalOrRunning(schedulerType, taskId, today)) {
            log.info("Trigger ignored, already handled today. schedulerType={}, taskId={}, date={}",
                    schedulerType, taskId, today);
            return FireOutcome.ALREADY_HANDLED;
        }

        LocalTime intendedTime = recurrenceRuleDomainService.parseScheduledTime(definition.getScheduledTime());
        if (intendedTime == null) {
            intendedTime = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        }
        executionIntentRepository.upsert(ExecutionIntentEntity.newPending(
                schedulerType, taskId, definition.getTaskName(), today, intendedTime, now));

        String executionId = "trigger-" + UUID.randomUUID();
        if (!executionIntentRepository.markRunning(schedulerType, taskId, today, executionId, now)) {
            log.info("Trigger lost claim on today's intent. schedulerType={}, taskId={}, date={}",
                    schedulerType, taskId, today);
            return FireOutcome.NOT_CLAIMED;
        }

        TaskExecutionResult result = taskDispatchDomainService.dispatch(schedulerType, taskId, today, executionId);
        LocalDateTime finishedAt = LocalDateTime.now(clock);
        if (result.success()) {
            executionIntentRepository.markCompleted(schedulerType, taskId, today, executionId, finishedAt);
        } else {
            executionIntentRepository.markFailed(schedulerType, taskId, today, result.error(), Constants.FAIL_REASON_SCHEDULED_EXECUTION);
            log.warn("Scheduled execution failed. schedulerType={}, taskId={}, error={}",
                    schedulerType, taskId, result.error());
        }
        recordRunOutcome(schedulerType, taskId, result.success(), finishedAt);
        return result.success() ? FireOutcome.COMPLETED : FireOutcome.FAILED;
    }

    private void recordRunOutcome(SchedulerTypeEnum schedulerType, String taskId, boolean success, LocalDateTime finishedAt) {
        ITaskDefinitionProvider provider = taskDispatchDomainService.provider(schedulerType);
        if (provider == null) {
            return;
        }
        try {
            provider.recordRunOutcome(taskId, success, finishedAt);
        } catch (Exception ex) {
            log.warn("Failed to record run outcome. schedulerType={}, taskId={}, error={}",
                    schedulerType, taskId, ex.getMessage());
        }
    }

    public enum FireOutcome {
        DEFINITION_MISSING,
        DISABLED,
        INTERVAL_NOT_REACHED,
        ALREADY_HANDLED,
        NOT_CLAIMED,
        COMPLETED,
        FAILED
    }
}
