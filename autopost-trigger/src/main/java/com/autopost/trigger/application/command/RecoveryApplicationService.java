package com.autopost.trigger.application.command;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.valobj.ExecutionItemResult;
import com.autopost.domain.intent.model.valobj.MissedExecution;
import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import com.autopost.domain.intent.model.valobj.RecoveryReport;
import com.autopost.domain.intent.service.CatchUpThrottleDomainService;
import com.autopost.domain.intent.service.CatchUpThrottleDomainService.ThrottlePlan;
import com.autopost.domain.intent.service.MissedExecutionDeduplicationDomainService;
import com.autopost.domain.intent.service.MissedExecutionDeduplicationDomainService.DeduplicationResult;
import com.autopost.domain.intent.service.MissedExecutionDetectorDomainService;
import com.autopost.domain.intent.service.StuckIntentReaperDomainService;
import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.model.valobj.TaskExecutionResult;
import com.autopost.domain.schedule.service.TaskDispatchDomainService;
import com.autopost.trigger.application.observability.RetryExhaustedAlertNotifier;
import com.autopost.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 补偿编排应用服务：清理损坏行 -> 回收卡死意图 -> 检测 -> 去重 -> 限流 -> 顺序执行 -> 报告。
 * <p>
 * 回收、检测、限流阶段的存储异常直接抛出；单个补偿项的失败只记录在报告中，不中断本轮。
 * </p>
 */
@Slf4j
@Service
public class RecoveryApplicationService {

    private final IExecutionIntentRepository executionIntentRepository;
    private final StuckIntentReaperDomainService stuckIntentReaperDomainService;
    private final MissedExecutionDetectorDomainService missedExecutionDetectorDomainService;
    private final MissedExecutionDeduplicationDomainService missedExecutionDeduplicationDomainService;
    private final CatchUpThrottleDomainService catchUpThrottleDomainService;
    private final TaskDispatchDomainService taskDispatchDomainService;
    private final RetryExhaustedAlertNotifier retryExhaustedAlertNotifier;
    private final Clock clock;

    public RecoveryApplicationService(IExecutionIntentRepository executionIntentRepository,
                                      StuckIntentReaperDomainService stuckIntentReaperDomainService,
                                      MissedExecutionDetectorDomainService missedExecutionDetectorDomainService,
                                      MissedExecutionDeduplicationDomainService missedExecutionDeduplicationDomainService,
                                      CatchUpThrottleDomainService catchUpThrottleDomainService,
                                      TaskDispatchDomainService taskDispatchDomainService,
                                      RetryExhaustedAlertNotifier retryExhaustedAlertNotifier,
                                      Clock clock) {
        this.executionIntentRepository = executionIntentRepository;
        this.stuckIntentReaperDomainService = stuckIntentReaperDomainService;
        this.missedExecutionDetectorDomainService = missedExecutionDetectorDomainService;
        this.missedExecutionDeduplicationDomainService = missedExecutionDeduplicationDomainService;
        this.catchUpThrottleDomainService = catchUpThrottleDomainService;
        this.taskDispatchDomainService = taskDispatchDomainService;
        this.retryExhaustedAlertNotifier = retryExhaustedAlertNotifier;
        this.clock = clock;
    }

    /**
     * 只检测，不做任何状态变更。
     */
    public List<MissedExecution> detectMissed(RecoveryOptions options) {
        RecoveryOptions normalized = normalize(options);
        return missedExecutionDetectorDomainService.detect(normalized, LocalDateTime.now(clock));
    }

    public RecoveryReport recover(RecoveryOptions options) {
        RecoveryOptions normalized = normalize(options);
        LocalDateTime now = LocalDateTime.now(clock);

        cleanupCorrupt();
        int reaped = stuckIntentReaperDomainService.reap(now);

        List<MissedExecution> missed = missedExecutionDetectorDomainService.detect(normalized, now);
        if (missed.isEmpty()) {
            signalRetryExhausted(normalized, now);
            log.info("Recovery pass finished, nothing missed. reaped={}", reaped);
            return RecoveryReport.empty(reaped);
        }

        DeduplicationResult deduplication = missedExecutionDeduplicationDomainService.deduplicate(missed);
        ThrottlePlan plan = catchUpThrottleDomainService.throttle(deduplication.kept(), normalized);

        RecoveryReport report = RecoveryReport.builder()
                .missedCount(missed.size())
                .reapedCount(reaped)
                .supersededCount(deduplication.superseded().size())
                .skippedCount(deduplication.superseded().size() + plan.toSkip().size())
                .invalidCount(plan.invalidCount())
                .missedExecutions(new ArrayList<>(missed))
                .build();

        if (normalized.isAutoExecuteEnabled()) {
            for (MissedExecution missedExecution : plan.toExecute()) {
                String inactiveReason = inactiveReason(missedExecution);
                if (inactiveReason != null) {
                    if (skipInactive(missedExecution, inactiveReason)) {
                        report.setSkippedCount(report.getSkippedCount() + 1);
                        report.setInactiveCount(report.getInactiveCount() + 1);
                    }
                    continue;
                }
                ExecutionItemResult result = executeOne(missedExecution);
                if (result == null) {
                    continue;
                }
                report.getExecutionResults().add(result);
                if (result.isSuccess()) {
                    report.setExecutedCount(report.getExecutedCount() + 1);
                } else {
                    report.setFailedCount(report.getFailedCount() + 1);
                }
            }
        }

        signalRetryExhausted(normalized, now);
        log.info("Recovery pass finished. missed={}, executed={}, failed={}, skipped={}, superseded={}, inactive={}, reaped={}, invalid={}",
                report.getMissedCount(),
                report.getExecutedCount(),
                report.getFailedCount(),
                report.getSkippedCount(),
                report.getSupersededCount(),
                report.getInactiveCount(),
                report.getReapedCount(),
                report.getInvalidCount());
        return report;
    }

    /**
     * 执行单个补偿项。意图已被其他执行方领取时返回 null。
     */
    private ExecutionItemResult executeOne(MissedExecution missed) {
        String executionId = "recovery-" + UUID.randomUUID();
        ExecutionItemResult.ExecutionItemResultBuilder result = ExecutionItemResult.builder()
                .intentId(missed.getIntentId())
                .schedulerType(missed.getSchedulerType())
                .taskId(missed.getTaskId())
                .taskName(missed.getTaskName())
                .intendedDate(missed.getIntendedDate());
        try {
            boolean claimed = executionIntentRepository.markRunning(missed.getSchedulerType(), missed.getTaskId(),
                    missed.getIntendedDate(), executionId, LocalDateTime.now(clock));
            if (!claimed) {
                log.info("Missed intent already claimed, skip executing. key={}", missed.getIntent().naturalKey());
                return null;
            }
            TaskExecutionResult executionResult = taskDispatchDomainService.dispatch(
                    missed.getSchedulerType(), missed.getTaskId(), missed.getIntendedDate(), executionId);
            LocalDateTime finishedAt = LocalDateTime.now(clock);
            if (executionResult.success()) {
                executionIntentRepository.markCompleted(missed.getSchedulerType(), missed.getTaskId(),
                        missed.getIntendedDate(), executionId, finishedAt);
                recordRunOutcome(missed, true, finishedAt);
                log.info("Missed intent recovered. key={}, executionId={}", missed.getIntent().naturalKey(), executionId);
                return result.success(true).build();
            }
            executionIntentRepository.markFailed(missed.getSchedulerType(), missed.getTaskId(),
                    missed.getIntendedDate(), executionResult.error(), Constants.FAIL_REASON_RECOVERY_EXECUTION);
            recordRunOutcome(missed, false, finishedAt);
            log.warn("Missed intent recovery failed. key={}, error={}", missed.getIntent().naturalKey(), executionResult.error());
            return result.success(false).error(executionResult.error()).build();
        } catch (Exception ex) {
            log.warn("Missed intent recovery aborted. key={}, error={}", missed.getIntent().naturalKey(), ex.getMessage());
            markFailedQuietly(missed, ex);
            return result.success(false).error(ex.getMessage()).build();
        }
    }

    /**
     * 按实时任务定义判断是否仍应执行：定义已删除或已停用时返回跳过原因。
     * 该任务族没有定义提供者，或读取定义失败时返回 null，交由分发阶段处理。
     */
    private String inactiveReason(MissedExecution missed) {
        ITaskDefinitionProvider provider = taskDispatchDomainService.provider(missed.getSchedulerType());
        if (provider == null) {
            return null;
        }
        TaskDefinition definition;
        try {
            definition = provider.findByTaskId(missed.getTaskId());
        } catch (Exception ex) {
            log.warn("Failed to load task definition before recovery. key={}, error={}",
                    missed.getIntent().naturalKey(), ex.getMessage());
            return null;
        }
        if (definition == null) {
            return Constants.SKIP_REASON_TASK_NOT_FOUND;
        }
        if (!definition.isEnabled()) {
            return Constants.SKIP_REASON_TASK_DISABLED;
        }
        return null;
    }

    private boolean skipInactive(MissedExecution missed, String reason) {
        boolean skipped = executionIntentRepository.markSkipped(missed.getSchedulerType(), missed.getTaskId(),
                missed.getIntendedDate(), reason);
        if (skipped) {
            log.info("Missed intent skipped, task no longer active. key={}, reason={}",
                    missed.getIntent().naturalKey(), reason);
        }
        return skipped;
    }

    private void markFailedQuietly(MissedExecution missed, Exception cause) {
        try {
            executionIntentRepository.markFailed(missed.getSchedulerType(), missed.getTaskId(),
                    missed.getIntendedDate(), cause.getMessage(), Constants.FAIL_REASON_RECOVERY_EXECUTION);
        } catch (Exception ex) {
            log.warn("Failed to mark intent failed after aborted recovery. key={}, error={}",
                    missed.getIntent().naturalKey(), ex.getMessage());
        }
    }

    private void recordRunOutcome(MissedExecution missed, boolean success, LocalDateTime finishedAt) {
        ITaskDefinitionProvider provider = taskDispatchDomainService.provider(missed.getSchedulerType());
        if (provider == null) {
            return;
        }
        try {
            provider.recordRunOutcome(missed.getTaskId(), success, finishedAt);
        } catch (Exception ex) {
            log.warn("Failed to record run outcome. key={}, error={}", missed.getIntent().naturalKey(), ex.getMessage());
        }
    }

    private void cleanupCorrupt() {
        try {
            int deleted = executionIntentRepository.deleteCorrupt();
            if (deleted > 0) {
                log.warn("Corrupt intents removed. count={}", deleted);
            }
        } catch (Exception ex) {
            log.warn("Corrupt intent cleanup failed. error={}", ex.getMessage());
        }
    }

    private void signalRetryExhausted(RecoveryOptions options, LocalDateTime now) {
        try {
            retryExhaustedAlertNotifier.notifyExhausted(now.toLocalDate(), options.getLookbackDays());
        } catch (Exception ex) {
            log.warn("Retry exhausted check failed. error={}", ex.getMessage());
        }
    }

    private RecoveryOptions normalize(RecoveryOptions options) {
        return options == null ? RecoveryOptions.defaults().normalized() : options.normalized();
    }
}
