package com.autopost.trigger.application.command;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.ResponseCode;
import com.autopost.types.enums.SchedulerTypeEnum;
import com.autopost.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * 意图维护：保留期清理、当日执行判定、人工取消。
 */
@Slf4j
@Service
public class IntentMaintenanceApplicationService {

    /**
     * 保留期清理覆盖的状态；PENDING 与 RUNNING 永不按保留期删除
     */
    public static final Set<IntentStatusEnum> RETENTION_STATUSES = EnumSet.of(
            IntentStatusEnum.COMPLETED,
            IntentStatusEnum.FAILED,
            IntentStatusEnum.SKIPPED,
            IntentStatusEnum.CANCELLED);

    private final IExecutionIntentRepository executionIntentRepository;
    private final Clock clock;

    public IntentMaintenanceApplicationService(IExecutionIntentRepository executionIntentRepository, Clock clock) {
        this.executionIntentRepository = executionIntentRepository;
        this.clock = clock;
    }

    /**
     * 删除 intendedDate 早于 today - retentionDays 的已结束意图。
     */
    public int cleanup(int retentionDays) {
        if (retentionDays < 1) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, "retentionDays must be >= 1");
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        int deleted = executionIntentRepository.deleteOlderThan(cutoff, RETENTION_STATUSES);
        log.info("Intent retention cleanup finished. retentionDays={}, cutoff={}, deleted={}",
                retentionDays, cutoff, deleted);
        return deleted;
    }

    public boolean hasRunToday(SchedulerTypeEnum schedulerType, String taskId) {
        requireTask(schedulerType, taskId);
        return executionIntentRepository.hasTerminalOrRunning(schedulerType, taskId, LocalDate.now(clock));
    }

    public ExecutionIntentEntity cancel(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate, String reason) {
        requireTask(schedulerType, taskId);
        if (intendedDate == null) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, "intendedDate is required");
        }
        ExecutionIntentEntity intent = executionIntentRepository.findByNaturalKey(schedulerType, taskId, intendedDate);
        if (intent == null) {
            throw AppException.of(ResponseCode.INTENT_NOT_FOUND);
        }
        if (!intent.isCancellable()) {
            throw AppException.of(ResponseCode.INTENT_STATE_CONFLICT,
                    "Intent is already " + intent.getStatus().getCode());
        }
        String cancelReason = StringUtils.defaultIfBlank(reason, Constants.CANCEL_REASON_OPERATOR);
        if (!executionIntentRepository.markCancelled(schedulerType, taskId, intendedDate, cancelReason)) {
            throw AppException.of(ResponseCode.INTENT_STATE_CONFLICT, "Intent changed state concurrently");
        }
        log.info("Intent cancelled by operator. key={}, reason={}", intent.naturalKey(), cancelReason);
        return executionIntentRepository.findByNaturalKey(schedulerType, taskId, intendedDate);
    }

    private void requireTask(SchedulerTypeEnum schedulerType, String taskId) {
        if (schedulerType == null || StringUtils.isBlank(taskId)) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, "schedulerType and taskId are required");
        }
    }
}
