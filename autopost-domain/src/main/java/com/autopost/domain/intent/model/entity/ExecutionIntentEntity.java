package com.autopost.domain.intent.model.entity;

import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 执行意图领域实体：记录一个周期任务在某一天“应该执行一次”的事实。
 * <p>
 * 自然键为 (schedulerType, taskId, intendedDate)，仓储层保证其唯一。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
public class ExecutionIntentEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 任务族
     */
    private SchedulerTypeEnum schedulerType;

    /**
     * 任务族内稳定的任务标识
     */
    private String taskId;

    /**
     * 任务名称（创建时快照，仅用于展示）
     */
    private String taskName;

    /**
     * 计划执行日期
     */
    private LocalDate intendedDate;

    /**
     * 计划执行时刻
     */
    private LocalTime intendedTime;

    /**
     * 准点窗口开始
     */
    private LocalDateTime executionWindowStart;

    /**
     * 准点窗口结束，超过后意图进入补偿候选
     */
    private LocalDateTime executionWindowEnd;

    /**
     * 状态
     */
    private IntentStatusEnum status;

    /**
     * 实际执行 ID
     */
    private String actualExecutionId;

    private LocalDateTime actualStartedAt;

    private LocalDateTime actualCompletedAt;

    /**
     * 跳过 / 失败原因（结构化短码）
     */
    private String skipReason;

    private String errorMessage;

    /**
     * 失败次数，上限 {@link Constants#MAX_RETRY_COUNT}
     */
    private Integer retryCount;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 创建一个 PENDING 意图，窗口为 [windowStart, windowStart + 2h]。
     */
    public static ExecutionIntentEntity newPending(SchedulerTypeEnum schedulerType,
                                                   String taskId,
                                                   String taskName,
                                                   LocalDate intendedDate,
                                                   LocalTime intendedTime,
                                                   LocalDateTime windowStart) {
        ExecutionIntentEntity intent = new ExecutionIntentEntity();
        intent.setSchedulerType(schedulerType);
        intent.setTaskId(taskId);
        intent.setTaskName(taskName);
        intent.setIntendedDate(intendedDate);
        intent.setIntendedTime(intendedTime);
        intent.setExecutionWindowStart(windowStart);
        intent.setExecutionWindowEnd(windowStart == null ? null : windowStart.plusHours(Constants.EXECUTION_WINDOW_HOURS));
        intent.setStatus(IntentStatusEnum.PENDING);
        intent.setRetryCount(0);
        return intent;
    }

    /**
     * 校验自然键与窗口字段
     */
    public void validate() {
        if (!hasNaturalKey()) {
            throw new IllegalStateException("Intent natural key (schedulerType, taskId, intendedDate) cannot be empty");
        }
        if (executionWindowStart == null || executionWindowEnd == null) {
            throw new IllegalStateException("Execution window cannot be null");
        }
        if (executionWindowEnd.isBefore(executionWindowStart)) {
            throw new IllegalStateException("Execution window end must not be before start");
        }
    }

    public boolean hasNaturalKey() {
        return schedulerType != null
                && taskId != null && !taskId.trim().isEmpty()
                && intendedDate != null;
    }

    /**
     * 开始执行
     */
    public void start(String executionId, LocalDateTime startedAt) {
        if (this.status != IntentStatusEnum.PENDING && this.status != IntentStatusEnum.FAILED) {
            throw new IllegalStateException("Intent must be PENDING or FAILED to start, current: " + this.status);
        }
        this.status = IntentStatusEnum.RUNNING;
        this.actualExecutionId = executionId;
        this.actualStartedAt = startedAt;
        this.updatedAt = startedAt;
    }

    /**
     * 完成执行
     */
    public void complete(String executionId, LocalDateTime completedAt) {
        this.status = IntentStatusEnum.COMPLETED;
        this.actualExecutionId = executionId;
        this.actualCompletedAt = completedAt;
        this.updatedAt = completedAt;
    }

    /**
     * 标记失败并累加重试次数（封顶）
     */
    public void fail(String errorMessage, String reason) {
        this.status = IntentStatusEnum.FAILED;
        this.errorMessage = errorMessage;
        this.skipReason = reason;
        this.retryCount = Math.min(normalizedRetryCount() + 1, Constants.MAX_RETRY_COUNT);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 跳过（仅 PENDING / FAILED 可跳过）
     */
    public void skip(String reason) {
        if (!isRecoverable()) {
            throw new IllegalStateException("Only PENDING or FAILED intents can be skipped, current: " + this.status);
        }
        this.status = IntentStatusEnum.SKIPPED;
        this.skipReason = reason;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 人工取消
     */
    public void cancel(String reason) {
        if (!isCancellable()) {
            throw new IllegalStateException("Terminal intent cannot be cancelled, current: " + this.status);
        }
        this.status = IntentStatusEnum.CANCELLED;
        this.skipReason = reason;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isRecoverable() {
        return this.status != null && this.status.isRecoverable();
    }

    public boolean isCancellable() {
        return this.status != null && !this.status.isTerminal();
    }

    public boolean isTerminalOrRunning() {
        return this.status == IntentStatusEnum.RUNNING || (this.status != null && this.status.isTerminal());
    }

    public int normalizedRetryCount() {
        return this.retryCount == null ? 0 : Math.max(this.retryCount, 0);
    }

    public boolean isRetryExhausted() {
        return normalizedRetryCount() >= Constants.MAX_RETRY_COUNT;
    }

    /**
     * 准点窗口已过且仍未进入终态
     */
    public boolean isMissedAt(LocalDateTime now) {
        return isRecoverable()
                && !isRetryExhausted()
                && executionWindowEnd != null
                && executionWindowEnd.isBefore(now);
    }

    /**
     * RUNNING 且开始时间早于阈值
     */
    public boolean isStaleRunning(LocalDateTime startedBefore) {
        return this.status == IntentStatusEnum.RUNNING
                && this.actualStartedAt != null
                && this.actualStartedAt.isBefore(startedBefore);
    }

    public String naturalKey() {
        return (schedulerType == null ? "-" : schedulerType.getCode()) + ":" + taskId + ":" + intendedDate;
    }
}
