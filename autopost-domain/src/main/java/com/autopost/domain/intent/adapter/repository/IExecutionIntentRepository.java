package com.autopost.domain.intent.adapter.repository;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * 执行意图仓储接口。
 * <p>
 * 所有状态迁移均以自然键 (schedulerType, taskId, intendedDate) 定位，行不存在时为 no-op 并返回 false。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
public interface IExecutionIntentRepository {

    /**
     * 按自然键幂等写入；冲突时只更新 intendedTime 与窗口字段，不改状态。
     */
    ExecutionIntentEntity upsert(ExecutionIntentEntity intent);

    /**
     * 批量写入（单事务，全部成功或全部回滚）；冲突行保持原样。
     *
     * @return 实际新插入的行数
     */
    int bulkUpsert(List<ExecutionIntentEntity> intents);

    /**
     * PENDING/FAILED -> RUNNING
     */
    boolean markRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                        String executionId, LocalDateTime startedAt);

    boolean markCompleted(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                          String executionId, LocalDateTime completedAt);

    /**
     * 标记失败并累加 retryCount（封顶）
     */
    boolean markFailed(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                       String errorMessage, String reason);

    /**
     * PENDING/FAILED -> SKIPPED
     */
    boolean markSkipped(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate, String reason);

    /**
     * 非终态 -> CANCELLED
     */
    boolean markCancelled(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate, String reason);

    /**
     * 查询补偿候选：PENDING/FAILED、intendedDate 在回溯窗口内、窗口已结束、retryCount 未达上限。
     *
     * @param schedulerFilter 为空表示全部任务族
     */
    List<ExecutionIntentEntity> findEligible(int lookbackDays, LocalDateTime now, Set<SchedulerTypeEnum> schedulerFilter);

    /**
     * 当天意图是否已处于 RUNNING 或终态
     */
    boolean hasTerminalOrRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate);

    /**
     * 删除 intendedDate 早于 cutoffDate 且状态在给定集合内的意图
     */
    int deleteOlderThan(LocalDate cutoffDate, Set<IntentStatusEnum> statuses);

    /**
     * 删除缺失自然键字段的损坏行
     */
    int deleteCorrupt();

    ExecutionIntentEntity findByNaturalKey(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate);

    List<ExecutionIntentEntity> findByIntendedDate(LocalDate intendedDate);

    /**
     * RUNNING 且 actualStartedAt 早于给定时间
     */
    List<ExecutionIntentEntity> findStaleRunning(LocalDateTime startedBefore);

    /**
     * 重试耗尽的 FAILED 意图（intendedDate >= sinceDate）
     */
    List<ExecutionIntentEntity> findRetryExhausted(LocalDate sinceDate);
}
