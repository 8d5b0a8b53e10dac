package com.autopost.infrastructure.dao;

import com.autopost.infrastructure.dao.po.ExecutionIntentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 执行意图 DAO
 *
 * @author autopost
 * @since 2025-03-02
 */
@Mapper
public interface ExecutionIntentDao {

    /**
     * 按自然键 upsert，冲突时只更新时刻与窗口
     */
    int upsert(ExecutionIntentPO po);

    /**
     * 批量插入，冲突行忽略
     */
    int batchInsertIgnoreConflict(@Param("list") List<ExecutionIntentPO> list);

    ExecutionIntentPO selectByNaturalKey(@Param("schedulerType") String schedulerType,
                                         @Param("taskId") String taskId,
                                         @Param("intendedDate") LocalDate intendedDate);

    /**
     * PENDING/FAILED -> RUNNING
     */
    int markRunning(@Param("schedulerType") String schedulerType,
                    @Param("taskId") String taskId,
                    @Param("intendedDate") LocalDate intendedDate,
                    @Param("executionId") String executionId,
                    @Param("startedAt") LocalDateTime startedAt);

    int markCompleted(@Param("schedulerType") String schedulerType,
                      @Param("taskId") String taskId,
                      @Param("intendedDate") LocalDate intendedDate,
                      @Param("executionId") String executionId,
                      @Param("completedAt") LocalDateTime completedAt);

    /**
     * 标记失败，retry_count 累加并封顶
     */
    int markFailed(@Param("schedulerType") String schedulerType,
                   @Param("taskId") String taskId,
                   @Param("intendedDate") LocalDate intendedDate,
                   @Param("errorMessage") String errorMessage,
                   @Param("reason") String reason,
                   @Param("maxRetryCount") int maxRetryCount);

    int markSkipped(@Param("schedulerType") String schedulerType,
                    @Param("taskId") String taskId,
                    @Param("intendedDate") LocalDate intendedDate,
                    @Param("reason") String reason);

    int markCancelled(@Param("schedulerType") String schedulerType,
                      @Param("taskId") String taskId,
                      @Param("intendedDate") LocalDate intendedDate,
                      @Param("reason") String reason);

    /**
     * 查询补偿候选
     */
    List<ExecutionIntentPO> selectEligible(@Param("sinceDate") LocalDate sinceDate,
                                           @Param("now") LocalDateTime now,
                                           @Param("maxRetryCount") int maxRetryCount,
                                           @Param("schedulerTypes") List<String> schedulerTypes);

    /**
     * 统计当日 RUNNING 或终态意图数
     */
    int countTerminalOrRunning(@Param("schedulerType") String schedulerType,
                               @Param("taskId") String taskId,
                               @Param("intendedDate") LocalDate intendedDate);

    int deleteOlderThan(@Param("cutoffDate") LocalDate cutoffDate,
                        @Param("statuses") List<String> statuses);

    /**
     * 删除自然键字段缺失的行
     */
    int deleteCorrupt();

    List<ExecutionIntentPO> selectByIntendedDate(@Param("intendedDate") LocalDate intendedDate);

    List<ExecutionIntentPO> selectStaleRunning(@Param("startedBefore") LocalDateTime startedBefore);

    List<ExecutionIntentPO> selectRetryExhausted(@Param("sinceDate") LocalDate sinceDate,
                                                 @Param("maxRetryCount") int maxRetryCount);
}
