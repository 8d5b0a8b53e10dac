package com.autopost.infrastructure.repository.intent;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.infrastructure.dao.ExecutionIntentDao;
import com.autopost.infrastructure.dao.po.ExecutionIntentPO;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 执行意图仓储实现类。
 * <p>
 * 负责执行意图的持久化操作，包括：
 * <ul>
 *   <li>按自然键 upsert 与批量预生成</li>
 *   <li>带状态守卫的状态迁移（markRunning / markSkipped / markCancelled）</li>
 *   <li>补偿候选、卡死意图、重试耗尽意图查询</li>
 *   <li>保留期清理与损坏行清理</li>
 *   <li>Entity 与 PO 之间的相互转换（枚举以 code 落库）</li>
 * </ul>
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class ExecutionIntentRepositoryImpl implements IExecutionIntentRepository {

    private final ExecutionIntentDao executionIntentDao;

    public ExecutionIntentRepositoryImpl(ExecutionIntentDao executionIntentDao) {
        this.executionIntentDao = executionIntentDao;
    }

    /**
     * 按自然键 upsert，返回落库后的最新状态。
     */
    @Override
    public ExecutionIntentEntity upsert(ExecutionIntentEntity intent) {
        intent.validate();
        if (intent.getStatus() == null) {
            intent.setStatus(IntentStatusEnum.PENDING);
        }
        executionIntentDao.upsert(toPO(intent));
        return findByNaturalKey(intent.getSchedulerType(), intent.getTaskId(), intent.getIntendedDate());
    }

    /**
     * 批量写入，单事务。
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public int bulkUpsert(List<ExecutionIntentEntity> intents) {
        if (intents == null || intents.isEmpty()) {
            return 0;
        }
        List<ExecutionIntentPO> pos = intents.stream()
                .peek(ExecutionIntentEntity::validate)
                .map(this::toPO)
                .collect(Collectors.toList());
        for (ExecutionIntentPO po : pos) {
            if (po.getStatus() == null) {
                po.setStatus(IntentStatusEnum.PENDING.getCode());
            }
        }
        return executionIntentDao.batchInsertIgnoreConflict(pos);
    }

    @Override
    public boolean markRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                               String executionId, LocalDateTime startedAt) {
        return executionIntentDao.markRunning(code(schedulerType), taskId, intendedDate, executionId, startedAt) > 0;
    }

    @Override
    public boolean markCompleted(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                 String executionId, LocalDateTime completedAt) {
        return executionIntentDao.markCompleted(code(schedulerType), taskId, intendedDate, executionId, completedAt) > 0;
    }

    @Override
    public boolean markFailed(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                              String errorMessage, String reason) {
        return executionIntentDao.markFailed(code(schedulerType), taskId, intendedDate, errorMessage, reason,
                Constants.MAX_RETRY_COUNT) > 0;
    }

    @Override
    public boolean markSkipped(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate, String reason) {
        return executionIntentDao.markSkipped(code(schedulerType), taskId, intendedDate, reason) > 0;
    }

    @Override
    public boolean markCancelled(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate, String reason) {
        return executionIntentDao.markCancelled(code(schedulerType), taskId, intendedDate, reason) > 0;
    }

    /**
     * 查询补偿候选，回溯起点为 today - lookbackDays。
     */
    @Override
    public List<ExecutionIntentEntity> findEligible(int lookbackDays, LocalDateTime now,
                                                    Set<SchedulerTypeEnum> schedulerFilter) {
        LocalDate sinceDate = now.toLocalDate().minusDays(Math.max(lookbackDays, 0));
        List<String> types = schedulerFilter == null || schedulerFilter.isEmpty()
                ? Collections.emptyList()
                : schedulerFilter.stream().map(SchedulerTypeEnum::getCode).sorted().collect(Collectors.toList());
        return toEntities(executionIntentDao.selectEligible(sinceDate, now, Constants.MAX_RETRY_COUNT, types));
    }

    @Override
    public boolean hasTerminalOrRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate) {
        return executionIntentDao.countTerminalOrRunning(code(schedulerType), taskId, intendedDate) > 0;
    }

    @Override
    public int deleteOlderThan(LocalDate cutoffDate, Set<IntentStatusEnum> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return 0;
        }
        List<String> codes = statuses.stream().map(IntentStatusEnum::getCode).sorted().collect(Collectors.toList());
        return executionIntentDao.deleteOlderThan(cutoffDate, codes);
    }

    @Override
    public int deleteCorrupt() {
        return executionIntentDao.deleteCorrupt();
    }

    @Override
    public ExecutionIntentEntity findByNaturalKey(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate) {
        return toEntity(executionIntentDao.selectByNaturalKey(code(schedulerType), taskId, intendedDate));
    }

    @Override
    public List<ExecutionIntentEntity> findByIntendedDate(LocalDate intendedDate) {
        return toEntities(executionIntentDao.selectByIntendedDate(intendedDate));
    }

    @Override
    public List<ExecutionIntentEntity> findStaleRunning(LocalDateTime startedBefore) {
        return toEntities(executionIntentDao.selectStaleRunning(startedBefore));
    }

    @Override
    public List<ExecutionIntentEntity> findRetryExhausted(LocalDate sinceDate) {
        return toEntities(executionIntentDao.selectRetryExhausted(sinceDate, Constants.MAX_RETRY_COUNT));
    }

    private String code(SchedulerTypeEnum schedulerType) {
        return schedulerType == null ? null : schedulerType.getCode();
    }

    private List<ExecutionIntentEntity> toEntities(List<ExecutionIntentPO> pos) {
        if (pos == null || pos.isEmpty()) {
            return Collections.emptyList();
        }
        return pos.stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity，未知编码按 null 处理并记录告警
     */
    private ExecutionIntentEntity toEntity(ExecutionIntentPO po) {
        if (po == null) {
            return null;
        }
        ExecutionIntentEntity entity = new ExecutionIntentEntity();
        entity.setId(po.getId());
        entity.setSchedulerType(parseSchedulerType(po));
        entity.setTaskId(po.getTaskId());
        entity.setTaskName(po.getTaskName());
        entity.setIntendedDate(po.getIntendedDate());
        entity.setIntendedTime(po.getIntendedTime());
        entity.setExecutionWindowStart(po.getExecutionWindowStart());
        entity.setExecutionWindowEnd(po.getExecutionWindowEnd());
        entity.setStatus(IntentStatusEnum.fromCode(po.getStatus()));
        entity.setActualExecutionId(po.getActualExecutionId());
        entity.setActualStartedAt(po.getActualStartedAt());
        entity.setActualCompletedAt(po.getActualCompletedAt());
        entity.setSkipReason(po.getSkipReason());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setRetryCount(po.getRetryCount());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private SchedulerTypeEnum parseSchedulerType(ExecutionIntentPO po) {
        try {
            return SchedulerTypeEnum.fromCode(po.getSchedulerType());
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown scheduler type on intent row. id={}, schedulerType={}", po.getId(), po.getSchedulerType());
            return null;
        }
    }

    /**
     * Entity 转换为 PO
     */
    private ExecutionIntentPO toPO(ExecutionIntentEntity entity) {
        return ExecutionIntentPO.builder()
                .id(entity.getId())
                .schedulerType(code(entity.getSchedulerType()))
                .taskId(entity.getTaskId())
                .taskName(entity.getTaskName())
                .intendedDate(entity.getIntendedDate())
                .intendedTime(entity.getIntendedTime())
                .executionWindowStart(entity.getExecutionWindowStart())
                .executionWindowEnd(entity.getExecutionWindowEnd())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .actualExecutionId(entity.getActualExecutionId())
                .actualStartedAt(entity.getActualStartedAt())
                .actualCompletedAt(entity.getActualCompletedAt())
                .skipReason(entity.getSkipReason())
                .errorMessage(entity.getErrorMessage())
                .retryCount(entity.getRetryCount())
                .build();
    }
}
