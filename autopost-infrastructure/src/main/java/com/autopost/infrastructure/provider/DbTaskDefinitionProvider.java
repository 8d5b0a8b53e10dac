package com.autopost.infrastructure.provider;

import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.infrastructure.dao.TaskDefinitionDao;
import com.autopost.infrastructure.dao.po.TaskDefinitionPO;
import com.autopost.infrastructure.util.JsonCodec;
import com.autopost.types.enums.FrequencyTypeEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于 scheduled_task_definitions 表的任务定义提供者，每个任务族一个实例（由配置类装配）。
 */
@Slf4j
public class DbTaskDefinitionProvider implements ITaskDefinitionProvider {

    private final SchedulerTypeEnum schedulerType;
    private final TaskDefinitionDao taskDefinitionDao;
    private final JsonCodec jsonCodec;

    public DbTaskDefinitionProvider(SchedulerTypeEnum schedulerType,
                                    TaskDefinitionDao taskDefinitionDao,
                                    JsonCodec jsonCodec) {
        this.schedulerType = schedulerType;
        this.taskDefinitionDao = taskDefinitionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SchedulerTypeEnum schedulerType() {
        return schedulerType;
    }

    @Override
    public TaskDefinition findByTaskId(String taskId) {
        return toDefinition(taskDefinitionDao.selectByTaskId(schedulerType.getCode(), taskId));
    }

    @Override
    public List<TaskDefinition> listEnabled() {
        List<TaskDefinitionPO> pos = taskDefinitionDao.selectEnabled(schedulerType.getCode());
        if (pos == null || pos.isEmpty()) {
            return Collections.emptyList();
        }
        List<TaskDefinition> definitions = new ArrayList<>(pos.size());
        for (TaskDefinitionPO po : pos) {
            TaskDefinition definition = toDefinition(po);
            if (definition != null) {
                definitions.add(definition);
            }
        }
        return definitions;
    }

    @Override
    public void recordRunOutcome(String taskId, boolean success, LocalDateTime finishedAt) {
        int updated = taskDefinitionDao.updateRunOutcome(schedulerType.getCode(), taskId,
                success ? "success" : "failed", success, finishedAt);
        if (updated == 0) {
            log.warn("Run outcome not recorded, task definition missing. schedulerType={}, taskId={}",
                    schedulerType.getCode(), taskId);
        }
    }

    private TaskDefinition toDefinition(TaskDefinitionPO po) {
        if (po == null) {
            return null;
        }
        FrequencyTypeEnum frequencyType;
        try {
            frequencyType = FrequencyTypeEnum.fromCode(po.getFrequencyType());
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping task definition with unknown frequency. taskId={}, frequencyType={}",
                    po.getTaskId(), po.getFrequencyType());
            return null;
        }
        return TaskDefinition.builder()
                .schedulerType(schedulerType)
                .taskId(po.getTaskId())
                .taskName(po.getTaskName())
                .enabled(Boolean.TRUE.equals(po.getEnabled()))
                .frequencyType(frequencyType)
                .scheduledTime(po.getScheduledTime())
                .dayOfWeek(po.getDayOfWeek())
                .dayOfMonth(po.getDayOfMonth())
                .customIntervalDays(po.getCustomIntervalDays())
                .lastSuccessAt(po.getLastSuccessAt())
                .executorConfig(jsonCodec.readMap(po.getExecutorConfig()))
                .build();
    }
}
