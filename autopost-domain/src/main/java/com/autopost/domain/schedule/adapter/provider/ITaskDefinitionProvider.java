package com.autopost.domain.schedule.adapter.provider;

import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务定义提供者端口，每个任务族一个实现。
 */
public interface ITaskDefinitionProvider {

    SchedulerTypeEnum schedulerType();

    /**
     * 实时读取任务定义，不存在返回 null
     */
    TaskDefinition findByTaskId(String taskId);

    List<TaskDefinition> listEnabled();

    /**
     * 回写一次执行结果（成功时刷新 lastSuccessAt）
     */
    void recordRunOutcome(String taskId, boolean success, LocalDateTime finishedAt);
}
