package com.autopost.domain.schedule.adapter.executor;

import com.autopost.domain.schedule.model.valobj.ExecutorContext;
import com.autopost.domain.schedule.model.valobj.TaskExecutionResult;
import com.autopost.types.enums.SchedulerTypeEnum;

/**
 * 任务执行器端口：执行一次任务负载，每个任务族一个实现。
 */
public interface ITaskExecutor {

    SchedulerTypeEnum schedulerType();

    /**
     * 未完成配置的执行器不参与注册
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * 执行任务。
     *
     * @param taskId  任务 ID
     * @param context 本次调用的上下文（由实时任务定义构建）
     * @return 执行结果，实现可以抛出异常，由调度方转换为失败结果
     */
    TaskExecutionResult execute(String taskId, ExecutorContext context);
}
