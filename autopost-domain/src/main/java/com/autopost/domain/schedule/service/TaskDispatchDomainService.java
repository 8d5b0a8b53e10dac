package com.autopost.domain.schedule.service;

import com.autopost.domain.schedule.adapter.executor.ITaskExecutor;
import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.ExecutorContext;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.model.valobj.TaskExecutionResult;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 任务分发领域服务：按任务族路由到执行器，执行上下文每次由实时任务定义构建。
 * <p>
 * 未注册的任务族、缺失的任务定义以及执行器异常均转换为失败结果，不向上抛出。
 * </p>
 */
@Slf4j
@Service
public class TaskDispatchDomainService {

    private final Map<SchedulerTypeEnum, ITaskExecutor> executors = new EnumMap<>(SchedulerTypeEnum.class);
    private final Map<SchedulerTypeEnum, ITaskDefinitionProvider> providers = new EnumMap<>(SchedulerTypeEnum.class);

    public TaskDispatchDomainService(List<ITaskExecutor> executorList,
                                     List<ITaskDefinitionProvider> providerList) {
        if (executorList != null) {
            for (ITaskExecutor executor : executorList) {
                if (!executor.isAvailable()) {
                    log.warn("Executor not available, family left unregistered. schedulerType={}", executor.schedulerType());
                    continue;
                }
                ITaskExecutor previous = executors.put(executor.schedulerType(), executor);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate executor for scheduler type: " + executor.schedulerType());
                }
            }
        }
        if (providerList != null) {
            for (ITaskDefinitionProvider provider : providerList) {
                ITaskDefinitionProvider previous = providers.put(provider.schedulerType(), provider);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate task definition provider for scheduler type: "
                            + provider.schedulerType());
                }
            }
        }
        log.info("Task dispatch initialized. executors={}, providers={}", executors.keySet(), providers.keySet());
    }

    public TaskExecutionResult dispatch(SchedulerTypeEnum schedulerType,
                                        String taskId,
                                        LocalDate intendedDate,
                                        String executionId) {
        ITaskExecutor executor = schedulerType == null ? null : executors.get(schedulerType);
        if (executor == null) {
            log.warn("No executor registered for scheduler type. schedulerType={}, taskId={}", schedulerType, taskId);
            return TaskExecutionResult.failure("Unknown scheduler type: " + schedulerType);
        }
        TaskDefinition definition = findDefinition(schedulerType, taskId);
        if (definition == null) {
            return TaskExecutionResult.failure("Task definition not found: " + taskId);
        }
        ExecutorContext context = ExecutorContext.builder()
                .schedulerType(schedulerType)
                .taskName(definition.getTaskName())
                .intendedDate(intendedDate)
                .executionId(executionId)
                .config(definition.getExecutorConfig() == null
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new HashMap<>(definition.getExecutorConfig())))
                .build();
        try {
            TaskExecutionResult result = executor.execute(taskId, context);
            if (result == null) {
                return TaskExecutionResult.failure("Executor returned no result");
            }
            return result;
        } catch (Exception ex) {
            log.warn("Executor invocation failed. schedulerType={}, taskId={}, error={}",
                    schedulerType, taskId, ex.getMessage());
            return TaskExecutionResult.failure(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
    }

    public TaskDefinition findDefinition(SchedulerTypeEnum schedulerType, String taskId) {
        ITaskDefinitionProvider provider = schedulerType == null ? null : providers.get(schedulerType);
        if (provider == null) {
            return null;
        }
        return provider.findByTaskId(taskId);
    }

    public ITaskDefinitionProvider provider(SchedulerTypeEnum schedulerType) {
        return schedulerType == null ? null : providers.get(schedulerType);
    }

    public Set<SchedulerTypeEnum> registeredExecutorTypes() {
        return Collections.unmodifiableSet(executors.keySet());
    }

    public Set<SchedulerTypeEnum> registeredProviderTypes() {
        return Collections.unmodifiableSet(providers.keySet());
    }
}
