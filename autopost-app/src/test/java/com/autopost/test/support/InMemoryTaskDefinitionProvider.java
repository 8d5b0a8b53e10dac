package com.autopost.test.support;

import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.types.enums.FrequencyTypeEnum;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存任务定义提供者。
 */
public class InMemoryTaskDefinitionProvider implements ITaskDefinitionProvider {

    private final SchedulerTypeEnum schedulerType;
    private final Map<String, TaskDefinition> definitions = new LinkedHashMap<>();
    private final List<String> outcomes = new ArrayList<>();

    public InMemoryTaskDefinitionProvider(SchedulerTypeEnum schedulerType) {
        this.schedulerType = schedulerType;
    }

    public static TaskDefinition daily(String taskId, String scheduledTime) {
        return TaskDefinition.builder()
                .taskId(taskId)
                .taskName("task-" + taskId)
                .enabled(true)
                .frequencyType(FrequencyTypeEnum.DAILY)
                .scheduledTime(scheduledTime)
                .build();
    }

    public InMemoryTaskDefinitionProvider put(TaskDefinition definition) {
        definition.setSchedulerType(schedulerType);
        definitions.put(definition.getTaskId(), definition);
        return this;
    }

    public void remove(String taskId) {
        definitions.remove(taskId);
    }

    @Override
    public SchedulerTypeEnum schedulerType() {
        return schedulerType;
    }

    @Override
    public TaskDefinition findByTaskId(String taskId) {
        return definitions.get(taskId);
    }

    @Override
    public List<TaskDefinition> listEnabled() {
        return definitions.values().stream()
                .filter(TaskDefinition::isEnabled)
                .collect(Collectors.toList());
    }

    @Override
    public void recordRunOutcome(String taskId, boolean success, LocalDateTime finishedAt) {
        outcomes.add(taskId + ":" + (success ? "success" : "failed"));
        TaskDefinition definition = definitions.get(taskId);
        if (definition != null && success) {
            definition.setLastSuccessAt(finishedAt);
        }
    }

    public List<String> getOutcomes() {
        return outcomes;
    }
}
