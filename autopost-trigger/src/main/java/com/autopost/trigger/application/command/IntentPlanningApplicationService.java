package com.autopost.trigger.application.command;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.service.RecurrenceRuleDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 意图预生成：为所有启用任务批量写入未来若干天的 PENDING 意图，
 * 进程停机期间错过的执行因此在重启后可被检测到。
 */
@Slf4j
@Service
public class IntentPlanningApplicationService {

    private final IExecutionIntentRepository executionIntentRepository;
    private final RecurrenceRuleDomainService recurrenceRuleDomainService;
    private final List<ITaskDefinitionProvider> taskDefinitionProviders;
    private final Clock clock;

    @Value("${recovery.planning.horizon-days:2}")
    private int horizonDays;

    public IntentPlanningApplicationService(IExecutionIntentRepository executionIntentRepository,
                                            RecurrenceRuleDomainService recurrenceRuleDomainService,
                                            List<ITaskDefinitionProvider> taskDefinitionProviders,
                                            Clock clock) {
        this.executionIntentRepository = executionIntentRepository;
        this.recurrenceRuleDomainService = recurrenceRuleDomainService;
        this.taskDefinitionProviders = taskDefinitionProviders == null ? List.of() : taskDefinitionProviders;
        this.clock = clock;
    }

    public PlanningResult planAhead() {
        return planAhead(horizonDays);
    }

    /**
     * 规划 [now, today + horizonDays + 1 天零点) 内的全部触发点。
     */
    public PlanningResult planAhead(int days) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime until = now.toLocalDate().plusDays(Math.max(days, 0) + 1L).atStartOfDay();

        List<ExecutionIntentEntity> intents = new ArrayList<>();
        int taskCount = 0;
        for (ITaskDefinitionProvider provider : taskDefinitionProviders) {
            List<TaskDefinition> definitions;
            try {
                definitions = provider.listEnabled();
            } catch (Exception ex) {
                log.warn("Failed to list task definitions for planning. schedulerType={}, error={}",
                        provider.schedulerType(), ex.getMessage());
                continue;
            }
            for (TaskDefinition definition : definitions) {
                if (definition == null || !definition.isEnabled()) {
                    continue;
                }
                taskCount++;
                for (LocalDateTime firing : recurrenceRuleDomainService.planOccurrences(definition, now, until)) {
                    intents.add(ExecutionIntentEntity.newPending(
                            provider.schedulerType(),
                            definition.getTaskId(),
                            definition.getTaskName(),
                            firing.toLocalDate(),
                            firing.toLocalTime(),
                            firing));
                }
            }
        }

        int inserted = executionIntentRepository.bulkUpsert(intents);
        log.info("Intent planning finished. tasks={}, planned={}, inserted={}, horizonDays={}",
                taskCount, intents.size(), inserted, days);
        return new PlanningResult(taskCount, intents.size(), inserted);
    }

    public record PlanningResult(int taskCount, int plannedCount, int insertedCount) {
    }
}
