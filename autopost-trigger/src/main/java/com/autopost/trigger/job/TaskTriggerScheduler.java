package com.autopost.trigger.job;

import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.domain.schedule.model.valobj.RecurrenceRule;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.domain.schedule.service.RecurrenceRuleDomainService;
import com.autopost.trigger.application.command.TriggerFireApplicationService;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 周期任务 cron 注册：按任务族把启用任务注册到各自的调度器，并定期与 Provider 同步（新增、删除、改期）。
 */
@Slf4j
@Component
public class TaskTriggerScheduler {

    private final FamilyTriggerSchedulers familyTriggerSchedulers;
    private final List<ITaskDefinitionProvider> taskDefinitionProviders;
    private final RecurrenceRuleDomainService recurrenceRuleDomainService;
    private final TriggerFireApplicationService triggerFireApplicationService;

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public TaskTriggerScheduler(FamilyTriggerSchedulers familyTriggerSchedulers,
                                List<ITaskDefinitionProvider> taskDefinitionProviders,
                                RecurrenceRuleDomainService recurrenceRuleDomainService,
                                TriggerFireApplicationService triggerFireApplicationService) {
        this.familyTriggerSchedulers = familyTriggerSchedulers;
        this.taskDefinitionProviders = taskDefinitionProviders == null ? List.of() : taskDefinitionProviders;
        this.recurrenceRuleDomainService = recurrenceRuleDomainService;
        this.triggerFireApplicationService = triggerFireApplicationService;
    }

    @Scheduled(initialDelayString = "${recovery.trigger.initial-delay-ms:2000}",
            fixedDelayString = "${recovery.trigger.refresh-interval-ms:60000}",
            scheduler = "daemonScheduler")
    public void refresh() {
        for (ITaskDefinitionProvider provider : taskDefinitionProviders) {
            try {
                refreshFamily(provider);
            } catch (Exception ex) {
                log.warn("Failed to refresh task triggers, keeping current registrations. schedulerType={}, error={}",
                        provider.schedulerType(), ex.getMessage());
            }
        }
    }

    private void refreshFamily(ITaskDefinitionProvider provider) {
        SchedulerTypeEnum schedulerType = provider.schedulerType();
        TaskScheduler scheduler = familyTriggerSchedulers.get(schedulerType);
        if (scheduler == null) {
            log.warn("No trigger scheduler for family. schedulerType={}", schedulerType);
            return;
        }

        Set<String> desiredKeys = new HashSet<>();
        for (TaskDefinition definition : provider.listEnabled()) {
            if (definition == null || !definition.isEnabled()) {
                continue;
            }
            Optional<RecurrenceRule> rule = recurrenceRuleDomainService.resolve(definition);
            if (rule.isEmpty()) {
                continue;
            }
            String key = registrationKey(schedulerType, definition.getTaskId());
            desiredKeys.add(key);
            String cronExpression = rule.get().getCronExpression();
            Registration existing = registrations.get(key);
            if (existing != null && existing.cronExpression().equals(cronExpression)) {
                continue;
            }
            if (existing != null) {
                existing.future().cancel(false);
            }
            String taskId = definition.getTaskId();
            ScheduledFuture<?> future = scheduler.schedule(
                    () -> fireSafely(schedulerType, taskId),
                    new CronTrigger(cronExpression));
            registrations.put(key, new Registration(schedulerType, cronExpression, future));
            log.info("Task trigger registered. schedulerType={}, taskId={}, cron={}",
                    schedulerType.getCode(), taskId, cronExpression);
        }

        registrations.entrySet().removeIf(entry -> {
            Registration registration = entry.getValue();
            if (registration.schedulerType() != schedulerType || desiredKeys.contains(entry.getKey())) {
                return false;
            }
            registration.future().cancel(false);
            log.info("Task trigger removed. key={}", entry.getKey());
            return true;
        });
    }

    void fireSafely(SchedulerTypeEnum schedulerType, String taskId) {
        try {
            TriggerFireApplicationService.FireOutcome outcome = triggerFireApplicationService.fire(schedulerType, taskId);
            log.debug("Task trigger fired. schedulerType={}, taskId={}, outcome={}", schedulerType, taskId, outcome);
        } catch (Exception ex) {
            log.warn("Task trigger firing failed. schedulerType={}, taskId={}, error={}",
                    schedulerType, taskId, ex.getMessage());
        }
    }

    /**
     * 当前注册的触发器快照：key -> cron
     */
    public Map<String, String> registeredTriggers() {
        Map<String, String> snapshot = new TreeMap<>();
        registrations.forEach((key, registration) -> snapshot.put(key, registration.cronExpression()));
        return snapshot;
    }

    private String registrationKey(SchedulerTypeEnum schedulerType, String taskId) {
        return schedulerType.getCode() + ":" + taskId;
    }

    private record Registration(SchedulerTypeEnum schedulerType, String cronExpression, ScheduledFuture<?> future) {
    }
}
