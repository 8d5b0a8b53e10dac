package com.autopost.trigger.job;

import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 各任务族独立的触发调度器，互不阻塞。
 */
@Slf4j
public class FamilyTriggerSchedulers implements DisposableBean {

    private final Map<SchedulerTypeEnum, TaskScheduler> schedulers;

    public FamilyTriggerSchedulers(Map<SchedulerTypeEnum, ? extends TaskScheduler> schedulers) {
        Map<SchedulerTypeEnum, TaskScheduler> copy = new EnumMap<>(SchedulerTypeEnum.class);
        if (schedulers != null) {
            copy.putAll(schedulers);
        }
        this.schedulers = Collections.unmodifiableMap(copy);
    }

    /**
     * 未配置调度器的任务族返回 null
     */
    public TaskScheduler get(SchedulerTypeEnum schedulerType) {
        return schedulerType == null ? null : schedulers.get(schedulerType);
    }

    @Override
    public void destroy() {
        for (Map.Entry<SchedulerTypeEnum, TaskScheduler> entry : schedulers.entrySet()) {
            if (entry.getValue() instanceof ThreadPoolTaskScheduler) {
                ((ThreadPoolTaskScheduler) entry.getValue()).shutdown();
                log.info("Trigger scheduler stopped. schedulerType={}", entry.getKey().getCode());
            }
        }
    }
}
