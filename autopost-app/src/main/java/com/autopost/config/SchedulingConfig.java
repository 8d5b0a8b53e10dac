package com.autopost.config;

import com.autopost.trigger.job.FamilyTriggerSchedulers;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * 调度器隔离配置：
 * 1) daemon-scheduler 承载补偿、预生成、保留期清理与触发器同步等守护任务；
 * 2) 每个任务族一个 trigger scheduler，任务族之间的 cron 触发互不阻塞。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:2}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:daemon-scheduler-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, threadNamePrefix, awaitTerminationSeconds);
    }

    @Bean
    public FamilyTriggerSchedulers familyTriggerSchedulers(
            @Value("${scheduling.trigger.pool-size:2}") int poolSize,
            @Value("${scheduling.trigger.await-termination-seconds:30}") int awaitTerminationSeconds) {
        Map<SchedulerTypeEnum, ThreadPoolTaskScheduler> schedulers = new EnumMap<>(SchedulerTypeEnum.class);
        for (SchedulerTypeEnum schedulerType : SchedulerTypeEnum.values()) {
            ThreadPoolTaskScheduler scheduler = buildScheduler(poolSize,
                    "trigger-" + schedulerType.getCode() + "-",
                    awaitTerminationSeconds);
            scheduler.initialize();
            schedulers.put(schedulerType, scheduler);
        }
        return new FamilyTriggerSchedulers(schedulers);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private ThreadPoolTaskScheduler buildScheduler(int poolSize, String threadNamePrefix, int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }

    /**
     * 集成测试通过 spring.task.scheduling.enabled=false 关闭守护任务
     */
    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "spring.task.scheduling.enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingEnablement {
    }
}
