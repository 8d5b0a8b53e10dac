package com.autopost.trigger.job;

import com.autopost.trigger.application.command.IntentPlanningApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 意图规划守护进程：为即将到来的触发点预先创建 pending 意图。
 */
@Slf4j
@Component
public class IntentPlanningDaemon {

    private final IntentPlanningApplicationService intentPlanningApplicationService;

    public IntentPlanningDaemon(IntentPlanningApplicationService intentPlanningApplicationService) {
        this.intentPlanningApplicationService = intentPlanningApplicationService;
    }

    @Scheduled(initialDelayString = "${recovery.planning.initial-delay-ms:1000}",
            fixedDelayString = "${recovery.planning.interval-ms:21600000}",
            scheduler = "daemonScheduler")
    public void planAhead() {
        try {
            intentPlanningApplicationService.planAhead();
        } catch (Exception ex) {
            log.warn("Intent planning failed. error={}", ex.getMessage());
        }
    }
}
