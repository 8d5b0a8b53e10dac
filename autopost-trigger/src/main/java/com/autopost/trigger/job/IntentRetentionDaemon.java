package com.autopost.trigger.job;

import com.autopost.trigger.application.command.IntentMaintenanceApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 意图保留期守护进程：每日清理超过保留期的已结束意图。
 */
@Slf4j
@Component
public class IntentRetentionDaemon {

    private final IntentMaintenanceApplicationService intentMaintenanceApplicationService;

    @Value("${recovery.retention.days:30}")
    private int retentionDays;

    public IntentRetentionDaemon(IntentMaintenanceApplicationService intentMaintenanceApplicationService) {
        this.intentMaintenanceApplicationService = intentMaintenanceApplicationService;
    }

    @Scheduled(cron = "${recovery.retention.cron:0 30 3 * * *}", scheduler = "daemonScheduler")
    public void cleanup() {
        try {
            intentMaintenanceApplicationService.cleanup(retentionDays);
        } catch (Exception ex) {
            log.warn("Intent retention cleanup failed. retentionDays={}, error={}", retentionDays, ex.getMessage());
        }
    }
}
