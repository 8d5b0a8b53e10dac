package com.autopost.trigger.job;

import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import com.autopost.trigger.application.command.RecoveryApplicationService;
import com.autopost.types.enums.PriorityOrderEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 补偿守护进程：启动后短暂延迟执行一轮补偿，之后按固定间隔周期执行。
 */
@Slf4j
@Component
public class RecoveryDaemon {

    private final RecoveryApplicationService recoveryApplicationService;

    @Value("${recovery.enabled:true}")
    private boolean enabled;

    @Value("${recovery.lookback-days:3}")
    private int lookbackDays;

    @Value("${recovery.auto-execute:true}")
    private boolean autoExecute;

    @Value("${recovery.max-catch-up-executions:3}")
    private int maxCatchUpExecutions;

    @Value("${recovery.priority-order:oldest_first}")
    private String priorityOrder;

    public RecoveryDaemon(RecoveryApplicationService recoveryApplicationService) {
        this.recoveryApplicationService = recoveryApplicationService;
    }

    @Scheduled(initialDelayString = "${recovery.startup-delay-ms:5000}",
            fixedDelayString = "${recovery.interval-ms:3600000}",
            scheduler = "daemonScheduler")
    public void runRecovery() {
        if (!enabled) {
            return;
        }
        try {
            recoveryApplicationService.recover(RecoveryOptions.builder()
                    .lookbackDays(lookbackDays)
                    .autoExecute(autoExecute)
                    .maxCatchUpExecutions(maxCatchUpExecutions)
                    .priorityOrder(PriorityOrderEnum.fromCodeOrDefault(priorityOrder))
                    .build());
        } catch (Exception ex) {
            log.warn("Recovery pass failed. error={}", ex.getMessage());
        }
    }
}
