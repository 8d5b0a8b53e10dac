package com.autopost.domain.intent.service;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 卡死意图回收：RUNNING 超过固定超时视为进程崩溃，转为 FAILED 以便重新进入补偿扫描。
 */
@Slf4j
@Service
public class StuckIntentReaperDomainService {

    private final IExecutionIntentRepository executionIntentRepository;

    public StuckIntentReaperDomainService(IExecutionIntentRepository executionIntentRepository) {
        this.executionIntentRepository = executionIntentRepository;
    }

    /**
     * @return 本次回收的意图数
     */
    public int reap(LocalDateTime now) {
        LocalDateTime startedBefore = now.minusMinutes(Constants.STUCK_RUNNING_TIMEOUT_MINUTES);
        List<ExecutionIntentEntity> staleIntents = executionIntentRepository.findStaleRunning(startedBefore);
        if (staleIntents == null || staleIntents.isEmpty()) {
            return 0;
        }
        int reaped = 0;
        for (ExecutionIntentEntity intent : staleIntents) {
            if (intent == null || !intent.hasNaturalKey()) {
                continue;
            }
            boolean updated = executionIntentRepository.markFailed(
                    intent.getSchedulerType(),
                    intent.getTaskId(),
                    intent.getIntendedDate(),
                    Constants.STUCK_RUNNING_MESSAGE,
                    Constants.FAIL_REASON_INFERRED_CRASH);
            if (updated) {
                reaped++;
                log.warn("Stuck intent reaped. key={}, startedAt={}, retryCount={}",
                        intent.naturalKey(), intent.getActualStartedAt(), intent.normalizedRetryCount() + 1);
            }
        }
        return reaped;
    }
}
