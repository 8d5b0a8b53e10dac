package com.autopost.trigger.application.observability;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.google.common.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 重试耗尽告警：达到重试上限的意图每天只告警一次，并累计计数器。
 */
@Slf4j
@Component
public class RetryExhaustedAlertNotifier {

    private final IExecutionIntentRepository executionIntentRepository;
    private final Cache<String, Boolean> alertedCache;
    private final Counter retryExhaustedCounter;

    public RetryExhaustedAlertNotifier(IExecutionIntentRepository executionIntentRepository,
                                       @Qualifier("retryExhaustedAlertCache") Cache<String, Boolean> alertedCache) {
        this.executionIntentRepository = executionIntentRepository;
        this.alertedCache = alertedCache;
        this.retryExhaustedCounter = Counter.builder("autopost.recovery.retry_exhausted.total")
                .register(Metrics.globalRegistry);
    }

    /**
     * @return 本次新告警的意图
     */
    public List<ExecutionIntentEntity> notifyExhausted(LocalDate today, int lookbackDays) {
        List<ExecutionIntentEntity> exhausted = executionIntentRepository.findRetryExhausted(
                today.minusDays(Math.max(lookbackDays, 0)));
        if (exhausted == null || exhausted.isEmpty()) {
            return Collections.emptyList();
        }
        List<ExecutionIntentEntity> alerted = new ArrayList<>();
        for (ExecutionIntentEntity intent : exhausted) {
            String cacheKey = today + "|" + intent.naturalKey();
            if (alertedCache.asMap().putIfAbsent(cacheKey, Boolean.TRUE) != null) {
                continue;
            }
            retryExhaustedCounter.increment();
            alerted.add(intent);
            log.warn("Intent retry exhausted, excluded from recovery. key={}, retryCount={}, lastError={}",
                    intent.naturalKey(), intent.getRetryCount(), intent.getErrorMessage());
        }
        return alerted;
    }
}
