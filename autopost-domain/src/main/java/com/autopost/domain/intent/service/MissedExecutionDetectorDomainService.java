package com.autopost.domain.intent.service;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.intent.model.valobj.MissedExecution;
import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 错过执行检测：纯查询，无副作用。
 */
@Service
public class MissedExecutionDetectorDomainService {

    private final IExecutionIntentRepository executionIntentRepository;

    public MissedExecutionDetectorDomainService(IExecutionIntentRepository executionIntentRepository) {
        this.executionIntentRepository = executionIntentRepository;
    }

    public List<MissedExecution> detect(RecoveryOptions options, LocalDateTime now) {
        RecoveryOptions normalized = options == null ? RecoveryOptions.defaults().normalized() : options.normalized();
        List<ExecutionIntentEntity> eligible = executionIntentRepository.findEligible(
                normalized.getLookbackDays(), now, normalized.getSchedulerFilter());
        if (eligible == null || eligible.isEmpty()) {
            return Collections.emptyList();
        }
        List<MissedExecution> missed = new ArrayList<>(eligible.size());
        for (ExecutionIntentEntity intent : eligible) {
            if (intent == null || !intent.isMissedAt(now)) {
                continue;
            }
            missed.add(new MissedExecution(intent, daysMissed(intent, now)));
        }
        return missed;
    }

    long daysMissed(ExecutionIntentEntity intent, LocalDateTime now) {
        return Duration.between(intent.getExecutionWindowEnd(), now).toDays();
    }
}
