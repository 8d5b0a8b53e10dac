package com.autopost.domain.intent.service;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.valobj.MissedExecution;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.CatchUpPolicyEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 错过执行去重：LATEST_ONLY 任务族同一 taskId 只保留 intendedDate 最大的一条，
 * 其余尽力标记为 SKIPPED(superseded_by_newer_attempt)。
 */
@Slf4j
@Service
public class MissedExecutionDeduplicationDomainService {

    private final IExecutionIntentRepository executionIntentRepository;
    private final CatchUpPolicy catchUpPolicy;

    public MissedExecutionDeduplicationDomainService(IExecutionIntentRepository executionIntentRepository,
                                                     CatchUpPolicy catchUpPolicy) {
        this.executionIntentRepository = executionIntentRepository;
        this.catchUpPolicy = catchUpPolicy == null ? CatchUpPolicy.latestOnly() : catchUpPolicy;
    }

    public DeduplicationResult deduplicate(List<MissedExecution> missedExecutions) {
        if (missedExecutions == null || missedExecutions.isEmpty()) {
            return DeduplicationResult.empty();
        }

        Map<String, MissedExecution> latestByTask = new LinkedHashMap<>();
        List<MissedExecution> passThrough = new ArrayList<>();
        List<MissedExecution> superseded = new ArrayList<>();

        for (MissedExecution missed : missedExecutions) {
            if (missed == null) {
                continue;
            }
            if (missed.getIntendedDate() == null || resolvePolicy(missed) == CatchUpPolicyEnum.REPLAY_ALL) {
                passThrough.add(missed);
                continue;
            }
            String groupKey = missed.getSchedulerType().getCode() + ":" + missed.getTaskId();
            MissedExecution current = latestByTask.get(groupKey);
            if (current == null) {
                latestByTask.put(groupKey, missed);
            } else if (missed.getIntendedDate().isAfter(current.getIntendedDate())) {
                superseded.add(current);
                latestByTask.put(groupKey, missed);
            } else {
                superseded.add(missed);
            }
        }

        List<MissedExecution> kept = new ArrayList<>(latestByTask.size() + passThrough.size());
        for (MissedExecution missed : missedExecutions) {
            if (missed != null && (passThrough.contains(missed) || latestByTask.containsValue(missed))) {
                kept.add(missed);
            }
        }

        int markFailures = 0;
        for (MissedExecution missed : superseded) {
            try {
                executionIntentRepository.markSkipped(
                        missed.getSchedulerType(),
                        missed.getTaskId(),
                        missed.getIntendedDate(),
                        Constants.SKIP_REASON_SUPERSEDED);
                log.info("Missed intent superseded by newer attempt. key={}", missed.getIntent().naturalKey());
            } catch (Exception ex) {
                markFailures++;
                log.warn("Failed to mark superseded intent skipped. key={}, error={}",
                        missed.getIntent().naturalKey(), ex.getMessage());
            }
        }

        return new DeduplicationResult(kept, superseded, markFailures);
    }

    private CatchUpPolicyEnum resolvePolicy(MissedExecution missed) {
        CatchUpPolicyEnum policy = catchUpPolicy.resolve(missed.getSchedulerType());
        return policy == null ? CatchUpPolicyEnum.LATEST_ONLY : policy;
    }

    public record DeduplicationResult(List<MissedExecution> kept,
                                      List<MissedExecution> superseded,
                                      int markFailures) {

        public static DeduplicationResult empty() {
            return new DeduplicationResult(Collections.emptyList(), Collections.emptyList(), 0);
        }
    }
}
