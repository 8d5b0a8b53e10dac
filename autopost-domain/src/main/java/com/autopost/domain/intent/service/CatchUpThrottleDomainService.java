package com.autopost.domain.intent.service;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.valobj.MissedExecution;
import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.PriorityOrderEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 补偿排序与限流：按 priorityOrder 排序后取前 maxCatchUpExecutions 条执行，
 * 其余在任何执行开始前标记为 SKIPPED(exceeded_max_catchup_executions)。
 */
@Slf4j
@Service
public class CatchUpThrottleDomainService {

    private static final Comparator<MissedExecution> OLDEST_FIRST = Comparator
            .comparing(MissedExecution::getIntendedDate)
            .thenComparing(MissedExecution::getIntendedTime, Comparator.nullsFirst(Comparator.<LocalTime>naturalOrder()));

    private final IExecutionIntentRepository executionIntentRepository;

    public CatchUpThrottleDomainService(IExecutionIntentRepository executionIntentRepository) {
        this.executionIntentRepository = executionIntentRepository;
    }

    public ThrottlePlan prioritize(List<MissedExecution> candidates, RecoveryOptions options) {
        if (candidates == null || candidates.isEmpty()) {
            return ThrottlePlan.empty();
        }
        RecoveryOptions normalized = options == null ? RecoveryOptions.defaults().normalized() : options.normalized();

        List<MissedExecution> valid = new ArrayList<>(candidates.size());
        int invalidCount = 0;
        for (MissedExecution missed : candidates) {
            if (missed == null || missed.getIntendedDate() == null) {
                invalidCount++;
                log.warn("Skipping missed intent without intendedDate. taskName={}, taskId={}",
                        missed == null ? null : missed.getTaskName(),
                        missed == null ? null : missed.getTaskId());
                continue;
            }
            valid.add(missed);
        }

        Comparator<MissedExecution> comparator = normalized.getPriorityOrder() == PriorityOrderEnum.NEWEST_FIRST
                ? OLDEST_FIRST.reversed()
                : OLDEST_FIRST;
        valid.sort(comparator);

        int limit = Math.min(normalized.getMaxCatchUpExecutions(), valid.size());
        List<MissedExecution> toExecute = new ArrayList<>(valid.subList(0, limit));
        List<MissedExecution> toSkip = new ArrayList<>(valid.subList(limit, valid.size()));
        return new ThrottlePlan(toExecute, toSkip, invalidCount);
    }

    /**
     * 排序 + 切分，并立即把超出上限的部分落库为 SKIPPED。存储异常向上抛出。
     */
    public ThrottlePlan throttle(List<MissedExecution> candidates, RecoveryOptions options) {
        ThrottlePlan plan = prioritize(candidates, options);
        for (MissedExecution missed : plan.toSkip()) {
            executionIntentRepository.markSkipped(
                    missed.getSchedulerType(),
                    missed.getTaskId(),
                    missed.getIntendedDate(),
                    Constants.SKIP_REASON_THROTTLED);
        }
        if (!plan.toSkip().isEmpty()) {
            log.info("Catch-up throttled. execute={}, skipped={}", plan.toExecute().size(), plan.toSkip().size());
        }
        return plan;
    }

    public record ThrottlePlan(List<MissedExecution> toExecute,
                               List<MissedExecution> toSkip,
                               int invalidCount) {

        public static ThrottlePlan empty() {
            return new ThrottlePlan(Collections.emptyList(), Collections.emptyList(), 0);
        }
    }
}
