package com.autopost.test.support;

import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内存执行意图仓储，状态守卫与 SQL 映射保持一致。
 */
public class InMemoryExecutionIntentRepository implements IExecutionIntentRepository {

    private final Map<Long, ExecutionIntentEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized ExecutionIntentEntity upsert(ExecutionIntentEntity intent) {
        intent.validate();
        ExecutionIntentEntity existing = find(intent.getSchedulerType(), intent.getTaskId(), intent.getIntendedDate());
        if (existing != null) {
            existing.setIntendedTime(intent.getIntendedTime());
            existing.setExecutionWindowStart(intent.getExecutionWindowStart());
            existing.setExecutionWindowEnd(intent.getExecutionWindowEnd());
            existing.setUpdatedAt(LocalDateTime.now());
            return copy(existing);
        }
        insert(intent);
        return findByNaturalKey(intent.getSchedulerType(), intent.getTaskId(), intent.getIntendedDate());
    }

    @Override
    public synchronized int bulkUpsert(List<ExecutionIntentEntity> intents) {
        if (intents == null) {
            return 0;
        }
        intents.forEach(ExecutionIntentEntity::validate);
        int inserted = 0;
        for (ExecutionIntentEntity intent : intents) {
            if (find(intent.getSchedulerType(), intent.getTaskId(), intent.getIntendedDate()) == null) {
                insert(intent);
                inserted++;
            }
        }
        return inserted;
    }

    /**
     * 直接写入一行（可写入损坏行或任意状态），返回分配的 ID。
     */
    public synchronized ExecutionIntentEntity seed(ExecutionIntentEntity intent) {
        return copy(insert(intent));
    }

    @Override
    public synchronized boolean markRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                            String executionId, LocalDateTime startedAt) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        if (intent == null || !intent.isRecoverable()) {
            return false;
        }
        intent.setStatus(IntentStatusEnum.RUNNING);
        intent.setActualExecutionId(executionId);
        intent.setActualStartedAt(startedAt);
        intent.setActualCompletedAt(null);
        return true;
    }

    @Override
    public synchronized boolean markCompleted(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                              String executionId, LocalDateTime completedAt) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        if (intent == null) {
            return false;
        }
        intent.complete(executionId, completedAt);
        intent.setErrorMessage(null);
        return true;
    }

    @Override
    public synchronized boolean markFailed(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                           String errorMessage, String reason) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        if (intent == null) {
            return false;
        }
        intent.fail(errorMessage, reason);
        return true;
    }

    @Override
    public synchronized boolean markSkipped(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                            String reason) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        if (intent == null || !intent.isRecoverable()) {
            return false;
        }
        intent.skip(reason);
        return true;
    }

    @Override
    public synchronized boolean markCancelled(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate,
                                              String reason) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        if (intent == null || !intent.isCancellable()) {
            return false;
        }
        intent.cancel(reason);
        return true;
    }

    @Override
    public synchronized List<ExecutionIntentEntity> findEligible(int lookbackDays, LocalDateTime now,
                                                                 Set<SchedulerTypeEnum> schedulerFilter) {
        LocalDate sinceDate = now.toLocalDate().minusDays(lookbackDays);
        return store.values().stream()
                .filter(intent -> intent.getSchedulerType() != null && intent.getTaskId() != null)
                .filter(ExecutionIntentEntity::isRecoverable)
                .filter(intent -> intent.getIntendedDate() != null && !intent.getIntendedDate().isBefore(sinceDate))
                .filter(intent -> intent.getExecutionWindowEnd() != null && intent.getExecutionWindowEnd().isBefore(now))
                .filter(intent -> intent.normalizedRetryCount() < Constants.MAX_RETRY_COUNT)
                .filter(intent -> schedulerFilter == null || schedulerFilter.isEmpty()
                        || schedulerFilter.contains(intent.getSchedulerType()))
                .sorted(Comparator.comparing(ExecutionIntentEntity::getIntendedDate)
                        .thenComparing(ExecutionIntentEntity::getIntendedTime,
                                Comparator.nullsFirst(Comparator.<LocalTime>naturalOrder())))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean hasTerminalOrRunning(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate) {
        ExecutionIntentEntity intent = find(schedulerType, taskId, intendedDate);
        return intent != null && intent.isTerminalOrRunning();
    }

    @Override
    public synchronized int deleteOlderThan(LocalDate cutoffDate, Set<IntentStatusEnum> statuses) {
        int deleted = 0;
        Iterator<ExecutionIntentEntity> iterator = store.values().iterator();
        while (iterator.hasNext()) {
            ExecutionIntentEntity intent = iterator.next();
            if (intent.getIntendedDate() != null
                    && intent.getIntendedDate().isBefore(cutoffDate)
                    && statuses.contains(intent.getStatus())) {
                iterator.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized int deleteCorrupt() {
        int deleted = 0;
        Iterator<ExecutionIntentEntity> iterator = store.values().iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().hasNaturalKey()) {
                iterator.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized ExecutionIntentEntity findByNaturalKey(SchedulerTypeEnum schedulerType, String taskId,
                                                               LocalDate intendedDate) {
        return copy(find(schedulerType, taskId, intendedDate));
    }

    @Override
    public synchronized List<ExecutionIntentEntity> findByIntendedDate(LocalDate intendedDate) {
        return store.values().stream()
                .filter(intent -> intendedDate.equals(intent.getIntendedDate()))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ExecutionIntentEntity> findStaleRunning(LocalDateTime startedBefore) {
        return store.values().stream()
                .filter(intent -> intent.isStaleRunning(startedBefore))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ExecutionIntentEntity> findRetryExhausted(LocalDate sinceDate) {
        return store.values().stream()
                .filter(intent -> intent.getStatus() == IntentStatusEnum.FAILED)
                .filter(ExecutionIntentEntity::isRetryExhausted)
                .filter(intent -> intent.getIntendedDate() != null && !intent.getIntendedDate().isBefore(sinceDate))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    public synchronized List<ExecutionIntentEntity> all() {
        return store.values().stream().map(this::copy).collect(Collectors.toList());
    }

    public synchronized int size() {
        return store.size();
    }

    private ExecutionIntentEntity insert(ExecutionIntentEntity intent) {
        ExecutionIntentEntity stored = copy(intent);
        stored.setId(nextId++);
        if (stored.getStatus() == null) {
            stored.setStatus(IntentStatusEnum.PENDING);
        }
        if (stored.getRetryCount() == null) {
            stored.setRetryCount(0);
        }
        stored.setCreatedAt(LocalDateTime.now());
        stored.setUpdatedAt(stored.getCreatedAt());
        store.put(stored.getId(), stored);
        return stored;
    }

    private ExecutionIntentEntity find(SchedulerTypeEnum schedulerType, String taskId, LocalDate intendedDate) {
        for (ExecutionIntentEntity intent : store.values()) {
            if (intent.getSchedulerType() == schedulerType
                    && taskId != null && taskId.equals(intent.getTaskId())
                    && intendedDate != null && intendedDate.equals(intent.getIntendedDate())) {
                return intent;
            }
        }
        return null;
    }

    private ExecutionIntentEntity copy(ExecutionIntentEntity source) {
        if (source == null) {
            return null;
        }
        ExecutionIntentEntity target = new ExecutionIntentEntity();
        target.setId(source.getId());
        target.setSchedulerType(source.getSchedulerType());
        target.setTaskId(source.getTaskId());
        target.setTaskName(source.getTaskName());
        target.setIntendedDate(source.getIntendedDate());
        target.setIntendedTime(source.getIntendedTime());
        target.setExecutionWindowStart(source.getExecutionWindowStart());
        target.setExecutionWindowEnd(source.getExecutionWindowEnd());
        target.setStatus(source.getStatus());
        target.setActualExecutionId(source.getActualExecutionId());
        target.setActualStartedAt(source.getActualStartedAt());
        target.setActualCompletedAt(source.getActualCompletedAt());
        target.setSkipReason(source.getSkipReason());
        target.setErrorMessage(source.getErrorMessage());
        target.setRetryCount(source.getRetryCount());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
