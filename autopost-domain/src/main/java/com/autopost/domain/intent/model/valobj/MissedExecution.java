package com.autopost.domain.intent.model.valobj;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 错过的执行：意图快照 + 错过天数，只在补偿流程内流转，不落库。
 */
@Getter
@ToString
public class MissedExecution {

    private final ExecutionIntentEntity intent;

    private final long daysMissed;

    public MissedExecution(ExecutionIntentEntity intent, long daysMissed) {
        this.intent = intent;
        this.daysMissed = Math.max(daysMissed, 0L);
    }

    public Long getIntentId() {
        return intent.getId();
    }

    public SchedulerTypeEnum getSchedulerType() {
        return intent.getSchedulerType();
    }

    public String getTaskId() {
        return intent.getTaskId();
    }

    public String getTaskName() {
        return intent.getTaskName();
    }

    public LocalDate getIntendedDate() {
        return intent.getIntendedDate();
    }

    public LocalTime getIntendedTime() {
        return intent.getIntendedTime();
    }

    public int getRetryCount() {
        return intent.normalizedRetryCount();
    }
}
