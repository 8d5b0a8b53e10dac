package com.autopost.test.support;

import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 意图测试数据。
 */
public final class IntentFixtures {

    private IntentFixtures() {
    }

    /**
     * 窗口为 [date time, date time + 2h] 的 PENDING 意图
     */
    public static ExecutionIntentEntity pending(SchedulerTypeEnum schedulerType, String taskId, String date, String time) {
        LocalDate intendedDate = LocalDate.parse(date);
        LocalTime intendedTime = LocalTime.parse(time);
        return ExecutionIntentEntity.newPending(schedulerType, taskId, "task-" + taskId,
                intendedDate, intendedTime, intendedDate.atTime(intendedTime));
    }

    public static ExecutionIntentEntity withStatus(ExecutionIntentEntity intent, IntentStatusEnum status, int retryCount) {
        intent.setStatus(status);
        intent.setRetryCount(retryCount);
        return intent;
    }
}
