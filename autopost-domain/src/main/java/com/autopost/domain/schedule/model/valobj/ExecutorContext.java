package com.autopost.domain.schedule.model.valobj;

import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * 单次执行上下文，不可变。
 */
@Value
@Builder
public class ExecutorContext {

    SchedulerTypeEnum schedulerType;

    String taskName;

    LocalDate intendedDate;

    String executionId;

    @Builder.Default
    Map<String, Object> config = Collections.emptyMap();
}
