package com.autopost.domain.intent.model.valobj;

import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 单个补偿项的执行结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionItemResult {

    private Long intentId;

    private SchedulerTypeEnum schedulerType;

    private String taskId;

    private String taskName;

    private LocalDate intendedDate;

    private boolean success;

    private String error;
}
