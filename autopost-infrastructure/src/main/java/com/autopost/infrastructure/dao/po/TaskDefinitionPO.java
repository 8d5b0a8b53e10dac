package com.autopost.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 周期任务定义 PO，对应表 scheduled_task_definitions。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDefinitionPO {

    private Long id;

    private String schedulerType;

    private String taskId;

    private String taskName;

    private Boolean enabled;

    private String frequencyType;

    private String scheduledTime;

    private Integer dayOfWeek;

    private Integer dayOfMonth;

    private Integer customIntervalDays;

    private LocalDateTime lastSuccessAt;

    private LocalDateTime lastRunAt;

    private String lastRunStatus;

    /**
     * JSONB
     */
    private String executorConfig;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
