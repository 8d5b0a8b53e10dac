package com.autopost.domain.schedule.model.valobj;

import com.autopost.types.enums.FrequencyTypeEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 任务定义（由各任务族的 Provider 提供，每次触发时实时读取）。
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDefinition {

    private SchedulerTypeEnum schedulerType;

    private String taskId;

    private String taskName;

    private boolean enabled;

    private FrequencyTypeEnum frequencyType;

    /**
     * 计划时刻 HH:mm
     */
    private String scheduledTime;

    /**
     * 0-6，0 = 周日
     */
    private Integer dayOfWeek;

    /**
     * 1-31
     */
    private Integer dayOfMonth;

    private Integer customIntervalDays;

    private LocalDateTime lastSuccessAt;

    /**
     * 执行器调用配置，按次传递给执行器
     */
    private Map<String, Object> executorConfig;
}
