package com.autopost.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 执行意图 PO，对应表 execution_intents。
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionIntentPO {

    private Long id;

    /**
     * 任务族编码
     */
    private String schedulerType;

    private String taskId;

    private String taskName;

    private LocalDate intendedDate;

    private LocalTime intendedTime;

    private LocalDateTime executionWindowStart;

    private LocalDateTime executionWindowEnd;

    /**
     * 状态编码
     */
    private String status;

    private String actualExecutionId;

    private LocalDateTime actualStartedAt;

    private LocalDateTime actualCompletedAt;

    private String skipReason;

    private String errorMessage;

    private Integer retryCount;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
