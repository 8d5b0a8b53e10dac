package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 执行意图 DTO。
 */
@Data
public class ExecutionIntentDTO {

    private Long id;
    private String schedulerType;
    private String taskId;
    private String taskName;
    private LocalDate intendedDate;
    private String intendedTime;
    private LocalDateTime executionWindowStart;
    private LocalDateTime executionWindowEnd;
    private String status;
    private String actualExecutionId;
    private LocalDateTime actualStartedAt;
    private LocalDateTime actualCompletedAt;
    private String skipReason;
    private String errorMessage;
    private Integer retryCount;
    private LocalDateTime updatedAt;
}
