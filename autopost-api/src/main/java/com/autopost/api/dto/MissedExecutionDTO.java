package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 错过执行 DTO。
 */
@Data
public class MissedExecutionDTO {

    private Long intentId;
    private String schedulerType;
    private String taskId;
    private String taskName;
    private LocalDate intendedDate;
    private String intendedTime;
    private Long daysMissed;
    private Integer retryCount;
}
