package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 单个补偿项执行结果 DTO。
 */
@Data
public class ExecutionItemResultDTO {

    private Long intentId;
    private String schedulerType;
    private String taskId;
    private String taskName;
    private LocalDate intendedDate;
    private Boolean success;
    private String error;
}
