package com.autopost.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 补偿报告 DTO。
 */
@Data
public class RecoveryReportDTO {

    private Integer missedCount;
    private Integer executedCount;
    private Integer failedCount;
    private Integer skippedCount;
    private Integer reapedCount;
    private Integer supersededCount;
    private Integer inactiveCount;
    private Integer invalidCount;
    private List<MissedExecutionDTO> missedExecutions;
    private List<ExecutionItemResultDTO> executionResults;
}
