package com.autopost.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 补偿选项请求 DTO，全部字段可选。
 */
@Data
public class RecoveryOptionsRequestDTO {

    private Integer lookbackDays;
    private Boolean autoExecute;
    private Integer maxCatchUpExecutions;
    /** oldest_first | newest_first */
    private String priorityOrder;
    /** 任务族编码列表，如 financehub、playwright */
    private List<String> schedulerTypes;
}
