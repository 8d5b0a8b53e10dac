package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 当日执行判定结果 DTO。
 */
@Data
public class HasRunTodayDTO {

    private String schedulerType;
    private String taskId;
    private LocalDate date;
    private Boolean hasRun;
}
