package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 取消意图请求 DTO。
 */
@Data
public class CancelIntentRequestDTO {

    private String schedulerType;
    private String taskId;
    private LocalDate intendedDate;
    private String reason;
}
