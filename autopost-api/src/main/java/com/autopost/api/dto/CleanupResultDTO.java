package com.autopost.api.dto;

import lombok.Data;

/**
 * 保留期清理结果 DTO。
 */
@Data
public class CleanupResultDTO {

    private Integer retentionDays;
    private Integer deletedCount;
}
