package com.autopost.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 补偿诊断快照 DTO。
 */
@Data
public class RecoveryDiagnosticsDTO {

    private LocalDate today;
    private List<ExecutionIntentDTO> todayIntents;
    private List<ExecutionIntentDTO> eligibleMissed;
    private List<ExecutionIntentDTO> stuckRunning;
    private List<ExecutionIntentDTO> retryExhausted;
    private List<String> registeredExecutors;
}
