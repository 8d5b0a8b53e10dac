package com.autopost.trigger.application.common;

import com.autopost.api.dto.ExecutionIntentDTO;
import com.autopost.api.dto.ExecutionItemResultDTO;
import com.autopost.api.dto.MissedExecutionDTO;
import com.autopost.api.dto.RecoveryReportDTO;
import com.autopost.domain.intent.model.entity.ExecutionIntentEntity;
import com.autopost.domain.intent.model.valobj.ExecutionItemResult;
import com.autopost.domain.intent.model.valobj.MissedExecution;
import com.autopost.domain.intent.model.valobj.RecoveryReport;
import com.autopost.types.enums.SchedulerTypeEnum;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 意图相关视图组装器（领域对象 -> API DTO）。
 */
public final class IntentViewAssembler {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private IntentViewAssembler() {
    }

    public static ExecutionIntentDTO toIntentDTO(ExecutionIntentEntity intent) {
        if (intent == null) {
            return null;
        }
        ExecutionIntentDTO dto = new ExecutionIntentDTO();
        dto.setId(intent.getId());
        dto.setSchedulerType(code(intent.getSchedulerType()));
        dto.setTaskId(intent.getTaskId());
        dto.setTaskName(intent.getTaskName());
        dto.setIntendedDate(intent.getIntendedDate());
        dto.setIntendedTime(formatTime(intent.getIntendedTime()));
        dto.setExecutionWindowStart(intent.getExecutionWindowStart());
        dto.setExecutionWindowEnd(intent.getExecutionWindowEnd());
        dto.setStatus(intent.getStatus() == null ? null : intent.getStatus().getCode());
        dto.setActualExecutionId(intent.getActualExecutionId());
        dto.setActualStartedAt(intent.getActualStartedAt());
        dto.setActualCompletedAt(intent.getActualCompletedAt());
        dto.setSkipReason(intent.getSkipReason());
        dto.setErrorMessage(intent.getErrorMessage());
        dto.setRetryCount(intent.normalizedRetryCount());
        dto.setUpdatedAt(intent.getUpdatedAt());
        return dto;
    }

    public static List<ExecutionIntentDTO> toIntentDTOs(List<ExecutionIntentEntity> intents) {
        if (intents == null || intents.isEmpty()) {
            return Collections.emptyList();
        }
        return intents.stream().map(IntentViewAssembler::toIntentDTO).collect(Collectors.toList());
    }

    public static MissedExecutionDTO toMissedDTO(MissedExecution missed) {
        MissedExecutionDTO dto = new MissedExecutionDTO();
        dto.setIntentId(missed.getIntentId());
        dto.setSchedulerType(code(missed.getSchedulerType()));
        dto.setTaskId(missed.getTaskId());
        dto.setTaskName(missed.getTaskName());
        dto.setIntendedDate(missed.getIntendedDate());
        dto.setIntendedTime(formatTime(missed.getIntendedTime()));
        dto.setDaysMissed(missed.getDaysMissed());
        dto.setRetryCount(missed.getRetryCount());
        return dto;
    }

    public static List<MissedExecutionDTO> toMissedDTOs(List<MissedExecution> missed) {
        if (missed == null || missed.isEmpty()) {
            return Collections.emptyList();
        }
        return missed.stream().map(IntentViewAssembler::toMissedDTO).collect(Collectors.toList());
    }

    public static RecoveryReportDTO toReportDTO(RecoveryReport report) {
        RecoveryReportDTO dto = new RecoveryReportDTO();
        dto.setMissedCount(report.getMissedCount());
        dto.setExecutedCount(report.getExecutedCount());
        dto.setFailedCount(report.getFailedCount());
        dto.setSkippedCount(report.getSkippedCount());
        dto.setReapedCount(report.getReapedCount());
        dto.setSupersededCount(report.getSupersededCount());
        dto.setInactiveCount(report.getInactiveCount());
        dto.setInvalidCount(report.getInvalidCount());
        dto.setMissedExecutions(toMissedDTOs(report.getMissedExecutions()));
        dto.setExecutionResults(report.getExecutionResults() == null
                ? Collections.emptyList()
                : report.getExecutionResults().stream().map(IntentViewAssembler::toItemDTO).collect(Collectors.toList()));
        return dto;
    }

    private static ExecutionItemResultDTO toItemDTO(ExecutionItemResult result) {
        ExecutionItemResultDTO dto = new ExecutionItemResultDTO();
        dto.setIntentId(result.getIntentId());
        dto.setSchedulerType(code(result.getSchedulerType()));
        dto.setTaskId(result.getTaskId());
        dto.setTaskName(result.getTaskName());
        dto.setIntendedDate(result.getIntendedDate());
        dto.setSuccess(result.isSuccess());
        dto.setError(result.getError());
        return dto;
    }

    private static String code(SchedulerTypeEnum schedulerType) {
        return schedulerType == null ? null : schedulerType.getCode();
    }

    private static String formatTime(LocalTime time) {
        return time == null ? null : time.format(TIME_FORMATTER);
    }
}
