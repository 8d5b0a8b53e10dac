package com.autopost.trigger.http;

import com.autopost.api.dto.CancelIntentRequestDTO;
import com.autopost.api.dto.CleanupResultDTO;
import com.autopost.api.dto.ExecutionIntentDTO;
import com.autopost.api.dto.HasRunTodayDTO;
import com.autopost.api.dto.MissedExecutionDTO;
import com.autopost.api.dto.RecoveryDiagnosticsDTO;
import com.autopost.api.dto.RecoveryOptionsRequestDTO;
import com.autopost.api.dto.RecoveryReportDTO;
import com.autopost.api.response.Response;
import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import com.autopost.trigger.application.command.IntentMaintenanceApplicationService;
import com.autopost.trigger.application.command.RecoveryApplicationService;
import com.autopost.trigger.application.common.IntentViewAssembler;
import com.autopost.trigger.application.query.RecoveryDiagnosticsQueryService;
import com.autopost.types.enums.PriorityOrderEnum;
import com.autopost.types.enums.ResponseCode;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 补偿管理 API。
 */
@RestController
@RequestMapping("/api/recovery")
public class RecoveryAdminController {

    private final RecoveryApplicationService recoveryApplicationService;
    private final IntentMaintenanceApplicationService intentMaintenanceApplicationService;
    private final RecoveryDiagnosticsQueryService recoveryDiagnosticsQueryService;
    private final Clock clock;

    public RecoveryAdminController(RecoveryApplicationService recoveryApplicationService,
                                   IntentMaintenanceApplicationService intentMaintenanceApplicationService,
                                   RecoveryDiagnosticsQueryService recoveryDiagnosticsQueryService,
                                   Clock clock) {
        this.recoveryApplicationService = recoveryApplicationService;
        this.intentMaintenanceApplicationService = intentMaintenanceApplicationService;
        this.recoveryDiagnosticsQueryService = recoveryDiagnosticsQueryService;
        this.clock = clock;
    }

    @GetMapping("/missed")
    public Response<List<MissedExecutionDTO>> missed(@RequestParam(value = "lookbackDays", required = false) Integer lookbackDays,
                                                     @RequestParam(value = "maxCatchUpExecutions", required = false) Integer maxCatchUpExecutions,
                                                     @RequestParam(value = "priorityOrder", required = false) String priorityOrder,
                                                     @RequestParam(value = "schedulerTypes", required = false) List<String> schedulerTypes) {
        RecoveryOptionsRequestDTO request = new RecoveryOptionsRequestDTO();
        request.setLookbackDays(lookbackDays);
        request.setMaxCatchUpExecutions(maxCatchUpExecutions);
        request.setPriorityOrder(priorityOrder);
        request.setSchedulerTypes(schedulerTypes);
        return success(IntentViewAssembler.toMissedDTOs(recoveryApplicationService.detectMissed(toOptions(request))));
    }

    @PostMapping("/execute")
    public Response<RecoveryReportDTO> execute(@RequestBody(required = false) RecoveryOptionsRequestDTO request) {
        return success(IntentViewAssembler.toReportDTO(recoveryApplicationService.recover(toOptions(request))));
    }

    @GetMapping("/has-run-today")
    public Response<HasRunTodayDTO> hasRunToday(@RequestParam("schedulerType") String schedulerType,
                                                @RequestParam("taskId") String taskId) {
        SchedulerTypeEnum type = SchedulerTypeEnum.fromCode(schedulerType);
        HasRunTodayDTO dto = new HasRunTodayDTO();
        dto.setSchedulerType(type.getCode());
        dto.setTaskId(taskId);
        dto.setDate(LocalDate.now(clock));
        dto.setHasRun(intentMaintenanceApplicationService.hasRunToday(type, taskId));
        return success(dto);
    }

    @PostMapping("/cleanup")
    public Response<CleanupResultDTO> cleanup(@RequestParam(value = "retentionDays", defaultValue = "30") Integer retentionDays) {
        CleanupResultDTO dto = new CleanupResultDTO();
        dto.setRetentionDays(retentionDays);
        dto.setDeletedCount(intentMaintenanceApplicationService.cleanup(retentionDays));
        return success(dto);
    }

    @PostMapping("/cancel")
    public Response<ExecutionIntentDTO> cancel(@RequestBody CancelIntentRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getSchedulerType())) {
            return illegal("schedulerType is required");
        }
        SchedulerTypeEnum type = SchedulerTypeEnum.fromCode(request.getSchedulerType());
        return success(IntentViewAssembler.toIntentDTO(intentMaintenanceApplicationService.cancel(
                type, request.getTaskId(), request.getIntendedDate(), request.getReason())));
    }

    @GetMapping("/diagnostics")
    public Response<RecoveryDiagnosticsDTO> diagnostics() {
        return success(recoveryDiagnosticsQueryService.diagnostics());
    }

    private RecoveryOptions toOptions(RecoveryOptionsRequestDTO request) {
        if (request == null) {
            return RecoveryOptions.defaults();
        }
        Set<SchedulerTypeEnum> filter = EnumSet.noneOf(SchedulerTypeEnum.class);
        if (request.getSchedulerTypes() != null) {
            for (String code : request.getSchedulerTypes()) {
                if (StringUtils.isNotBlank(code)) {
                    filter.add(SchedulerTypeEnum.fromCode(code.trim()));
                }
            }
        }
        return RecoveryOptions.builder()
                .lookbackDays(request.getLookbackDays())
                .autoExecute(request.getAutoExecute())
                .maxCatchUpExecutions(request.getMaxCatchUpExecutions())
                .priorityOrder(PriorityOrderEnum.fromCodeOrDefault(request.getPriorityOrder()))
                .schedulerFilter(filter)
                .build();
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }
}
