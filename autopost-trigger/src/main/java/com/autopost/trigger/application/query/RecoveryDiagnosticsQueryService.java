package com.autopost.trigger.application.query;

import com.autopost.api.dto.RecoveryDiagnosticsDTO;
import com.autopost.domain.intent.adapter.repository.IExecutionIntentRepository;
import com.autopost.domain.intent.model.valobj.RecoveryOptions;
import com.autopost.domain.schedule.service.TaskDispatchDomainService;
import com.autopost.trigger.application.common.IntentViewAssembler;
import com.autopost.types.common.Constants;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * 补偿诊断查询：当日意图、待补偿意图、卡死快照、重试耗尽意图。只读。
 */
@Service
public class RecoveryDiagnosticsQueryService {

    private final IExecutionIntentRepository executionIntentRepository;
    private final TaskDispatchDomainService taskDispatchDomainService;
    private final Clock clock;

    public RecoveryDiagnosticsQueryService(IExecutionIntentRepository executionIntentRepository,
                                           TaskDispatchDomainService taskDispatchDomainService,
                                           Clock clock) {
        this.executionIntentRepository = executionIntentRepository;
        this.taskDispatchDomainService = taskDispatchDomainService;
        this.clock = clock;
    }

    public RecoveryDiagnosticsDTO diagnostics() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        int lookbackDays = RecoveryOptions.DEFAULT_LOOKBACK_DAYS;

        RecoveryDiagnosticsDTO dto = new RecoveryDiagnosticsDTO();
        dto.setToday(today);
        dto.setTodayIntents(IntentViewAssembler.toIntentDTOs(executionIntentRepository.findByIntendedDate(today)));
        dto.setEligibleMissed(IntentViewAssembler.toIntentDTOs(
                executionIntentRepository.findEligible(lookbackDays, now, null)));
        dto.setStuckRunning(IntentViewAssembler.toIntentDTOs(
                executionIntentRepository.findStaleRunning(now.minusMinutes(Constants.STUCK_RUNNING_TIMEOUT_MINUTES))));
        dto.setRetryExhausted(IntentViewAssembler.toIntentDTOs(
                executionIntentRepository.findRetryExhausted(today.minusDays(lookbackDays))));
        dto.setRegisteredExecutors(taskDispatchDomainService.registeredExecutorTypes().stream()
                .map(SchedulerTypeEnum::getCode)
                .sorted()
                .collect(Collectors.toList()));
        return dto;
    }
}
