package com.autopost.test;

import com.autopost.domain.intent.service.CatchUpPolicy;
import com.autopost.domain.intent.service.CatchUpThrottleDomainService;
import com.autopost.domain.intent.service.MissedExecutionDeduplicationDomainService;
import com.autopost.domain.intent.service.MissedExecutionDetectorDomainService;
import com.autopost.domain.intent.service.StuckIntentReaperDomainService;
import com.autopost.domain.schedule.service.TaskDispatchDomainService;
import com.autopost.test.support.InMemoryExecutionIntentRepository;
import com.autopost.test.support.InMemoryTaskDefinitionProvider;
import com.autopost.test.support.IntentFixtures;
import com.autopost.test.support.MutableClock;
import com.autopost.test.support.RecordingTaskExecutor;
import com.autopost.trigger.application.command.IntentMaintenanceApplicationService;
import com.autopost.trigger.application.command.RecoveryApplicationService;
import com.autopost.trigger.application.observability.RetryExhaustedAlertNotifier;
import com.autopost.trigger.application.query.RecoveryDiagnosticsQueryService;
import com.autopost.trigger.http.GlobalApiExceptionHandler;
import com.autopost.trigger.http.RecoveryAdminController;
import com.autopost.types.enums.IntentStatusEnum;
import com.autopost.types.enums.ResponseCode;
import com.autopost.types.enums.SchedulerTypeEnum;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RecoveryAdminControllerTest {

    private InMemoryExecutionIntentRepository repository;
    private RecordingTaskExecutor executor;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryExecutionIntentRepository();
        executor = new RecordingTaskExecutor(SchedulerTypeEnum.PLAYWRIGHT);
        InMemoryTaskDefinitionProvider provider = new InMemoryTaskDefinitionProvider(SchedulerTypeEnum.PLAYWRIGHT)
                .put(InMemoryTaskDefinitionProvider.daily("post", "09:00"));
        MutableClock clock = new MutableClock(LocalDateTime.parse("2025-03-10T10:00"));
        TaskDispatchDomainService dispatch = new TaskDispatchDomainService(List.of(executor), List.of(provider));

        RecoveryApplicationService recoveryApplicationService = new RecoveryApplicationService(
                repository,
                new StuckIntentReaperDomainService(repository),
                new MissedExecutionDetectorDomainService(repository),
                new MissedExecutionDeduplicationDomainService(repository, CatchUpPolicy.latestOnly()),
                new CatchUpThrottleDomainService(repository),
                dispatch,
                new RetryExhaustedAlertNotifier(repository, CacheBuilder.newBuilder().<String, Boolean>build()),
                clock);
        RecoveryAdminController controller = new RecoveryAdminController(
                recoveryApplicationService,
                new IntentMaintenanceApplicationService(repository, clock),
                new RecoveryDiagnosticsQueryService(repository, dispatch, clock),
                clock);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();

        for (String date : List.of("2025-03-07", "2025-03-08", "2025-03-09")) {
            repository.seed(IntentFixtures.pending(SchedulerTypeEnum.PLAYWRIGHT, "post", date, "09:00"));
        }
    }

    @Test
    public void shouldListMissedExecutionsWithoutChangingState() throws Exception {
        mockMvc.perform(get("/api/recovery/missed").param("lookbackDays", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].schedulerType").value("playwright"))
                .andExpect(jsonPath("$.data[0].intendedDate").value("2025-03-08"))
                .andExpect(jsonPath("$.data[0].intendedTime").value("09:00"));

        Assertions.assertTrue(repository.all().stream().allMatch(intent -> intent.getStatus() == IntentStatusEnum.PENDING));
    }

    @Test
    public void shouldRunRecoveryPass() throws Exception {
        mockMvc.perform(post("/api/recovery/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxCatchUpExecutions\":3,\"priorityOrder\":\"oldest_first\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.missedCount").value(3))
                .andExpect(jsonPath("$.data.executedCount").value(1))
                .andExpect(jsonPath("$.data.skippedCount").value(2))
                .andExpect(jsonPath("$.data.failedCount").value(0))
                .andExpect(jsonPath("$.data.executionResults[0].intendedDate").value("2025-03-09"));

        Assertions.assertEquals(List.of("post@2025-03-09"), executor.getInvocations());
    }

    @Test
    public void shouldAnswerHasRunTodayAndRejectUnknownFamily() throws Exception {
        mockMvc.perform(get("/api/recovery/has-run-today")
                        .param("schedulerType", "playwright")
                        .param("taskId", "post"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.hasRun").value(false))
                .andExpect(jsonPath("$.data.date").value("2025-03-10"));

        mockMvc.perform(get("/api/recovery/has-run-today")
                        .param("schedulerType", "cron")
                        .param("taskId", "post"))
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldRejectInvalidRetention() throws Exception {
        mockMvc.perform(post("/api/recovery/cleanup").param("retentionDays", "0"))
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));

        mockMvc.perform(post("/api/recovery/cleanup"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.retentionDays").value(30))
                .andExpect(jsonPath("$.data.deletedCount").value(0));
    }

    @Test
    public void shouldCancelIntent() throws Exception {
        mockMvc.perform(post("/api/recovery/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"schedulerType\":\"playwright\",\"taskId\":\"post\",\"intendedDate\":\"2025-03-09\"}"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("cancelled"));

        mockMvc.perform(post("/api/recovery/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"schedulerType\":\"playwright\",\"taskId\":\"post\",\"intendedDate\":\"2025-03-01\"}"))
                .andExpect(jsonPath("$.code").value(ResponseCode.INTENT_NOT_FOUND.getCode()));

        Assertions.assertEquals(IntentStatusEnum.CANCELLED, repository.findByNaturalKey(
                SchedulerTypeEnum.PLAYWRIGHT, "post", LocalDate.parse("2025-03-09")).getStatus());
    }

    @Test
    public void shouldExposeDiagnostics() throws Exception {
        mockMvc.perform(get("/api/recovery/diagnostics"))
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.today").value("2025-03-10"))
                .andExpect(jsonPath("$.data.eligibleMissed.length()").value(3))
                .andExpect(jsonPath("$.data.registeredExecutors[0]").value("playwright"));
    }
}
