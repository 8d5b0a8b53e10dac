package com.autopost.domain.intent.model.valobj;

import com.autopost.types.enums.PriorityOrderEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 补偿选项值对象，所有字段均有默认值。
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryOptions {

    public static final int DEFAULT_LOOKBACK_DAYS = 3;
    public static final int DEFAULT_MAX_CATCH_UP_EXECUTIONS = 3;

    /** 回溯天数 */
    @Builder.Default
    private Integer lookbackDays = DEFAULT_LOOKBACK_DAYS;

    /** 是否自动执行补偿，false 时只做检测 + 标记 */
    @Builder.Default
    private Boolean autoExecute = Boolean.TRUE;

    /** 单轮最多补偿执行数 */
    @Builder.Default
    private Integer maxCatchUpExecutions = DEFAULT_MAX_CATCH_UP_EXECUTIONS;

    @Builder.Default
    private PriorityOrderEnum priorityOrder = PriorityOrderEnum.OLDEST_FIRST;

    /** 任务族过滤，为空表示全部 */
    private Set<SchedulerTypeEnum> schedulerFilter;

    public static RecoveryOptions defaults() {
        return RecoveryOptions.builder().build();
    }

    /**
     * 返回填充默认值后的副本，非法值同样回退默认值。
     */
    public RecoveryOptions normalized() {
        return RecoveryOptions.builder()
                .lookbackDays(lookbackDays == null || lookbackDays < 0 ? DEFAULT_LOOKBACK_DAYS : lookbackDays)
                .autoExecute(autoExecute == null ? Boolean.TRUE : autoExecute)
                .maxCatchUpExecutions(maxCatchUpExecutions == null || maxCatchUpExecutions < 0
                        ? DEFAULT_MAX_CATCH_UP_EXECUTIONS
                        : maxCatchUpExecutions)
                .priorityOrder(priorityOrder == null ? PriorityOrderEnum.OLDEST_FIRST : priorityOrder)
                .schedulerFilter(schedulerFilter == null || schedulerFilter.isEmpty()
                        ? Collections.emptySet()
                        : Collections.unmodifiableSet(EnumSet.copyOf(schedulerFilter)))
                .build();
    }

    public boolean isAutoExecuteEnabled() {
        return !Boolean.FALSE.equals(autoExecute);
    }
}
