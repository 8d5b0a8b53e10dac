package com.autopost.domain.intent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 补偿报告
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryReport {

    /** 检测到的错过执行数（去重前） */
    private int missedCount;

    private int executedCount;

    private int failedCount;

    /** 被取代、被限流以及任务已停用或删除而跳过的数量 */
    private int skippedCount;

    /** 本轮由 Reaper 回收的 RUNNING 意图数 */
    private int reapedCount;

    private int supersededCount;

    /** 任务已停用或定义已删除，未执行而直接跳过的数量 */
    private int inactiveCount;

    /** 因日期缺失被丢弃的行数 */
    private int invalidCount;

    @Builder.Default
    private List<MissedExecution> missedExecutions = new ArrayList<>();

    @Builder.Default
    private List<ExecutionItemResult> executionResults = new ArrayList<>();

    public static RecoveryReport empty(int reapedCount) {
        return RecoveryReport.builder().reapedCount(reapedCount).build();
    }
}
