package com.autopost.types.common;

/**
 * 全局常量定义类。
 *
 * @author autopost
 * @since 2025-03-02
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** 意图失败重试上限，达到后永久排除出补偿扫描 */
    public final static int MAX_RETRY_COUNT = 5;

    /** 触发时创建意图的准点窗口（小时） */
    public final static int EXECUTION_WINDOW_HOURS = 2;

    /** RUNNING 超时判定阈值（分钟） */
    public final static int STUCK_RUNNING_TIMEOUT_MINUTES = 60;

    public final static String SKIP_REASON_SUPERSEDED = "superseded_by_newer_attempt";

    public final static String SKIP_REASON_THROTTLED = "exceeded_max_catchup_executions";

    /** 补偿时任务已被停用 */
    public final static String SKIP_REASON_TASK_DISABLED = "task_disabled";

    /** 补偿时任务定义已被删除 */
    public final static String SKIP_REASON_TASK_NOT_FOUND = "task_not_found";

    public final static String FAIL_REASON_RECOVERY_EXECUTION = "recovery_execution_failed";

    public final static String FAIL_REASON_SCHEDULED_EXECUTION = "scheduled_execution_failed";

    public final static String FAIL_REASON_INFERRED_CRASH = "inferred_crash";

    public final static String CANCEL_REASON_OPERATOR = "cancelled_by_operator";

    public final static String STUCK_RUNNING_MESSAGE =
            "inferred_crash: running longer than " + STUCK_RUNNING_TIMEOUT_MINUTES + " minutes";

}
