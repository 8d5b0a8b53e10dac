package com.autopost.domain.schedule.model.valobj;

/**
 * 执行器返回结果
 */
public record TaskExecutionResult(boolean success, String error) {

    public static TaskExecutionResult ok() {
        return new TaskExecutionResult(true, null);
    }

    public static TaskExecutionResult failure(String error) {
        return new TaskExecutionResult(false, error);
    }
}
