package com.autopost.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 执行意图状态枚举
 *
 * @author autopost
 * @since 2025-03-02
 */
public enum IntentStatusEnum {

    /**
     * 待执行 - 意图已创建，等待触发或补偿
     */
    PENDING("pending"),

    /**
     * 运行中
     */
    RUNNING("running"),

    /**
     * 已完成 - 终态
     */
    COMPLETED("completed"),

    /**
     * 失败 - 重试次数未达上限前仍可被补偿
     */
    FAILED("failed"),

    /**
     * 已跳过 - 被更新的意图取代或超出补偿上限，终态
     */
    SKIPPED("skipped"),

    /**
     * 已取消 - 运维人工取消，终态
     */
    CANCELLED("cancelled");

    private static final Set<IntentStatusEnum> TERMINAL = EnumSet.of(COMPLETED, SKIPPED, CANCELLED);
    private static final Set<IntentStatusEnum> RECOVERABLE = EnumSet.of(PENDING, FAILED);

    private final String code;

    IntentStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isRecoverable() {
        return RECOVERABLE.contains(this);
    }

    public static IntentStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (IntentStatusEnum status : IntentStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown intent status code: " + code);
    }
}
