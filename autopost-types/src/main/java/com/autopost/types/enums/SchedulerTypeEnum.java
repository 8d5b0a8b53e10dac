package com.autopost.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务族（调度器类型）枚举。
 * <p>
 * 每个任务族对应一组 Executor / TaskDefinitionProvider，持久化时使用 code。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
public enum SchedulerTypeEnum {

    /**
     * 财务数据同步
     */
    FINANCEHUB("financehub"),

    /**
     * 容器化任务
     */
    DOCKER("docker"),

    /**
     * 浏览器自动化测试
     */
    PLAYWRIGHT("playwright"),

    /**
     * 定时内容发布
     */
    SCHEDULED_POSTS("scheduled_posts");

    private final String code;

    SchedulerTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SchedulerTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SchedulerTypeEnum type : SchedulerTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scheduler type code: " + code);
    }
}
