package com.autopost.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 补偿执行排序策略
 *
 * @author autopost
 * @since 2025-03-02
 */
public enum PriorityOrderEnum {

    OLDEST_FIRST("oldest_first"),

    NEWEST_FIRST("newest_first");

    private final String code;

    PriorityOrderEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 宽松解析：未知或空值回退到 OLDEST_FIRST。
     */
    public static PriorityOrderEnum fromCodeOrDefault(String code) {
        if (code == null || code.isBlank()) {
            return OLDEST_FIRST;
        }
        for (PriorityOrderEnum order : PriorityOrderEnum.values()) {
            if (order.code.equalsIgnoreCase(code.trim()) || order.name().equalsIgnoreCase(code.trim())) {
                return order;
            }
        }
        return OLDEST_FIRST;
    }
}
