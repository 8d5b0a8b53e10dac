package com.autopost.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务重复频率枚举
 *
 * @author autopost
 * @since 2025-03-02
 */
public enum FrequencyTypeEnum {

    DAILY("daily"),

    WEEKLY("weekly"),

    MONTHLY("monthly"),

    /**
     * 自定义间隔：按天触发，再按 customIntervalDays 判定是否真正执行
     */
    CUSTOM("custom");

    private final String code;

    FrequencyTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static FrequencyTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (FrequencyTypeEnum type : FrequencyTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown frequency type code: " + code);
    }
}
