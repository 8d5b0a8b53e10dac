package com.autopost.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 *
 * @author autopost
 * @since 2025-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 意图不存在 */
    INTENT_NOT_FOUND("0101", "执行意图不存在"),

    /** 意图状态不允许该操作 */
    INTENT_STATE_CONFLICT("0102", "执行意图状态不允许该操作"),

    /** 执行器调用失败 */
    EXECUTOR_INVOKE_FAILED("0202", "执行器调用失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
