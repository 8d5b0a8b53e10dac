package com.autopost.types.exception;

import com.autopost.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载业务异常的异常码与描述信息，由上层（REST 异常处理器）统一转换为响应体。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3829102749166021571L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 以响应码枚举创建异常，描述信息取枚举默认文案。
     */
    public static AppException of(ResponseCode responseCode) {
        return new AppException(responseCode.getCode(), responseCode.getInfo());
    }

    /**
     * 以响应码枚举和自定义描述创建异常。
     */
    public static AppException of(ResponseCode responseCode, String message) {
        return new AppException(responseCode.getCode(), message);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.autopost.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
