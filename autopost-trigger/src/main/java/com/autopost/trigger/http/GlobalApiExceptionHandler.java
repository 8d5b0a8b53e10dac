package com.autopost.trigger.http;

import com.autopost.api.response.Response;
import com.autopost.types.enums.ResponseCode;
import com.autopost.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。
 * <p>
 * 意图不存在、意图状态冲突属于运维操作被拒绝，按 INFO 记录并原样返回业务码；
 * 其余业务异常按 WARN 记录，未知异常按 ERROR 记录并隐藏细节。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        if (isIntentRejection(code)) {
            log.info("HTTP_REJECTED path={}, method={}, query={}, errorCode={}, errorMessage={}",
                    resolvePath(request),
                    resolveMethod(request),
                    resolveQuery(request),
                    code,
                    info);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request),
                    resolveMethod(request),
                    ex.getClass().getSimpleName(),
                    code,
                    info);
        }
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), 300);
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                ex.getClass().getSimpleName(),
                ResponseCode.ILLEGAL_PARAMETER.getCode(),
                info);
        return Response.<Object>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(info)
                .build();
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage(), 300),
                ex);
        return Response.<Object>builder()
                .code(ResponseCode.UN_ERROR.getCode())
                .info(ResponseCode.UN_ERROR.getInfo())
                .build();
    }

    private boolean isIntentRejection(String code) {
        return ResponseCode.INTENT_NOT_FOUND.getCode().equals(code)
                || ResponseCode.INTENT_STATE_CONFLICT.getCode().equals(code);
    }

    private String resolveQuery(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getQueryString(), "-");
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
