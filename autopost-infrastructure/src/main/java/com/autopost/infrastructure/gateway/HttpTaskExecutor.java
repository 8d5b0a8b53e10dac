package com.autopost.infrastructure.gateway;

import com.autopost.domain.schedule.adapter.executor.ITaskExecutor;
import com.autopost.domain.schedule.model.valobj.ExecutorContext;
import com.autopost.domain.schedule.model.valobj.TaskExecutionResult;
import com.autopost.infrastructure.util.JsonCodec;
import com.autopost.types.enums.ResponseCode;
import com.autopost.types.enums.SchedulerTypeEnum;
import com.autopost.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP 执行器网关：把一次任务执行 POST 给外部 worker。
 * <p>
 * 请求体 {taskId, schedulerType, intendedDate, executionId, taskName, config}，
 * 响应体 {success, error}；非 2xx 视为失败。
 * </p>
 */
@Slf4j
public class HttpTaskExecutor implements ITaskExecutor {

    private final SchedulerTypeEnum schedulerType;
    private final String endpoint;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final String authHeaderName;
    private final String authHeaderValue;
    private final JsonCodec jsonCodec;

    public HttpTaskExecutor(SchedulerTypeEnum schedulerType,
                            String endpoint,
                            int connectTimeoutMs,
                            int readTimeoutMs,
                            String authHeaderName,
                            String authHeaderValue,
                            JsonCodec jsonCodec) {
        this.schedulerType = schedulerType;
        this.endpoint = StringUtils.trimToNull(endpoint);
        this.connectTimeoutMs = Math.max(connectTimeoutMs, 1);
        this.readTimeoutMs = Math.max(readTimeoutMs, 1);
        this.authHeaderName = authHeaderName;
        this.authHeaderValue = authHeaderValue;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SchedulerTypeEnum schedulerType() {
        return schedulerType;
    }

    /**
     * 未配置 endpoint 的任务族不注册执行器
     */
    @Override
    public boolean isAvailable() {
        return endpoint != null;
    }

    @Override
    public TaskExecutionResult execute(String taskId, ExecutorContext context) {
        if (endpoint == null) {
            return TaskExecutionResult.failure("Executor endpoint not configured for " + schedulerType.getCode());
        }
        String body = jsonCodec.writeValue(buildPayload(taskId, context));
        HttpURLConnection connection = null;
        try {
            URL url = new URL(endpoint);
            connection = (HttpURLConnection) url.openConnection();
            connection.setConnectTimeout(connectTimeoutMs);
            connection.setReadTimeout(readTimeoutMs);
            connection.setRequestMethod("POST");
            connection.setDoOutput(true);
            connection.setRequestProperty("Content-Type", "application/json; charset=UTF-8");
            connection.setRequestProperty("Accept", "application/json");
            if (StringUtils.isNotBlank(authHeaderName) && StringUtils.isNotBlank(authHeaderValue)) {
                connection.setRequestProperty(authHeaderName, authHeaderValue);
            }
            try (OutputStream output = connection.getOutputStream()) {
                output.write(body.getBytes(StandardCharsets.UTF_8));
            }

            int statusCode = connection.getResponseCode();
            String responseBody = readBody(statusCode >= 400 ? connection.getErrorStream() : connection.getInputStream());
            if (statusCode < 200 || statusCode >= 300) {
                log.warn("Executor endpoint returned non-2xx. schedulerType={}, taskId={}, status={}",
                        schedulerType.getCode(), taskId, statusCode);
                return TaskExecutionResult.failure("HTTP " + statusCode + (StringUtils.isBlank(responseBody)
                        ? ""
                        : ": " + StringUtils.abbreviate(responseBody, 500)));
            }
            return parseResult(responseBody);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.EXECUTOR_INVOKE_FAILED.getCode(),
                    "Executor call failed: " + ex.getMessage(), ex);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private Map<String, Object> buildPayload(String taskId, ExecutorContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("schedulerType", schedulerType.getCode());
        if (context != null) {
            payload.put("taskName", context.getTaskName());
            payload.put("intendedDate", context.getIntendedDate() == null ? null : context.getIntendedDate().toString());
            payload.put("executionId", context.getExecutionId());
            payload.put("config", context.getConfig());
        }
        return payload;
    }

    private TaskExecutionResult parseResult(String responseBody) {
        Map<String, Object> response = jsonCodec.readMap(responseBody);
        if (response == null) {
            return TaskExecutionResult.ok();
        }
        Object success = response.get("success");
        if (success == null || Boolean.TRUE.equals(success) || "true".equalsIgnoreCase(String.valueOf(success))) {
            return TaskExecutionResult.ok();
        }
        Object error = response.get("error");
        return TaskExecutionResult.failure(error == null ? "Executor reported failure" : String.valueOf(error));
    }

    private String readBody(InputStream stream) throws IOException {
        if (stream == null) {
            return null;
        }
        try (InputStream input = stream; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            input.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
