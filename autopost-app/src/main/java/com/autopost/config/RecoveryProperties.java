package com.autopost.config;

import com.autopost.types.enums.CatchUpPolicyEnum;
import com.autopost.types.enums.SchedulerTypeEnum;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 补偿配置属性类，前缀 recovery。
 * <p>
 * 任务族的 key 可写编码或枚举名（financehub / scheduled-posts / SCHEDULED_POSTS 均可），
 * 匹配时忽略大小写与分隔符。
 * </p>
 *
 * @author autopost
 * @since 2025-03-02
 */
@Data
@ConfigurationProperties(prefix = "recovery", ignoreInvalidFields = true)
public class RecoveryProperties {

    /** 未单独配置的任务族使用的补偿策略 */
    private CatchUpPolicyEnum defaultCatchUpPolicy = CatchUpPolicyEnum.LATEST_ONLY;

    /** 按任务族覆盖补偿策略 */
    private Map<String, CatchUpPolicyEnum> catchUpPolicies = new LinkedHashMap<>();

    /** 按任务族配置 HTTP 执行器 */
    private Map<String, ExecutorProperties> executors = new LinkedHashMap<>();

    public CatchUpPolicyEnum resolveCatchUpPolicy(SchedulerTypeEnum schedulerType) {
        CatchUpPolicyEnum policy = lookup(catchUpPolicies, schedulerType);
        if (policy != null) {
            return policy;
        }
        return defaultCatchUpPolicy == null ? CatchUpPolicyEnum.LATEST_ONLY : defaultCatchUpPolicy;
    }

    public ExecutorProperties resolveExecutor(SchedulerTypeEnum schedulerType) {
        ExecutorProperties properties = lookup(executors, schedulerType);
        return properties == null ? new ExecutorProperties() : properties;
    }

    private <T> T lookup(Map<String, T> values, SchedulerTypeEnum schedulerType) {
        if (values == null || schedulerType == null) {
            return null;
        }
        String target = normalizeKey(schedulerType.getCode());
        for (Map.Entry<String, T> entry : values.entrySet()) {
            if (target.equals(normalizeKey(entry.getKey()))) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }

    @Data
    public static class ExecutorProperties {

        /** worker 地址，为空表示该任务族不注册执行器 */
        private String endpoint;

        private Integer connectTimeoutMs = 3000;

        private Integer readTimeoutMs = 300000;

        private String authHeaderName = "Authorization";

        private String authHeaderValue;
    }
}
