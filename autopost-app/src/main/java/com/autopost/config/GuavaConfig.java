package com.autopost.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 重试耗尽告警去重缓存：key 含日期，写入后 2 天过期即可覆盖跨天边界。
 * </p>
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "retryExhaustedAlertCache")
    public Cache<String, Boolean> retryExhaustedAlertCache() {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(2, TimeUnit.DAYS)
                .maximumSize(10_000)
                .build();
    }

}
