package com.autopost.config;

import com.autopost.domain.intent.service.CatchUpPolicy;
import com.autopost.domain.schedule.adapter.executor.ITaskExecutor;
import com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider;
import com.autopost.infrastructure.dao.TaskDefinitionDao;
import com.autopost.infrastructure.gateway.HttpTaskExecutor;
import com.autopost.infrastructure.provider.DbTaskDefinitionProvider;
import com.autopost.infrastructure.util.JsonCodec;
import com.autopost.types.enums.SchedulerTypeEnum;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 任务族装配：每个任务族一个任务定义提供者与一个 HTTP 执行器，补偿策略按族解析。
 */
@Configuration
@EnableConfigurationProperties(RecoveryProperties.class)
public class TaskFamilyConfig {

    @Bean
    public CatchUpPolicy catchUpPolicy(RecoveryProperties recoveryProperties) {
        return recoveryProperties::resolveCatchUpPolicy;
    }

    @Bean
    public ITaskDefinitionProvider financehubTaskDefinitionProvider(TaskDefinitionDao taskDefinitionDao, JsonCodec jsonCodec) {
        return new DbTaskDefinitionProvider(SchedulerTypeEnum.FINANCEHUB, taskDefinitionDao, jsonCodec);
    }

    @Bean
    public ITaskDefinitionProvider dockerTaskDefinitionProvider(TaskDefinitionDao taskDefinitionDao, JsonCodec jsonCodec) {
        return new DbTaskDefinitionProvider(SchedulerTypeEnum.DOCKER, taskDefinitionDao, jsonCodec);
    }

    @Bean
    public ITaskDefinitionProvider playwrightTaskDefinitionProvider(TaskDefinitionDao taskDefinitionDao, JsonCodec jsonCodec) {
        return new DbTaskDefinitionProvider(SchedulerTypeEnum.PLAYWRIGHT, taskDefinitionDao, jsonCodec);
    }

    @Bean
    public ITaskDefinitionProvider scheduledPostsTaskDefinitionProvider(TaskDefinitionDao taskDefinitionDao, JsonCodec jsonCodec) {
        return new DbTaskDefinitionProvider(SchedulerTypeEnum.SCHEDULED_POSTS, taskDefinitionDao, jsonCodec);
    }

    @Bean
    public ITaskExecutor financehubTaskExecutor(RecoveryProperties recoveryProperties, JsonCodec jsonCodec) {
        return httpExecutor(SchedulerTypeEnum.FINANCEHUB, recoveryProperties, jsonCodec);
    }

    @Bean
    public ITaskExecutor dockerTaskExecutor(RecoveryProperties recoveryProperties, JsonCodec jsonCodec) {
        return httpExecutor(SchedulerTypeEnum.DOCKER, recoveryProperties, jsonCodec);
    }

    @Bean
    public ITaskExecutor playwrightTaskExecutor(RecoveryProperties recoveryProperties, JsonCodec jsonCodec) {
        return httpExecutor(SchedulerTypeEnum.PLAYWRIGHT, recoveryProperties, jsonCodec);
    }

    @Bean
    public ITaskExecutor scheduledPostsTaskExecutor(RecoveryProperties recoveryProperties, JsonCodec jsonCodec) {
        return httpExecutor(SchedulerTypeEnum.SCHEDULED_POSTS, recoveryProperties, jsonCodec);
    }

    private ITaskExecutor httpExecutor(SchedulerTypeEnum schedulerType,
                                       RecoveryProperties recoveryProperties,
                                       JsonCodec jsonCodec) {
        RecoveryProperties.ExecutorProperties properties = recoveryProperties.resolveExecutor(schedulerType);
        return new HttpTaskExecutor(schedulerType,
                properties.getEndpoint(),
                properties.getConnectTimeoutMs() == null ? 3000 : properties.getConnectTimeoutMs(),
                properties.getReadTimeoutMs() == null ? 300000 : properties.getReadTimeoutMs(),
                properties.getAuthHeaderName(),
                properties.getAuthHeaderValue(),
                jsonCodec);
    }
}
