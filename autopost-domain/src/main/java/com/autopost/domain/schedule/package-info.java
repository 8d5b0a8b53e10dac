/**
 * Schedule 领域 - 任务定义、重复规则与执行分发
 *
 * <p>任务族（financehub / docker / playwright / scheduled_posts）各自提供任务定义与执行器，
 * 本领域只依赖 {@link com.autopost.domain.schedule.adapter.provider.ITaskDefinitionProvider}
 * 与 {@link com.autopost.domain.schedule.adapter.executor.ITaskExecutor} 两个端口。</p>
 *
 * @author autopost
 * @since 2025-03-02
 */
package com.autopost.domain.schedule;
