/**
 * 仓储接口层
 * <p>
 * 执行意图的持久化接口，由基础设施层基于 MyBatis 实现。
 * 所有状态迁移都是带前置状态守卫的条件更新，返回值表示本次是否生效。
 *
 * @author autopost
 * @since 2025-03-02
 */
package com.autopost.domain.intent.adapter.repository;
