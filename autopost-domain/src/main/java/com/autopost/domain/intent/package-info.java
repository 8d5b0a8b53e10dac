/**
 * Intent 领域 - 执行意图与补偿
 *
 * <p>职责：记录周期任务“某天应执行一次”的事实，检测错过的执行并有限度地补偿。</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>执行意图：(schedulerType, taskId, intendedDate) 唯一</li>
 *   <li>准点窗口：intendedTime 起 2 小时，窗口关闭后仍未结束即视为错过</li>
 *   <li>补偿策略：LATEST_ONLY 只补最近一次，REPLAY_ALL 逐日回放</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>StuckIntentReaperDomainService - 卡死意图回收</li>
 *   <li>MissedExecutionDetectorDomainService - 错过检测</li>
 *   <li>MissedExecutionDeduplicationDomainService - 去重</li>
 *   <li>CatchUpThrottleDomainService - 排序与限流</li>
 * </ul>
 *
 * @author autopost
 * @since 2025-03-02
 */
package com.autopost.domain.intent;
