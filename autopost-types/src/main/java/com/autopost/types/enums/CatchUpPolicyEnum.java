package com.autopost.types.enums;

/**
 * 任务族补偿策略。
 * <ul>
 *   <li>LATEST_ONLY：同一任务多次错过只补最新一次（状态同步类任务）</li>
 *   <li>REPLAY_ALL：每次错过都是独立工作，全部交给限流器裁剪（事件类任务）</li>
 * </ul>
 *
 * @author autopost
 * @since 2025-03-02
 */
public enum CatchUpPolicyEnum {

    LATEST_ONLY,

    REPLAY_ALL
}
