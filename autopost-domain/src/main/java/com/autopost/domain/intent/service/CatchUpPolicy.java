package com.autopost.domain.intent.service;

import com.autopost.types.enums.CatchUpPolicyEnum;
import com.autopost.types.enums.SchedulerTypeEnum;

/**
 * 按任务族解析补偿策略。
 */
public interface CatchUpPolicy {

    CatchUpPolicyEnum resolve(SchedulerTypeEnum schedulerType);

    static CatchUpPolicy latestOnly() {
        return schedulerType -> CatchUpPolicyEnum.LATEST_ONLY;
    }
}
