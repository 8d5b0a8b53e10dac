package com.autopost.infrastructure.dao;

import com.autopost.infrastructure.dao.po.TaskDefinitionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 周期任务定义 DAO
 */
@Mapper
public interface TaskDefinitionDao {

    TaskDefinitionPO selectByTaskId(@Param("schedulerType") String schedulerType,
                                    @Param("taskId") String taskId);

    List<TaskDefinitionPO> selectEnabled(@Param("schedulerType") String schedulerType);

    /**
     * 回写执行结果，成功时同时刷新 last_success_at
     */
    int updateRunOutcome(@Param("schedulerType") String schedulerType,
                         @Param("taskId") String taskId,
                         @Param("runStatus") String runStatus,
                         @Param("success") boolean success,
                         @Param("finishedAt") LocalDateTime finishedAt);

    int insert(TaskDefinitionPO po);
}
