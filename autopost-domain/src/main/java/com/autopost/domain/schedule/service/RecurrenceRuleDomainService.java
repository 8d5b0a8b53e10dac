package com.autopost.domain.schedule.service;

import com.autopost.domain.schedule.model.valobj.RecurrenceRule;
import com.autopost.domain.schedule.model.valobj.TaskDefinition;
import com.autopost.types.enums.FrequencyTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 重复规则领域服务：任务定义 -> 重复规则，custom 间隔判定，以及未来触发点规划。
 */
@Slf4j
@Service
public class RecurrenceRuleDomainService {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    /**
     * 无法推导规则（weekly 缺 dayOfWeek、monthly 缺 dayOfMonth、时刻非法）时返回 empty。
     */
    public Optional<RecurrenceRule> resolve(TaskDefinition definition) {
        if (definition == null || definition.getFrequencyType() == null) {
            return Optional.empty();
        }
        LocalTime time = parseScheduledTime(definition.getScheduledTime());
        if (time == null) {
            log.warn("Task not scheduled, invalid scheduledTime. taskId={}, scheduledTime={}",
                    definition.getTaskId(), definition.getScheduledTime());
            return Optional.empty();
        }
        FrequencyTypeEnum frequency = definition.getFrequencyType();
        switch (frequency) {
            case DAILY:
            case CUSTOM:
                return Optional.of(RecurrenceRule.daily(frequency, time));
            case WEEKLY:
                Integer dayOfWeek = definition.getDayOfWeek();
                if (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6) {
                    log.warn("Task not scheduled, weekly without valid dayOfWeek. taskId={}, dayOfWeek={}",
                            definition.getTaskId(), dayOfWeek);
                    return Optional.empty();
                }
                return Optional.of(RecurrenceRule.weekly(time, dayOfWeek));
            case MONTHLY:
                Integer dayOfMonth = definition.getDayOfMonth();
                if (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31) {
                    log.warn("Task not scheduled, monthly without valid dayOfMonth. taskId={}, dayOfMonth={}",
                            definition.getTaskId(), dayOfMonth);
                    return Optional.empty();
                }
                return Optional.of(RecurrenceRule.monthly(time, dayOfMonth));
            default:
                return Optional.empty();
        }
    }

    /**
     * 非 custom 频率恒为 true；custom 频率要求距上次成功的整天数 >= customIntervalDays，从未执行过直接放行。
     */
    public boolean isIntervalReached(TaskDefinition definition, LocalDateTime now) {
        if (definition == null || definition.getFrequencyType() != FrequencyTypeEnum.CUSTOM) {
            return true;
        }
        if (definition.getLastSuccessAt() == null) {
            return true;
        }
        int interval = definition.getCustomIntervalDays() == null ? 1 : Math.max(definition.getCustomIntervalDays(), 1);
        // 按日历日比较，上次完成时间晚于触发点几秒也不会多等一天
        long elapsedDays = ChronoUnit.DAYS.between(definition.getLastSuccessAt().toLocalDate(), now.toLocalDate());
        return elapsedDays >= interval;
    }

    /**
     * 规划 [from, to) 内的触发时间。custom 频率最多规划一次（执行后 lastSuccessAt 会变化）。
     */
    public List<LocalDateTime> planOccurrences(TaskDefinition definition, LocalDateTime from, LocalDateTime to) {
        Optional<RecurrenceRule> rule = resolve(definition);
        if (rule.isEmpty()) {
            return Collections.emptyList();
        }
        List<LocalDateTime> firings = rule.get().firingsBetween(from, to);
        if (definition.getFrequencyType() != FrequencyTypeEnum.CUSTOM) {
            return firings;
        }
        List<LocalDateTime> planned = new ArrayList<>(1);
        for (LocalDateTime firing : firings) {
            if (isIntervalReached(definition, firing)) {
                planned.add(firing);
                break;
            }
        }
        return planned;
    }

    public LocalTime parseScheduledTime(String scheduledTime) {
        if (StringUtils.isBlank(scheduledTime)) {
            return null;
        }
        try {
            return LocalTime.parse(scheduledTime.trim(), TIME_FORMATTER);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
