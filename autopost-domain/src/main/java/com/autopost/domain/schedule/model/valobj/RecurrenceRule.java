package com.autopost.domain.schedule.model.valobj;

import com.autopost.types.enums.FrequencyTypeEnum;
import lombok.Getter;
import lombok.ToString;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 由任务定义推导出的重复规则，底层为 Spring 六段 cron（秒 分 时 日 月 周）。
 */
@Getter
@ToString(exclude = "cron")
public class RecurrenceRule {

    private final FrequencyTypeEnum frequencyType;

    private final LocalTime scheduledTime;

    private final String cronExpression;

    private final CronExpression cron;

    private RecurrenceRule(FrequencyTypeEnum frequencyType, LocalTime scheduledTime, String cronExpression) {
        this.frequencyType = frequencyType;
        this.scheduledTime = scheduledTime;
        this.cronExpression = cronExpression;
        this.cron = CronExpression.parse(cronExpression);
    }

    /**
     * custom 频率同样按天触发，间隔判定在触发时进行
     */
    public static RecurrenceRule daily(FrequencyTypeEnum frequencyType, LocalTime scheduledTime) {
        return new RecurrenceRule(frequencyType,
                scheduledTime,
                String.format("0 %d %d * * *", scheduledTime.getMinute(), scheduledTime.getHour()));
    }

    public static RecurrenceRule weekly(LocalTime scheduledTime, int dayOfWeek) {
        return new RecurrenceRule(FrequencyTypeEnum.WEEKLY,
                scheduledTime,
                String.format("0 %d %d * * %d", scheduledTime.getMinute(), scheduledTime.getHour(), dayOfWeek));
    }

    public static RecurrenceRule monthly(LocalTime scheduledTime, int dayOfMonth) {
        return new RecurrenceRule(FrequencyTypeEnum.MONTHLY,
                scheduledTime,
                String.format("0 %d %d %d * *", scheduledTime.getMinute(), scheduledTime.getHour(), dayOfMonth));
    }

    /**
     * 严格晚于 after 的下一次触发时间，无则返回 null
     */
    public LocalDateTime nextFiring(LocalDateTime after) {
        return cron.next(after);
    }

    public boolean firesOn(LocalDate date) {
        LocalDateTime next = cron.next(date.atStartOfDay().minusSeconds(1));
        return next != null && next.toLocalDate().equals(date);
    }

    /**
     * [from, to) 区间内的全部触发时间
     */
    public List<LocalDateTime> firingsBetween(LocalDateTime from, LocalDateTime to) {
        List<LocalDateTime> firings = new ArrayList<>();
        LocalDateTime next = cron.next(from.minusNanos(1));
        while (next != null && next.isBefore(to)) {
            firings.add(next);
            next = cron.next(next);
        }
        return firings;
    }
}
