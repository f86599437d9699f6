package quest.gekko.aspath.service.scheduling;

import org.springframework.scheduling.support.CronExpression;

import java.time.ZonedDateTime;

/**
 * Daily trigger at a fixed UTC hour and minute.
 */
public record CronSchedule(int hour, int minute) {

    public CronSchedule {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be within 0..23, got " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be within 0..59, got " + minute);
        }
    }

    /** Spring six-field form: second minute hour day month weekday. */
    public String toCronExpression() {
        return "0 " + minute + " " + hour + " * * *";
    }

    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        return CronExpression.parse(toCronExpression()).next(after);
    }
}
