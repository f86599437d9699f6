package quest.gekko.aspath.service.scheduling;

import java.util.List;

/**
 * Named, cron-triggered invocation of an ingestion task with positional args.
 */
public record ScheduleEntry(String name, CronSchedule trigger, String task, List<String> args) {

    public static final String GRAB_PREFIX = "grab-";

    public ScheduleEntry {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static String grabName(String collectorName) {
        return GRAB_PREFIX + collectorName;
    }
}
