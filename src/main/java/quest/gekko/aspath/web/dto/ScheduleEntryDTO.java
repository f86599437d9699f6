package quest.gekko.aspath.web.dto;

import quest.gekko.aspath.service.scheduling.ScheduleEntry;

import java.util.List;

public record ScheduleEntryDTO(String name, String cron, int hour, int minute, String task, List<String> args) {

    public static ScheduleEntryDTO of(ScheduleEntry entry) {
        return new ScheduleEntryDTO(
                entry.name(),
                entry.trigger().toCronExpression(),
                entry.trigger().hour(),
                entry.trigger().minute(),
                entry.task(),
                entry.args());
    }
}
