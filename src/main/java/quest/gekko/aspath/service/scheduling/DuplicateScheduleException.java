package quest.gekko.aspath.service.scheduling;

import lombok.Getter;

@Getter
public class DuplicateScheduleException extends RuntimeException {
    private final String entryName;

    public DuplicateScheduleException(String entryName) {
        super("Schedule entry already registered: " + entryName);
        this.entryName = entryName;
    }

    public DuplicateScheduleException(String entryName, Throwable cause) {
        super("Schedule entry already registered: " + entryName, cause);
        this.entryName = entryName;
    }
}
