package quest.gekko.aspath.service.scheduling;

import java.util.List;

/**
 * Durable set of schedule entries keyed by name.
 */
public interface ScheduleRegistry {

    /** Every registered entry, in no particular order. */
    List<ScheduleEntry> list();

    /**
     * Registers a new entry.
     *
     * @throws DuplicateScheduleException if an entry with the same name exists
     */
    void add(ScheduleEntry entry);

    /** Removes the named entry; does nothing when it is absent. */
    void remove(String name);
}
