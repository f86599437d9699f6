package quest.gekko.aspath.service.scheduling;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.aspath.domain.ScheduledGrab;
import quest.gekko.aspath.repository.ScheduledGrabRepository;

import java.util.List;

/**
 * Registry stored in the {@code schedule_entries} table, so every scheduler
 * process pointed at the same database sees the same set.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "aspath.scheduler.registry", havingValue = "jpa", matchIfMissing = true)
public class JpaScheduleRegistry implements ScheduleRegistry {

    private final ScheduledGrabRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<ScheduleEntry> list() {
        return repository.findAll().stream()
                .map(row -> new ScheduleEntry(row.getName(),
                        new CronSchedule(row.getHour(), row.getMinute()),
                        row.getTask(),
                        row.getArgs()))
                .toList();
    }

    @Override
    @Transactional
    public void add(ScheduleEntry entry) {
        if (repository.existsById(entry.name())) {
            throw new DuplicateScheduleException(entry.name());
        }
        ScheduledGrab row = new ScheduledGrab();
        row.setName(entry.name());
        row.setHour(entry.trigger().hour());
        row.setMinute(entry.trigger().minute());
        row.setTask(entry.task());
        row.setArgs(entry.args());
        try {
            repository.saveAndFlush(row);
        } catch (DataIntegrityViolationException e) {
            // another process inserted the same name between the check and the flush
            throw new DuplicateScheduleException(entry.name(), e);
        }
    }

    @Override
    @Transactional
    public void remove(String name) {
        repository.findById(name).ifPresent(repository::delete);
    }
}
