package quest.gekko.aspath.service.scheduling;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry. Only suitable when a single scheduler process runs.
 */
@Component
@ConditionalOnProperty(name = "aspath.scheduler.registry", havingValue = "memory")
public class InMemoryScheduleRegistry implements ScheduleRegistry {

    private final Map<String, ScheduleEntry> entries = new ConcurrentHashMap<>();

    @Override
    public List<ScheduleEntry> list() {
        return List.copyOf(entries.values());
    }

    @Override
    public void add(ScheduleEntry entry) {
        if (entries.putIfAbsent(entry.name(), entry) != null) {
            throw new DuplicateScheduleException(entry.name());
        }
    }

    @Override
    public void remove(String name) {
        entries.remove(name);
    }
}
