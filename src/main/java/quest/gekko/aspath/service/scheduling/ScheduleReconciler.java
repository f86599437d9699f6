package quest.gekko.aspath.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.aspath.service.ingestion.GrabAndIngestTask;

import java.util.List;
import java.util.Map;

/**
 * Rebuilds the schedule registry from configuration: every existing entry is
 * removed, then one {@code grab-<collector>} entry is added per configured
 * collector.
 * <p>
 * Nothing is rolled back. A failure half way leaves a partial registry which
 * the next reconcile repairs. An interrupted reconcile stops before its next
 * registry write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduleReconciler {

    private final ScheduleRegistry registry;

    public List<ScheduleEntry> reconcile(Map<String, CronSchedule> grabbers) {
        log.info("Wiping scheduled tasks...");
        for (ScheduleEntry stale : registry.list()) {
            abortIfInterrupted();
            registry.remove(stale.name());
            log.debug("Removed schedule entry {}", stale.name());
        }

        log.info("Registering {} grabber(s): {}", grabbers.size(), grabbers.keySet());
        for (Map.Entry<String, CronSchedule> grabber : grabbers.entrySet()) {
            String collector = grabber.getKey();
            ScheduleEntry entry = new ScheduleEntry(
                    ScheduleEntry.grabName(collector),
                    grabber.getValue(),
                    GrabAndIngestTask.TASK_NAME,
                    List.of(collector));
            abortIfInterrupted();
            try {
                registry.add(entry);
            } catch (DuplicateScheduleException e) {
                log.error("Schedule name collision for collector {} ({}), aborting reconcile", collector, entry.name());
                throw e;
            }
        }

        List<ScheduleEntry> current = registry.list();
        log.info("New scheduler config:");
        for (ScheduleEntry entry : current) {
            log.info("  {} @ {} -> {}{}", entry.name(), entry.trigger().toCronExpression(), entry.task(), entry.args());
        }
        return current;
    }

    private static void abortIfInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Reconcile interrupted, registry left partial");
            throw new ReconcileInterruptedException();
        }
    }
}
