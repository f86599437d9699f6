package quest.gekko.aspath.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import quest.gekko.aspath.service.ingestion.IngestionDispatcher;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Periodic tick that fires registry entries whose trigger came due since the
 * previous tick. The registry is re-read on every tick, so entries written by
 * a reconcile in another process are picked up without a restart.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "aspath.scheduler.beat-enabled", havingValue = "true", matchIfMissing = true)
public class GrabScheduleBeat {

    private final ScheduleRegistry registry;
    private final IngestionDispatcher dispatcher;
    private final Clock clock;

    private ZonedDateTime lastTick;

    public GrabScheduleBeat(ScheduleRegistry registry, IngestionDispatcher dispatcher, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${aspath.scheduler.beat-interval:30s}")
    public void tick() {
        try {
            List<ScheduleEntry> fired = tick(ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC));
            if (!fired.isEmpty()) {
                log.info("Beat fired {} entries", fired.size());
            }
        } catch (RuntimeException e) {
            log.error("Beat tick failed: {}", e.getMessage(), e);
        }
    }

    synchronized List<ScheduleEntry> tick(ZonedDateTime now) {
        ZonedDateTime since = lastTick;
        if (since == null) {
            lastTick = now;
            return List.of();
        }

        // a failed read leaves the window open so the next tick fires what came due
        List<ScheduleEntry> entries = registry.list();
        lastTick = now;

        List<ScheduleEntry> fired = new ArrayList<>();
        for (ScheduleEntry entry : entries) {
            ZonedDateTime due = entry.trigger().nextFireAfter(since);
            if (due != null && !due.isAfter(now)) {
                log.info("Firing {} (due {})", entry.name(), due);
                try {
                    dispatcher.dispatch(entry.task(), entry.args());
                    fired.add(entry);
                } catch (RuntimeException e) {
                    log.error("Cannot fire {}: {}", entry.name(), e.getMessage(), e);
                }
            }
        }
        return fired;
    }
}
