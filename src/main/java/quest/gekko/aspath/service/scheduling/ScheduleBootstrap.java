package quest.gekko.aspath.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import quest.gekko.aspath.config.AspathProperties;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the reconcile once per process start. A failed or timed out reconcile
 * is logged and the service keeps serving reads.
 * <p>
 * On timeout the reconcile thread is interrupted; the reconciler stops before
 * its next registry write, leaving a partial registry for the next start.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScheduleBootstrap {

    private final ScheduleReconciler reconciler;
    private final AspathProperties.Scheduler properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.reconcileOnStartup()) {
            log.info("Schedule reconcile on startup disabled");
            return;
        }
        reconcileWithin();
    }

    boolean reconcileWithin() {
        var triggers = properties.triggers();
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "schedule-reconcile");
            thread.setDaemon(true);
            return thread;
        });
        Future<List<ScheduleEntry>> run = worker.submit(() -> reconciler.reconcile(triggers));
        try {
            List<ScheduleEntry> entries = run.get(properties.reconcileTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Scheduler reconciled with {} entries", entries.size());
            return true;
        } catch (TimeoutException e) {
            run.cancel(true);
            log.error("Schedule reconcile did not finish within {}; registry may be partial for collectors {}",
                    properties.reconcileTimeout(), triggers.keySet());
        } catch (ExecutionException e) {
            log.error("Schedule reconcile failed; registry may be partial for collectors {}",
                    triggers.keySet(), e.getCause());
        } catch (InterruptedException e) {
            run.cancel(true);
            Thread.currentThread().interrupt();
            log.error("Interrupted while reconciling schedules");
        } finally {
            worker.shutdownNow();
        }
        return false;
    }
}
