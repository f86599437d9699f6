package quest.gekko.aspath.service.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs ingestion tasks by reference on the ingestion executor.
 * <p>
 * Runs are serialized per collector (the first positional arg): a run that
 * arrives while another one for the same collector is still going is skipped.
 */
@Service
@Slf4j
public class IngestionDispatcher {

    private final Map<String, IngestionTask> tasksByName;
    private final TaskExecutor executor;
    private final Map<String, ReentrantLock> collectorLocks = new ConcurrentHashMap<>();

    public IngestionDispatcher(List<IngestionTask> tasks,
                               @Qualifier("ingestionExecutor") TaskExecutor executor) {
        this.tasksByName = tasks.stream()
                .collect(Collectors.toMap(IngestionTask::taskName, Function.identity()));
        this.executor = executor;
    }

    public CompletableFuture<Boolean> dispatch(String taskName, List<String> args) {
        IngestionTask task = tasksByName.get(taskName);
        if (task == null) {
            throw new IllegalArgumentException("Unknown ingestion task: " + taskName);
        }
        String collector = args.isEmpty() ? "" : args.get(0);
        return CompletableFuture.supplyAsync(() -> runExclusive(task, collector, args), executor);
    }

    public boolean isRunning(String collector) {
        ReentrantLock lock = collectorLocks.get(collector);
        return lock != null && lock.isLocked();
    }

    private boolean runExclusive(IngestionTask task, String collector, List<String> args) {
        ReentrantLock lock = collectorLocks.computeIfAbsent(collector, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Skipping {} for {}: previous run still in progress", task.taskName(), collector);
            return false;
        }
        try {
            log.info("Running {}{}", task.taskName(), args);
            task.run(args);
            return true;
        } catch (RuntimeException e) {
            log.error("Task {} for collector {} failed: {}", task.taskName(), collector, e.getMessage(), e);
            throw e;
        } finally {
            lock.unlock();
        }
    }
}
