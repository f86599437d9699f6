package quest.gekko.aspath.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import quest.gekko.aspath.config.AspathProperties;
import quest.gekko.aspath.domain.RouteCollector;
import quest.gekko.aspath.domain.RoutingSnapshot;
import quest.gekko.aspath.service.core.RouteCollectorService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Grabs one collector's current table and stores it as a new snapshot.
 * <p>
 * The snapshot is opened as pending, rows are appended in batches and the
 * snapshot ends up parsed, or failed if anything along the way throws.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GrabAndIngestTask implements IngestionTask {
    public static final String TASK_NAME = "grab_and_ingest";

    private final RouteCollectorService collectorService;
    private final RoutingTableSource tableSource;
    private final SnapshotWriter writer;
    private final AspathProperties.Ingestion properties;
    private final Clock clock;

    @Override
    public String taskName() { return TASK_NAME; }

    @Override
    public void run(List<String> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException(TASK_NAME + " expects exactly one collector name, got " + args);
        }
        ingest(args.get(0));
    }

    public RoutingSnapshot ingest(String collectorName) {
        RouteCollector collector = collectorService.requireByName(collectorName);

        // whole seconds keep the created_at join exact on every database
        LocalDateTime createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        RoutingSnapshot snapshot = writer.open(collector, createdAt);
        log.info("Opened snapshot {} for {} at {}", snapshot.getId(), collectorName, createdAt);

        try {
            List<AnnouncedRoute> routes = retryTemplate().execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying grab of {} (attempt {})", collectorName, ctx.getRetryCount() + 1);
                }
                return tableSource.fetch(collectorName);
            });

            int batchSize = Math.max(1, properties.batchSize());
            for (int i = 0; i < routes.size(); i += batchSize) {
                writer.append(snapshot, routes.subList(i, Math.min(i + batchSize, routes.size())));
                log.debug("Wrote batch {}/{}", Math.min(i + batchSize, routes.size()), routes.size());
            }

            RoutingSnapshot parsed = writer.markParsed(snapshot, routes.size());
            log.info("Snapshot {} for {} parsed with {} routes", parsed.getId(), collectorName, routes.size());
            return parsed;
        } catch (Exception e) {
            log.error("Ingestion of {} failed, snapshot {} marked failed: {}", collectorName, snapshot.getId(), e.getMessage(), e);
            writer.markFailed(snapshot, e.getMessage());
            throw new IngestionException("Ingestion of " + collectorName + " failed", e);
        }
    }

    private RetryTemplate retryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.maxAttempts()))
                .fixedBackoff(Math.max(1, properties.backoff().toMillis()))
                .notRetryOn(RoutingTableFormatException.class)
                .notRetryOn(IllegalArgumentException.class)
                .build();
    }
}
