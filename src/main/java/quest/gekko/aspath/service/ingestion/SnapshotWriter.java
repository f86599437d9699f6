package quest.gekko.aspath.service.ingestion;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.aspath.domain.RouteCollector;
import quest.gekko.aspath.domain.RouteRow;
import quest.gekko.aspath.domain.RoutingSnapshot;
import quest.gekko.aspath.domain.SnapshotStatus;
import quest.gekko.aspath.repository.RouteRowRepository;
import quest.gekko.aspath.repository.RoutingSnapshotRepository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Write side of a snapshot. Each step commits on its own so readers see the
 * snapshot as pending while its rows are still being appended.
 */
@Service
@RequiredArgsConstructor
public class SnapshotWriter {
    private final RoutingSnapshotRepository snapshotRepository;
    private final RouteRowRepository routeRepository;

    @Transactional
    public RoutingSnapshot open(RouteCollector collector, LocalDateTime createdAt) {
        RoutingSnapshot snapshot = new RoutingSnapshot();
        snapshot.setRouteCollectorId(collector.getId());
        snapshot.setCreatedAt(createdAt);
        snapshot.setStatus(SnapshotStatus.PENDING);
        return snapshotRepository.save(snapshot);
    }

    @Transactional
    public void append(RoutingSnapshot snapshot, List<AnnouncedRoute> batch) {
        List<RouteRow> rows = batch.stream().map(route -> {
            RouteRow row = new RouteRow();
            row.setBlock(route.block());
            row.setPath(route.path());
            row.setOriginAs(route.origin());
            row.setSnapshotId(snapshot.getId());
            row.setCreatedAt(snapshot.getCreatedAt());
            return row;
        }).toList();
        routeRepository.saveAll(rows);
    }

    @Transactional
    public RoutingSnapshot markParsed(RoutingSnapshot snapshot, long routeCount) {
        snapshot.setStatus(SnapshotStatus.PARSED);
        snapshot.setRouteCount(routeCount);
        return snapshotRepository.save(snapshot);
    }

    @Transactional
    public RoutingSnapshot markFailed(RoutingSnapshot snapshot, String error) {
        snapshot.setStatus(SnapshotStatus.FAILED);
        snapshot.setErrorMessage(error == null ? null : error.substring(0, Math.min(error.length(), 1024)));
        return snapshotRepository.save(snapshot);
    }
}
