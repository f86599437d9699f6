package quest.gekko.aspath.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.aspath.domain.ExchangePoint;
import quest.gekko.aspath.domain.RouteCollector;
import quest.gekko.aspath.domain.RoutingSnapshot;
import quest.gekko.aspath.domain.SnapshotStatus;
import quest.gekko.aspath.repository.AutonomousSystemRepository;
import quest.gekko.aspath.repository.ExchangePointRepository;
import quest.gekko.aspath.repository.RouteCollectorRepository;
import quest.gekko.aspath.repository.RouteRowRepository;
import quest.gekko.aspath.repository.RoutingSnapshotRepository;
import quest.gekko.aspath.web.dto.ExchangePointDTO;
import quest.gekko.aspath.web.dto.RouteCollectorDTO;
import quest.gekko.aspath.web.dto.RouteDTO;
import quest.gekko.aspath.web.dto.SnapshotDTO;
import quest.gekko.aspath.web.dto.SnapshotRoutesDTO;
import quest.gekko.aspath.web.dto.StatisticsDTO;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side over collectors, snapshots and routes.
 * <p>
 * Every per-collector operation resolves the collector first and fails with
 * {@link CollectorNotFoundException} before touching snapshots or routes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class SnapshotQueryService {

    private final RouteCollectorService collectorService;
    private final ExchangePointRepository exchangePointRepository;
    private final RouteCollectorRepository collectorRepository;
    private final RoutingSnapshotRepository snapshotRepository;
    private final RouteRowRepository routeRepository;
    private final AutonomousSystemRepository asRepository;

    public List<RouteCollectorDTO> listCollectors() {
        return collectorService.findAll().stream()
                .map(RouteCollectorDTO::of)
                .toList();
    }

    public Map<Long, ExchangePointDTO> listExchangePoints() {
        Map<Long, ExchangePointDTO> result = new LinkedHashMap<>();
        for (ExchangePoint ixp : exchangePointRepository.findAllByOrderByIdAsc()) {
            result.put(ixp.getId(), summarize(ixp));
        }
        return result;
    }

    public List<SnapshotDTO> listSnapshots(String collectorName) {
        RouteCollector collector = collectorService.requireByName(collectorName);
        return snapshotRepository
                .findByRouteCollectorIdAndStatusOrderByCreatedAtDescIdDesc(collector.getId(), SnapshotStatus.PARSED)
                .stream()
                .map(SnapshotDTO::of)
                .toList();
    }

    public SnapshotRoutesDTO getLatestRoutes(String collectorName) {
        RouteCollector collector = collectorService.requireByName(collectorName);
        RoutingSnapshot snapshot = snapshotRepository.findTopByRouteCollectorIdOrderByIdDesc(collector.getId())
                .orElseThrow(() -> new SnapshotNotFoundException(collectorName, null));
        return routesOf(snapshot);
    }

    public SnapshotRoutesDTO getSnapshotRoutes(String collectorName, Long snapshotId) {
        RouteCollector collector = collectorService.requireByName(collectorName);
        RoutingSnapshot snapshot = snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(collectorName, snapshotId));
        if (!Objects.equals(snapshot.getRouteCollectorId(), collector.getId())) {
            log.debug("Snapshot {} belongs to collector id {}, not {}", snapshotId,
                    snapshot.getRouteCollectorId(), collectorName);
            throw new SnapshotNotFoundException(collectorName, snapshotId);
        }
        return routesOf(snapshot);
    }

    public StatisticsDTO getStatistics() {
        return new StatisticsDTO(
                collectorRepository.count(),
                snapshotRepository.count(),
                asRepository.count(),
                exchangePointRepository.count());
    }

    private SnapshotRoutesDTO routesOf(RoutingSnapshot snapshot) {
        List<RouteDTO> routes = routeRepository.findRoutesWithOrigin(snapshot.getCreatedAt(), snapshot.getId());
        return SnapshotRoutesDTO.of(snapshot, routes);
    }

    private ExchangePointDTO summarize(ExchangePoint ixp) {
        List<RouteCollector> collectors = collectorService.findByExchangePoint(ixp.getId());
        if (collectors.isEmpty()) {
            return ExchangePointDTO.withoutSnapshot(ixp, 0);
        }

        Map<Long, String> namesById = collectors.stream()
                .collect(Collectors.toMap(RouteCollector::getId, RouteCollector::getName));
        Optional<RoutingSnapshot> last = snapshotRepository
                .findTopByRouteCollectorIdInOrderByCreatedAtDescIdDesc(namesById.keySet());

        return last
                .map(s -> ExchangePointDTO.withSnapshot(ixp, collectors.size(),
                        s.getCreatedAt().toLocalDate(), s.getId(), namesById.get(s.getRouteCollectorId())))
                .orElseGet(() -> ExchangePointDTO.withoutSnapshot(ixp, collectors.size()));
    }
}
