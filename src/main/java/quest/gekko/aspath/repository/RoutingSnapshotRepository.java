package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.aspath.domain.RoutingSnapshot;
import quest.gekko.aspath.domain.SnapshotStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RoutingSnapshotRepository extends JpaRepository<RoutingSnapshot, Long> {

    // history view: parsed only, newest first
    List<RoutingSnapshot> findByRouteCollectorIdAndStatusOrderByCreatedAtDescIdDesc(final Long routeCollectorId,
                                                                                   final SnapshotStatus status);

    // "latest" ignores status and may surface an in-progress snapshot
    Optional<RoutingSnapshot> findTopByRouteCollectorIdOrderByIdDesc(final Long routeCollectorId);

    // most recent snapshot across a set of collectors, any status
    Optional<RoutingSnapshot> findTopByRouteCollectorIdInOrderByCreatedAtDescIdDesc(final Collection<Long> routeCollectorIds);
}
