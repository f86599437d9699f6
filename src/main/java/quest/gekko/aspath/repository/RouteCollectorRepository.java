package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.aspath.domain.RouteCollector;

import java.util.List;
import java.util.Optional;

public interface RouteCollectorRepository extends JpaRepository<RouteCollector, Long> {
    Optional<RouteCollector> findByName(final String name);
    List<RouteCollector> findByExchangePointIdOrderByIdAsc(final Long exchangePointId);
}
