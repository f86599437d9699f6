package quest.gekko.aspath.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.aspath.config.CacheConfig;
import quest.gekko.aspath.domain.RouteCollector;
import quest.gekko.aspath.repository.RouteCollectorRepository;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RouteCollectorService {

    private final RouteCollectorRepository collectorRepository;

    public Optional<RouteCollector> findByName(String name) {
        return collectorRepository.findByName(name);
    }

    // unknown names throw and stay uncached, so a freshly added collector is visible at once
    @Cacheable(value = CacheConfig.ROUTE_COLLECTORS, key = "#name")
    public RouteCollector requireByName(String name) {
        return collectorRepository.findByName(name).orElseThrow(() -> new CollectorNotFoundException(name));
    }

    public List<RouteCollector> findAll() {
        return collectorRepository.findAll();
    }

    public List<RouteCollector> findByExchangePoint(Long exchangePointId) {
        return collectorRepository.findByExchangePointIdOrderByIdAsc(exchangePointId);
    }
}
