package quest.gekko.aspath.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caches route collectors by name. Collectors are never renamed or deleted by
 * this service, so a bounded TTL is the only invalidation.
 */
@Configuration
@EnableCaching
@ConditionalOnProperty(name = "aspath.cache.enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    public static final String ROUTE_COLLECTORS = "routeCollectors";

    @Bean
    public CacheManager cacheManager(final AspathProperties.Cache properties) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(ROUTE_COLLECTORS);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(properties.maxCollectors())
                .expireAfterWrite(properties.ttl()));
        return cacheManager;
    }
}
