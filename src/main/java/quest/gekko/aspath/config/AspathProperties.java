package quest.gekko.aspath.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.aspath.service.scheduling.CronSchedule;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for scheduling, ingestion and the collector cache
 */
@Configuration
@EnableConfigurationProperties({
        AspathProperties.Scheduler.class,
        AspathProperties.Ingestion.class,
        AspathProperties.Cache.class
})
public class AspathProperties {

    /**
     * @param grabbers collector name to daily UTC grab time
     * @param registry {@code jpa} (shared, default) or {@code memory}
     */
    @ConfigurationProperties("aspath.scheduler")
    public record Scheduler(
            Map<String, Grabber> grabbers,
            @DefaultValue("jpa") String registry,
            @DefaultValue("true") boolean reconcileOnStartup,
            @DefaultValue("30s") Duration reconcileTimeout,
            @DefaultValue("true") boolean beatEnabled,
            @DefaultValue("30s") Duration beatInterval) {

        public Map<String, CronSchedule> triggers() {
            Map<String, CronSchedule> triggers = new LinkedHashMap<>();
            if (grabbers != null) {
                grabbers.forEach((collector, g) -> triggers.put(collector, g.toCronSchedule()));
            }
            return triggers;
        }
    }

    public record Grabber(int hour, int minute) {
        public CronSchedule toCronSchedule() {
            return new CronSchedule(hour, minute);
        }
    }

    @ConfigurationProperties("aspath.ingestion")
    public record Ingestion(
            @DefaultValue("./dumps") Path dumpDir,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("2s") Duration backoff,
            @DefaultValue("1000") int batchSize,
            @DefaultValue("4") int poolSize) {}

    /**
     * @param ttl how long a resolved collector name is served from memory
     */
    @ConfigurationProperties("aspath.cache")
    public record Cache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("15m") Duration ttl,
            @DefaultValue("1000") long maxCollectors) {}
}
