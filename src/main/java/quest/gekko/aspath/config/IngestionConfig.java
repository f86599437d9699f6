package quest.gekko.aspath.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class IngestionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // grabs for different collectors run side by side; same-collector runs are
    // serialized by IngestionDispatcher
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(AspathProperties.Ingestion properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.poolSize());
        executor.setMaxPoolSize(properties.poolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
