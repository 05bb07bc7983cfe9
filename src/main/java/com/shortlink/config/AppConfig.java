package com.shortlink.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Read-through cache of code -> target URL used on the redirect path.
     * Entries never go stale because a link's target is immutable, so only the size bound evicts.
     */
    @Bean
    public Cache<String, String> targetUrlCache(@Value("${app.cache.max-size:10000}") long maxSize) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .build();
    }

    /**
     * Writes the per-visit log. When the queue is full the record is dropped rather than
     * run on the redirecting thread.
     */
    @Bean(name = "visitLogExecutor")
    public Executor visitLogExecutor(@Value("${app.visits.log-threads:2}") int threads,
                                     @Value("${app.visits.log-queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("VisitLog-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Visit log queue full ({} queued), dropping one visit record", pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
