package com.phillippitts.factopinion.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the scoring executor through Micrometer.
 *
 * <ul>
 *   <li>scoring.pool.size - Current number of threads in the pool</li>
 *   <li>scoring.pool.active - Number of actively executing tasks</li>
 *   <li>scoring.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>scoring.pool.completed - Cumulative count of completed tasks</li>
 *   <li>scoring.pool.core.size - Configured core pool size</li>
 *   <li>scoring.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/scoring.pool.active}. A health summary is also
 * logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> scoringExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("scoringExecutor") ObjectProvider<ThreadPoolTaskExecutor> scoringExecutorProvider) {
        this.scoringExecutorProvider = scoringExecutorProvider;
    }

    @Bean
    public MeterBinder scoringExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = scoringExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("scoring.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the scoring pool")
                    .register(registry);

            Gauge.builder("scoring.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively scoring sentences")
                    .register(registry);

            Gauge.builder("scoring.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of sentences waiting in the queue")
                    .register(registry);

            Gauge.builder("scoring.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of scored sentences")
                    .register(registry);

            Gauge.builder("scoring.pool.core.size", executor, ThreadPoolExecutor::getCorePoolSize)
                    .description("Configured core pool size for scoring executor")
                    .register(registry);

            Gauge.builder("scoring.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for scoring executor")
                    .register(registry);

            LOG.info("Scoring thread pool metrics registered: scoring.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = scoringExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Scoring Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
