package com.phillippitts.callcopilot.config;

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
 * Exposes the fan-out executor through Micrometer.
 *
 * <p>Gauges:
 * <ul>
 *   <li>fanout.pool.size - Current number of threads in the pool</li>
 *   <li>fanout.pool.active - Number of actively executing tasks</li>
 *   <li>fanout.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>fanout.pool.completed - Cumulative count of completed tasks</li>
 *   <li>fanout.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Available at {@code GET /actuator/metrics/fanout.pool.active}. A summary is also logged
 * every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> fanoutExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("fanoutExecutor") ObjectProvider<ThreadPoolTaskExecutor> fanoutExecutorProvider) {
        this.fanoutExecutorProvider = fanoutExecutorProvider;
    }

    @Bean
    public MeterBinder fanoutExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = fanoutExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("fanout.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the fan-out pool")
                    .register(registry);

            Gauge.builder("fanout.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing fan-out tasks")
                    .register(registry);

            Gauge.builder("fanout.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of fan-out tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("fanout.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed fan-out tasks")
                    .register(registry);

            Gauge.builder("fanout.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the fan-out executor")
                    .register(registry);

            LOG.info("Fan-out thread pool metrics registered: fanout.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = fanoutExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Fan-out Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
