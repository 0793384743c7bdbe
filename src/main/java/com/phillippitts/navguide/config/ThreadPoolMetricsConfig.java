package com.phillippitts.navguide.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Exposes frame and speech pool state via Micrometer.
 *
 * <p>Gauges per pool ({@code navguide.pool.*}, tagged {@code pool=frame|speech}):
 * size, active, queued, completed. A backed-up speech queue means the sink is slower than
 * the gates allow output, which shows up here before it shows up as late guidance.
 *
 * <p>Also logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> frameExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> speechExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("frameExecutor") ObjectProvider<ThreadPoolTaskExecutor> frameExecutorProvider,
            @Qualifier("speechExecutor") ObjectProvider<ThreadPoolTaskExecutor> speechExecutorProvider) {
        this.frameExecutorProvider = frameExecutorProvider;
        this.speechExecutorProvider = speechExecutorProvider;
    }

    @Bean
    public MeterBinder navigationExecutorMetrics() {
        return registry -> {
            bind(registry, "frame", frameExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "speech", speechExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: navguide.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("navguide.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("navguide.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("navguide.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("navguide.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("Frame", frameExecutorProvider.getObject().getThreadPoolExecutor());
        log("Speech", speechExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
