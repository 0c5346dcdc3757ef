package com.phillippitts.syd.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the star executor through Micrometer gauges:
 * {@code star.pool.size}, {@code star.pool.active}, {@code star.pool.queued} and
 * {@code star.pool.completed}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> starExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("starExecutor") ObjectProvider<ThreadPoolTaskExecutor> starExecutorProvider) {
        this.starExecutorProvider = starExecutorProvider;
    }

    @Bean
    public MeterBinder starExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = starExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("star.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the star pool")
                    .register(registry);
            Gauge.builder("star.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively processing star groups")
                    .register(registry);
            Gauge.builder("star.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of star groups waiting in the queue")
                    .register(registry);
            Gauge.builder("star.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed star groups")
                    .register(registry);

            LOG.debug("Star thread pool metrics registered");
        };
    }
}
