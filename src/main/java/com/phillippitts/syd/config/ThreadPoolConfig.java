package com.phillippitts.syd.config;

import com.phillippitts.syd.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executor that runs star groups in parallel mode.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.star.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the thread pool for star groups.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the dispatching thread runs the group itself, so no group is ever dropped.
     *
     * <p>The Log4j2 ThreadContext of the submitting thread is copied to the worker, so run-level
     * context keys appear in per-star logs.
     *
     * @return configured executor for star groups
     */
    @Bean(name = "starExecutor")
    public ThreadPoolTaskExecutor starExecutor() {
        ThreadPoolProperties.StarPoolProperties starProps = threadPoolProperties.getStar();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(starProps.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(starProps.getCorePoolSize(), starProps.getMaxPoolSize()));
        executor.setQueueCapacity(starProps.getQueueCapacity());
        executor.setThreadNamePrefix(starProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(starProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(contextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator contextPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
