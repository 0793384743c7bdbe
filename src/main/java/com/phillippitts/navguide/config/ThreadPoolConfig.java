package com.phillippitts.navguide.config;

import com.phillippitts.navguide.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for frame processing and speech output.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}. Both executors copy the
 * Log4j2 ThreadContext (MDC) from the submitting thread, so request and session ids
 * survive the hop to the worker.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool running one pipeline pass per submitted frame.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue
     * are full the submitting request thread processes the frame itself, which slows the
     * detector client down instead of dropping frames.
     *
     * @return executor for frame processing
     */
    @Bean(name = "frameExecutor")
    public ThreadPoolTaskExecutor frameExecutor() {
        return build(threadPoolProperties.getFrame(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Single worker that hands utterances to the speech sink in acceptance order.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A full queue means the sink
     * is stuck; the arbiter catches the rejection, drops the request and counts it.
     *
     * @return executor for speech output
     */
    @Bean(name = "speechExecutor")
    public ThreadPoolTaskExecutor speechExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getSpeech();
        if (props.getMaxPoolSize() != 1) {
            throw new IllegalArgumentException("threadpool.speech.max-pool-size must be 1 to keep utterances "
                    + "in order, got: " + props.getMaxPoolSize());
        }
        return build(props, new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
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
