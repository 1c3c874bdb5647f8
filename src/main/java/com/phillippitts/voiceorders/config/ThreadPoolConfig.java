package com.phillippitts.voiceorders.config;

import com.phillippitts.voiceorders.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used in asynchronous processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent sessions and observers.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for blocking calls to the speech, language and voice backends.
     *
     * <p>A session waiting for a backend holds one of these threads, never a WebSocket
     * container thread. Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; a rejected
     * call is reported to the session as a backend failure.
     *
     * @return executor for backend calls
     */
    @Bean(name = "backendExecutor")
    public ThreadPoolTaskExecutor backendExecutor() {
        return build(threadPoolProperties.getBackend(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for transcript fan-out, one task per observer per update.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full, the appending session delivers the update itself, providing backpressure
     * instead of dropping snapshots.
     *
     * @return executor for transcript delivery
     */
    @Bean(name = "transcriptExecutor")
    public ThreadPoolTaskExecutor transcriptExecutor() {
        return build(threadPoolProperties.getTranscript(), new ThreadPoolExecutor.CallerRunsPolicy());
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
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread,
     * so session ids survive the hop onto pool threads.
     */
    static TaskDecorator mdcPropagation() {
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
