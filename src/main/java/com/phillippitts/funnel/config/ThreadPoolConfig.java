package com.phillippitts.funnel.config;

import com.phillippitts.funnel.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs relay session work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the shared pool behind every session's serial mailbox.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.relay.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - handles typical load</li>
     *   <li>Max pool: default 16 - handles bursts of concurrent sessions</li>
     *   <li>Queue: default 500 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the submitting thread (a WebSocket or backend I/O thread)
     * runs the task, which slows intake instead of dropping audio.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the worker.
     *
     * @return Configured executor for relay session tasks
     */
    @Bean(name = "relayExecutor")
    public Executor relayExecutor() {
        ThreadPoolProperties.RelayPoolProperties relayProps = threadPoolProperties.getRelay();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relayProps.getCorePoolSize());
        executor.setMaxPoolSize(relayProps.getMaxPoolSize());
        executor.setQueueCapacity(relayProps.getQueueCapacity());
        executor.setThreadNamePrefix(relayProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(relayProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
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
