package com.phillippitts.transcriptionagent.config;

import com.phillippitts.transcriptionagent.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools that run track sessions, room notifications and the heartbeat.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of speakers per room.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the thread pool running the two flows of every track session.
     *
     * <p>Session flows block for as long as the track publishes audio, so the pool has no queue:
     * a flow either gets a thread immediately or is rejected with
     * {@link ThreadPoolExecutor.AbortPolicy}. A rejected session fails fast and releases its
     * track id; a caller-runs policy would park the dispatch thread inside a session.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread.
     *
     * @return Configured executor for track sessions
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolProperties.SessionPoolProperties sessionProps = threadPoolProperties.getSession();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sessionProps.getCorePoolSize());
        executor.setMaxPoolSize(sessionProps.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(sessionProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(sessionProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Creates a bounded thread pool for room notification handling.
     *
     * <p>Each notification (participant joined, track subscribed, track unsubscribed) is handled
     * as an independent task so the dispatch loop never waits on discovery work.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When pool and queue are full, the dispatch loop handles the notification itself, providing
     * backpressure instead of dropping it.
     *
     * @return Configured executor for notification handling
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolProperties.EventPoolProperties eventProps = threadPoolProperties.getEvent();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventProps.getCorePoolSize());
        executor.setMaxPoolSize(eventProps.getMaxPoolSize());
        executor.setQueueCapacity(eventProps.getQueueCapacity());
        executor.setThreadNamePrefix(eventProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(eventProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Single-threaded scheduler for the status heartbeat.
     */
    @Bean(name = "heartbeatScheduler")
    public ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("heartbeat-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static TaskDecorator mdcPropagatingDecorator() {
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
