package com.phillippitts.transcriptionagent.config;

import com.phillippitts.transcriptionagent.service.session.SessionRegistry;
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
 * Exposes session registry and session pool gauges via Micrometer.
 *
 * <ul>
 *   <li>agent.sessions.active - Tracks currently held in the session registry</li>
 *   <li>session.pool.size - Current number of threads in the session pool</li>
 *   <li>session.pool.active - Number of threads running session flows</li>
 *   <li>session.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes for operational visibility.
 */
@Configuration
public class SessionMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(SessionMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider;
    private final SessionRegistry sessionRegistry;

    public SessionMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            SessionRegistry sessionRegistry) {
        this.sessionExecutorProvider = sessionExecutorProvider;
        this.sessionRegistry = sessionRegistry;
    }

    @Bean
    public MeterBinder sessionMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = sessionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("agent.sessions.active", sessionRegistry, SessionRegistry::size)
                    .description("Number of audio tracks currently being transcribed")
                    .register(registry);

            Gauge.builder("session.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the session pool")
                    .register(registry);

            Gauge.builder("session.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running session flows")
                    .register(registry);

            Gauge.builder("session.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the session executor")
                    .register(registry);

            LOG.info("Session metrics registered: agent.sessions.active, session.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSessionPoolHealth() {
        ThreadPoolExecutor executor = sessionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Session pool health: sessions={}, threads={}/{}, active={}, completed={}",
                sessionRegistry.size(),
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getCompletedTaskCount()
        );
    }
}
