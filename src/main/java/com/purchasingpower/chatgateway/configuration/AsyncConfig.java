package com.purchasingpower.chatgateway.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executors for work that runs off the request thread.
 *
 * <ul>
 *   <li>{@code analyticsExecutor} - fire-and-forget exchange analytics</li>
 *   <li>{@code providerAttemptExecutor} - provider calls, so the orchestrator can
 *       bound and abandon each attempt</li>
 * </ul>
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig implements AsyncConfigurer {

    private final AppProperties props;

    @Bean(name = "analyticsExecutor")
    @Override
    public Executor getAsyncExecutor() {
        AnalyticsProperties analytics = props.getAnalytics();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(analytics.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(analytics.getCorePoolSize(), analytics.getMaxPoolSize()));
        executor.setQueueCapacity(analytics.getQueueCapacity());
        executor.setThreadNamePrefix("analytics-async-");

        // Analytics are best-effort, don't hold shutdown for them
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        log.info("✅ Analytics executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                analytics.getQueueCapacity());

        return executor;
    }

    @Bean(name = "providerAttemptExecutor")
    public ThreadPoolTaskExecutor providerAttemptExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("provider-attempt-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Provider attempt executor configured: core={}, max={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize());

        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.warn("Async task {} failed: {}", method.getName(), ex.getMessage(), ex);
    }
}
