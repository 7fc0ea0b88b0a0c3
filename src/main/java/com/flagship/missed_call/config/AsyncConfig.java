package com.flagship.missed_call.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool configuration for background pipeline work.
 *
 * pipelineTaskExecutor runs every webhook-triggered saga after the HTTP
 * request has been acknowledged. Work is I/O bound (ledger writes, Twilio
 * REST call, outbox insert), so the pool is sized above core count.
 * A full queue rejects at once (AbortPolicy) so the webhook thread never
 * runs a saga itself; {@code WebhookDispatcher} logs and counts the
 * rejected event.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    public static final String PIPELINE_EXECUTOR = "pipelineTaskExecutor";

    @Bean(name = PIPELINE_EXECUTOR)
    public Executor pipelineTaskExecutor(MissedCallProperties properties) {
        MissedCallProperties.Async async = properties.getAsync();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(async.getCorePoolSize());
        executor.setMaxPoolSize(async.getMaxPoolSize());
        executor.setQueueCapacity(async.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's MDC (correlation id) onto the worker thread.
     */
    private TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
