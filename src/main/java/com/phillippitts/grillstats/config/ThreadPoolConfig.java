package com.phillippitts.grillstats.config;

import com.phillippitts.grillstats.config.properties.PollingProperties;
import com.phillippitts.grillstats.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools of the telemetry pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on device count and subscriber load.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final PollingProperties pollingProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, PollingProperties pollingProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.pollingProperties = pollingProperties;
    }

    /**
     * Scheduler that fires the per-device poll ticks. Ticks only hand work to
     * {@link #pollExecutor()}, so a small pool serves many devices.
     *
     * @return scheduler for poll ticks
     */
    @Bean(name = "pollScheduler")
    public ThreadPoolTaskScheduler pollScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(pollingProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("poll-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool running device polls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected tick is reported
     * as a failed poll for that device instead of running on the scheduler thread, where a
     * stalled source would delay every other device.
     *
     * @return executor for device polls
     */
    @Bean(name = "pollExecutor")
    public ThreadPoolTaskExecutor pollExecutor() {
        return buildExecutor(threadPoolProperties.getPoll(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Pool draining subscriber buffers onto their connections. Sends block on network flush,
     * so they never run on a producer thread.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the dispatcher keeps the
     * update buffered and retries the drain on the next publish.
     *
     * @return executor for stream sends
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        return buildExecutor(threadPoolProperties.getDispatch(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Pool forwarding readings to the historical store, fire-and-forget.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the forwarder counts and drops
     * the reading so the live path is never slowed by the store.
     *
     * @return executor for history forwarding
     */
    @Bean(name = "historyExecutor")
    public ThreadPoolTaskExecutor historyExecutor() {
        return buildExecutor(threadPoolProperties.getHistory(), new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                 RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread onto the worker so request,
     * device and client ids survive the hop.
     */
    static TaskDecorator threadContextPropagator() {
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
