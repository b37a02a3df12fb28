package com.phillippitts.grillstats.config;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the poll, dispatch and history executors via Micrometer.
 *
 * <p>For each pool {@code <name>} in (poll, dispatch, history):
 * <ul>
 *   <li>grillstats.pool.size - current number of threads</li>
 *   <li>grillstats.pool.active - threads executing a task</li>
 *   <li>grillstats.pool.queued - tasks waiting in the queue</li>
 *   <li>grillstats.pool.completed - cumulative completed tasks</li>
 * </ul>
 * all tagged {@code pool=<name>}. A saturated poll or history pool shows up here before it shows
 * up as rejected polls or dropped history.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ObjectProvider<ThreadPoolTaskExecutor>> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(
            @Qualifier("pollExecutor") ObjectProvider<ThreadPoolTaskExecutor> pollExecutor,
            @Qualifier("dispatchExecutor") ObjectProvider<ThreadPoolTaskExecutor> dispatchExecutor,
            @Qualifier("historyExecutor") ObjectProvider<ThreadPoolTaskExecutor> historyExecutor) {
        pools.put("poll", pollExecutor);
        pools.put("dispatch", dispatchExecutor);
        pools.put("history", historyExecutor);
    }

    /**
     * Binds pool gauges to the meter registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder telemetryExecutorMetrics() {
        return registry -> {
            pools.forEach((name, provider) -> {
                ThreadPoolExecutor executor = provider.getObject().getThreadPoolExecutor();
                Gauge.builder("grillstats.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                        .description("Current number of threads in the pool")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("grillstats.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                        .description("Threads actively executing tasks")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("grillstats.pool.queued", executor, e -> e.getQueue().size())
                        .description("Tasks waiting in the queue")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("grillstats.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                        .description("Cumulative count of completed tasks")
                        .tag("pool", name)
                        .register(registry);
            });
            LOG.info("Executor metrics registered for pools {}", pools.keySet());
        };
    }

    /**
     * Logs a pool summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools.forEach((name, provider) -> {
            ThreadPoolExecutor executor = provider.getObject().getThreadPoolExecutor();
            LOG.info("Pool {}: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }
}
