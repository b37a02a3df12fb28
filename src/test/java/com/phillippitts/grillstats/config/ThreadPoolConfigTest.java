package com.phillippitts.grillstats.config;

import com.phillippitts.grillstats.config.properties.PollingProperties;
import com.phillippitts.grillstats.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties(), new PollingProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsFromDefaults() {
        ThreadPoolTaskExecutor poll = config.pollExecutor();
        ThreadPoolTaskExecutor dispatch = config.dispatchExecutor();
        try {
            assertThat(poll.getCorePoolSize()).isEqualTo(4);
            assertThat(poll.getMaxPoolSize()).isEqualTo(16);
            assertThat(poll.getThreadNamePrefix()).isEqualTo("poll-pool-");
            assertThat(dispatch.getThreadNamePrefix()).isEqualTo("dispatch-pool-");
        } finally {
            poll.shutdown();
            dispatch.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.historyExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        String[] seen = new String[2];

        ThreadContext.put("deviceId", "smoker-1");
        executor.execute(() -> {
            seen[0] = ThreadContext.get("deviceId");
            seen[1] = Thread.currentThread().getName();
            latch.countDown();
        });
        ThreadContext.clearAll();

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen[0]).isEqualTo("smoker-1");
        assertThat(seen[1]).startsWith("history-pool-");
        executor.shutdown();
    }

    @Test
    void shouldRejectWhenPollPoolIsSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setPoll(new ThreadPoolProperties.PoolProperties(1, 1, 1, "tiny-"));
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties, new PollingProperties()).pollExecutor();
        CountDownLatch block = new CountDownLatch(1);
        try {
            executor.execute(() -> awaitQuietly(block));
            executor.execute(() -> awaitQuietly(block));

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            block.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldSizeSchedulerFromPollingProperties() {
        PollingProperties polling = new PollingProperties();
        polling.setSchedulerPoolSize(3);
        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties(), polling).pollScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(3);
        } finally {
            scheduler.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
