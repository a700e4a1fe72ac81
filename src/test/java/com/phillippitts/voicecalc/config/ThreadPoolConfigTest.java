package com.phillippitts.voicecalc.config;

import com.phillippitts.voicecalc.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void captureExecutorUsesDefaults() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.captureExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(2);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("voice-capture-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void captureExecutorRejectsInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.captureExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            Runnable blocker = () -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            executor.execute(blocker);
            executor.execute(blocker);

            assertThatThrownBy(() -> executor.execute(blocker)).isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void streamExecutorNamesItsThread() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.streamExecutor();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("voice-stream-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void threadContextIsPropagatedAndRestored() {
        ThreadContext.put("voiceSession", "ab12cd34");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable decorated = ThreadPoolConfig.threadContextPropagator().decorate(
                () -> seen.set(ThreadContext.get("voiceSession")));
        ThreadContext.clearAll();
        ThreadContext.put("other", "kept");

        decorated.run();

        assertThat(seen.get()).isEqualTo("ab12cd34");
        assertThat(ThreadContext.get("voiceSession")).isNull();
        assertThat(ThreadContext.get("other")).isEqualTo("kept");
    }
}
