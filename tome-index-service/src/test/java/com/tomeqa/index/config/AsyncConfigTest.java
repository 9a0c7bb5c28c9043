package com.tomeqa.index.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncConfigTest {

    private final AsyncConfig config = new AsyncConfig();

    @Test
    @DisplayName("Should reject rebuilds once the rebuild queue is full")
    void shouldRejectBeyondRebuildQueue() throws Exception {
        ThreadPoolTaskExecutor executor = config.rebuildExecutor(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();
        try {
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                started.countDown();
                await(release);
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            executor.execute(() -> { });

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(threadName.get()).startsWith("rebuild-");
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Should run overflowing embed batches on the submitting thread")
    void shouldRunEmbedOverflowOnCaller() throws Exception {
        ThreadPoolTaskExecutor executor = config.embedExecutor(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> overflowThread = new AtomicReference<>();
        try {
            executor.execute(() -> {
                started.countDown();
                await(release);
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            executor.execute(() -> { });

            executor.execute(() -> overflowThread.set(Thread.currentThread().getName()));

            assertThat(overflowThread.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
