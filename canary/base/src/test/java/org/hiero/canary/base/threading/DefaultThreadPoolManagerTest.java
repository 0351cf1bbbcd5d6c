// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.threading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DefaultThreadPoolManager}.
 */
class DefaultThreadPoolManagerTest {
    private final ThreadPoolManager manager = new DefaultThreadPoolManager();

    /**
     * This test aims to verify that pool threads are named daemons carrying the given exception handler.
     */
    @Test
    @DisplayName("Threads are named daemons")
    void testThreadProperties() throws Exception {
        final Thread.UncaughtExceptionHandler handler = (t, e) -> {};
        final ExecutorService executor = manager.createFixedThreadPool("s3-parts", 2, handler);
        try {
            final CompletableFuture<Thread> thread = CompletableFuture.supplyAsync(Thread::currentThread, executor);
            final Thread worker = thread.get(5, TimeUnit.SECONDS);
            assertThat(worker.getName()).startsWith("s3-parts-");
            assertThat(worker.isDaemon()).isTrue();
            assertThat(worker.getUncaughtExceptionHandler()).isSameAs(handler);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * This test aims to verify that invalid arguments are rejected.
     */
    @Test
    @DisplayName("Invalid arguments")
    void testInvalidArguments() {
        assertThatIllegalArgumentException().isThrownBy(() -> manager.createFixedThreadPool(" ", 1));
        assertThatIllegalArgumentException().isThrownBy(() -> manager.createFixedThreadPool("pool", 0));
    }
}
