// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.threading;

import static java.lang.System.Logger.Level.ERROR;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The default implementation of the {@link ThreadPoolManager} interface. All threads are daemon platform threads
 * named {@code <prefix>-<n>}. Uncaught exceptions are logged when no handler is supplied.
 */
public final class DefaultThreadPoolManager implements ThreadPoolManager {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(DefaultThreadPoolManager.class.getName());
    /** Handler used when the caller does not provide one. */
    private static final UncaughtExceptionHandler LOGGING_HANDLER =
            (t, e) -> LOGGER.log(ERROR, "Uncaught exception in thread: " + t.getName(), e);

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public ExecutorService createFixedThreadPool(
            @NonNull final String threadName,
            final int threadCount,
            @Nullable final UncaughtExceptionHandler uncaughtExceptionHandler) {
        Preconditions.requireNotBlank(threadName);
        Preconditions.requirePositive(threadCount);
        final ThreadFactory factory = new NamedThreadFactory(
                threadName, uncaughtExceptionHandler == null ? LOGGING_HANDLER : uncaughtExceptionHandler);
        return new ThreadPoolExecutor(
                threadCount, threadCount, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
    }

    /**
     * Thread factory producing named daemon threads.
     */
    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final UncaughtExceptionHandler handler;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(final String prefix, final UncaughtExceptionHandler handler) {
            this.prefix = prefix;
            this.handler = handler;
        }

        @Override
        public Thread newThread(@NonNull final Runnable runnable) {
            final Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(handler);
            return thread;
        }
    }
}
