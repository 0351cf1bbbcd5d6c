// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.threading;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * An interface that defines a manager for creating thread pools. Components that need threads ask the manager
 * instead of building executors themselves, so tests can hand them a direct or mocked implementation.
 */
public interface ThreadPoolManager {
    /**
     * Factory method. Creates a new, named, fixed size {@link ExecutorService}.
     *
     * @param threadName the thread name prefix, must not be blank
     * @param threadCount the number of threads in the pool, must be positive
     * @return a new fixed thread pool executor service
     */
    @NonNull
    default ExecutorService createFixedThreadPool(@NonNull final String threadName, final int threadCount) {
        return createFixedThreadPool(Objects.requireNonNull(threadName), threadCount, null);
    }

    /**
     * Factory method. Creates a new fixed size {@link ExecutorService} using the name provided and the specified
     * {@link Thread.UncaughtExceptionHandler}, if not null.
     *
     * @param threadName the thread name prefix, must not be blank
     * @param threadCount the number of threads in the pool, must be positive
     * @param uncaughtExceptionHandler the uncaught exception handler, nullable
     * @return a new fixed thread pool executor service
     */
    @NonNull
    ExecutorService createFixedThreadPool(
            @NonNull final String threadName,
            final int threadCount,
            @Nullable final Thread.UncaughtExceptionHandler uncaughtExceptionHandler);
}
