// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * An exclusive lease on one pooled connection of a {@link ConnectionManager}. A lease carries at most one stream.
 * It returns to its manager when that stream completes, or when {@link #close()} is called if no stream was made.
 */
public interface Connection extends AutoCloseable {
    /**
     * @return true if the connection can carry a stream
     */
    boolean isOpen();

    /**
     * Send a request on this connection.
     *
     * @param request the request to send
     * @param handler receives the response events
     * @return a future completing after {@link StreamHandler#onStreamComplete(int, Throwable)} returned, or null if no
     *     stream could be created, in which case the handler is never called
     */
    @Nullable
    CompletableFuture<Void> stream(@NonNull Request request, @NonNull StreamHandler handler);

    /**
     * Return the lease to its manager. Has no effect once a stream was created or the lease was already returned.
     */
    @Override
    void close();
}
