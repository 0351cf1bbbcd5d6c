// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.CompletableFuture;

/**
 * A pool of connections to one address.
 */
public interface ConnectionManager extends AutoCloseable {
    /**
     * Lease a connection. When all connections are leased the returned future completes once one is returned.
     *
     * @return a future completing with an exclusive connection, or exceptionally if none can be provided
     */
    @NonNull
    CompletableFuture<Connection> acquireConnection();

    /**
     * @return the options this manager was created with
     */
    @NonNull
    ConnectionManagerOptions options();

    /**
     * @return the number of connections currently leased
     */
    int leasedConnectionCount();

    /**
     * Stop handing out connections. Pending acquisitions fail, leased connections finish their streams.
     */
    @Override
    void close();
}
