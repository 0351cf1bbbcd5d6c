// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The settings of one connection manager.
 *
 * @param address the IP address every connection goes to
 * @param port the port every connection goes to
 * @param connectTimeout the socket connect timeout
 * @param tlsServerName the server name indicated in the TLS handshake, null for plain text connections
 * @param maxConnections the maximum number of connections leased at the same time
 */
public record ConnectionManagerOptions(
        @NonNull String address,
        int port,
        @NonNull Duration connectTimeout,
        @Nullable String tlsServerName,
        int maxConnections) {
    /**
     * Constructor.
     */
    public ConnectionManagerOptions {
        Preconditions.requireNotBlank(address);
        Preconditions.requireInRange(port, 1, 65535);
        Preconditions.requirePositive(connectTimeout);
        Preconditions.requirePositive(maxConnections);
    }

    /**
     * @return true if connections use TLS
     */
    public boolean isEncrypted() {
        return tlsServerName != null;
    }
}
