// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.dns;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves host names and keeps the results cached.
 */
public interface HostResolver {
    /**
     * Resolve a host asynchronously. The result holds the addresses currently cached for the host, including those
     * of earlier resolutions that are still valid.
     *
     * @param host the host name
     * @return a future completing with the cached addresses, or exceptionally if resolution failed
     */
    @NonNull
    CompletableFuture<List<HostAddress>> resolve(@NonNull String host);

    /**
     * @param host the host name
     * @param recordType the record type to count
     * @return the number of addresses of the given type currently cached for the host, never blocks
     */
    int getHostAddressCount(@NonNull String host, @NonNull AddressRecordType recordType);
}
