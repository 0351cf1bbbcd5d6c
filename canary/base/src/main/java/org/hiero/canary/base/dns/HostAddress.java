// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.dns;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.canary.common.utils.Preconditions;

/**
 * One resolved address of a host.
 *
 * @param host the host name that was resolved
 * @param address the textual IP address
 * @param recordType the record type of the address
 */
public record HostAddress(@NonNull String host, @NonNull String address, @NonNull AddressRecordType recordType) {
    /**
     * Constructor.
     */
    public HostAddress {
        Preconditions.requireNotBlank(host);
        Preconditions.requireNotBlank(address);
        Objects.requireNonNull(recordType);
    }
}
