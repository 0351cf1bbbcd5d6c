// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.dns;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * The DNS record type an address came from.
 */
public enum AddressRecordType {
    /** An IPv4 address. */
    A,
    /** An IPv6 address. */
    AAAA;

    /**
     * @param address a resolved address
     * @return {@link #A} for IPv4 addresses, {@link #AAAA} otherwise
     */
    @NonNull
    public static AddressRecordType of(@NonNull final InetAddress address) {
        return address instanceof Inet4Address ? A : AAAA;
    }
}
