// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

/**
 * Bit flags of {@link S3ObjectTransport#putObject}.
 */
public final class PutObjectFlags {
    /** No flags. */
    public static final int NONE = 0;
    /** Capture the ETag response header and report it on success. A response without ETag is a failure. */
    public static final int RETRIEVE_ETAG = 1;

    private PutObjectFlags() {}

    /**
     * @param flags a combination of flags
     * @param flag the flag to test
     * @return true if the flag is set
     */
    public static boolean isSet(final int flags, final int flag) {
        return (flags & flag) == flag;
    }
}
