// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.ByteBuffer;
import org.hiero.canary.transport.multipart.TransferState;

/**
 * Receives the content of download parts. A retried part delivers its content again from the start.
 */
@FunctionalInterface
public interface ReceivePartCallback {
    /**
     * @param transferState the part the chunk belongs to
     * @param data the next chunk, only valid during the call
     */
    void receivePart(@NonNull TransferState transferState, @NonNull ByteBuffer data);
}
