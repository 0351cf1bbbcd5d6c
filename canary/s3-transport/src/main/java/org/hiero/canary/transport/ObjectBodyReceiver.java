// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.ByteBuffer;

/**
 * Receives the body of a downloaded object chunk by chunk.
 */
@FunctionalInterface
public interface ObjectBodyReceiver {
    /**
     * @param data the next chunk, only valid during the call
     */
    void onBody(@NonNull ByteBuffer data);
}
