// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.canary.base.metrics.MetricsPublisher;

/**
 * The state of one multipart download.
 */
public final class MultipartDownloadState extends MultipartTransferState {
    /**
     * @param key the object key
     * @param numParts the number of parts
     * @param metrics receives the part byte counts
     */
    public MultipartDownloadState(
            @NonNull final String key,
            final int numParts,
            @NonNull final MetricsPublisher metrics) {
        super(key, numParts, metrics);
    }
}
