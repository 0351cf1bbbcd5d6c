// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The state of one multipart upload. ETags are stored by part index, so the order parts finish in does not matter.
 */
public final class MultipartUploadState extends MultipartTransferState {
    private final long objectSize;
    private final AtomicReferenceArray<String> etags;
    private volatile String uploadId;

    /**
     * @param key the object key
     * @param objectSize the size of the whole object in bytes
     * @param numParts the number of parts
     * @param metrics receives the part byte counts
     */
    public MultipartUploadState(
            @NonNull final String key,
            final long objectSize,
            final int numParts,
            @NonNull final MetricsPublisher metrics) {
        super(key, numParts, metrics);
        this.objectSize = Preconditions.requireWhole(objectSize);
        this.etags = new AtomicReferenceArray<>(numParts);
    }

    public long objectSize() {
        return objectSize;
    }

    /**
     * @param partIndex the 0-based part index
     * @param etag the ETag the part was stored with
     * @throws IllegalStateException if the part already has an ETag
     */
    public void setETag(final int partIndex, @NonNull final String etag) {
        Preconditions.requireNotBlank(etag);
        if (!etags.compareAndSet(partIndex, null, etag)) {
            throw new IllegalStateException("ETag of part " + (partIndex + 1) + " of " + key() + " is already set");
        }
    }

    /**
     * @return the ETags in part order, null for parts not uploaded yet
     */
    @NonNull
    public List<String> getETags() {
        final List<String> result = new ArrayList<>(etags.length());
        for (int i = 0; i < etags.length(); i++) {
            result.add(etags.get(i));
        }
        return result;
    }

    /**
     * @return the upload id, null until the upload was created
     */
    @Nullable
    public String uploadId() {
        return uploadId;
    }

    public void setUploadId(@NonNull final String uploadId) {
        this.uploadId = Preconditions.requireNotBlank(uploadId);
    }
}
