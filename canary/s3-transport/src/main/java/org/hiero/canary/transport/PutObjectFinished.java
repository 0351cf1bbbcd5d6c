// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of a single object upload.
 */
@FunctionalInterface
public interface PutObjectFinished {
    /**
     * @param error the failure, null on success
     * @param etag the ETag of the stored object, only reported on success with {@link PutObjectFlags#RETRIEVE_ETAG}
     */
    void onFinished(@Nullable S3ClientException error, @Nullable String etag);
}
