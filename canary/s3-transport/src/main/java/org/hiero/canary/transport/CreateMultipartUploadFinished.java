// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of creating a multipart upload.
 */
@FunctionalInterface
public interface CreateMultipartUploadFinished {
    /**
     * @param error the failure, null on success
     * @param uploadId the id of the new upload, non-blank on success and null on failure
     */
    void onFinished(@Nullable S3ClientException error, @Nullable String uploadId);
}
