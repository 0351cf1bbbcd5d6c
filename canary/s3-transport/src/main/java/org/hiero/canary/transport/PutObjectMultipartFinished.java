// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of a multipart upload.
 */
@FunctionalInterface
public interface PutObjectMultipartFinished {
    /**
     * @param error the failure, null on success
     * @param numParts the number of parts the upload was started with, also on failure
     */
    void onFinished(@Nullable S3ClientException error, int numParts);
}
