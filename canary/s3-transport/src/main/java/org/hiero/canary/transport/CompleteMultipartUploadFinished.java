// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of completing a multipart upload.
 */
@FunctionalInterface
public interface CompleteMultipartUploadFinished {
    /**
     * @param error the failure, null once the object is assembled
     */
    void onFinished(@Nullable S3ClientException error);
}
