// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of a multipart download.
 */
@FunctionalInterface
public interface GetObjectMultipartFinished {
    /**
     * @param error the failure, null once every part was received
     */
    void onFinished(@Nullable S3ClientException error);
}
