// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.canary.base.s3.S3ClientException;

/**
 * Receives the result of a download.
 */
@FunctionalInterface
public interface GetObjectFinished {
    /**
     * @param error the failure, null on success
     */
    void onFinished(@Nullable S3ClientException error);
}
