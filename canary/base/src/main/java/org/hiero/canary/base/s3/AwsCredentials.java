// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.canary.common.utils.Preconditions;

/**
 * An access key pair used to sign requests.
 *
 * @param accessKey the access key id
 * @param secretKey the secret access key
 */
public record AwsCredentials(@NonNull String accessKey, @NonNull String secretKey) {
    /**
     * Constructor.
     */
    public AwsCredentials {
        Preconditions.requireNotBlank(accessKey, "accessKey is required");
        Preconditions.requireNotBlank(secretKey, "secretKey is required");
    }

    @Override
    public String toString() {
        return "AwsCredentials[accessKey=" + accessKey + ", secretKey=*****]";
    }
}
