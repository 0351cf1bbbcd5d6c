// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A checked exception thrown when an S3 request fails before or below the HTTP status, or when a successful
 * response is missing metadata the operation depends on.
 */
public final class S3TransportException extends S3ClientException {
    /**
     * {@inheritDoc}
     */
    public S3TransportException(@NonNull final ErrorType errorType, final String message) {
        super(errorType, message);
    }

    /**
     * {@inheritDoc}
     */
    public S3TransportException(@NonNull final ErrorType errorType, final String message, final Throwable cause) {
        super(errorType, message, cause);
    }

    @Override
    public String toString() {
        return getClass().getName() + "[" + errorType() + "]: " + getLocalizedMessage();
    }
}
