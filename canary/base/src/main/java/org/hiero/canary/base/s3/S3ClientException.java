// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A checked exception to act as a base for all S3 client exceptions. Every instance knows the {@link ErrorType}
 * that caused it.
 */
public class S3ClientException extends Exception {
    private final ErrorType errorType;

    /**
     * @param errorType the kind of failure
     * @param message the detail message
     */
    public S3ClientException(@NonNull final ErrorType errorType, final String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType);
    }

    /**
     * @param errorType the kind of failure
     * @param message the detail message
     * @param cause the underlying cause
     */
    public S3ClientException(@NonNull final ErrorType errorType, final String message, final Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType);
    }

    /**
     * @return the kind of failure
     */
    @NonNull
    public ErrorType errorType() {
        return errorType;
    }
}
