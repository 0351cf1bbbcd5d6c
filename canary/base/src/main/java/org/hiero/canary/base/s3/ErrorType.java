// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

/**
 * The reason an S3 operation failed. Callers decide pass or fail on the presence of an error alone; the type is
 * diagnostic detail for logs and metrics.
 */
public enum ErrorType {
    /** The request could not be signed. */
    SIGNING_FAILURE,
    /** No open connection could be acquired from the connection manager. */
    CONNECTION_ACQUIRE_FAILURE,
    /** A connection was acquired but no stream could be opened on it. */
    STREAM_CREATE_FAILURE,
    /** The stream completed with a status code other than the expected one. */
    UNEXPECTED_STATUS,
    /** The response lacked metadata the operation needs, such as an ETag or an UploadId. */
    MISSING_RESPONSE_METADATA,
    /** Host resolution could not produce the requested addresses. */
    RESOLUTION_INCOMPLETE,
    /** The stream failed below HTTP, e.g. a reset connection or a timeout. */
    TRANSPORT_FAILURE,
    /** A part of a multipart transfer failed more often than the configured retry limit allows. */
    RETRIES_EXHAUSTED
}
