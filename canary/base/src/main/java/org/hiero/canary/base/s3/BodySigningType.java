// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

/**
 * How the request body takes part in the signature.
 */
public enum BodySigningType {
    /** The body is not hashed, the {@code x-amz-content-sha256} header carries {@code UNSIGNED-PAYLOAD}. */
    UNSIGNED_PAYLOAD,
    /** The SHA-256 of the body is computed and signed. Reads the whole body once before sending. */
    SIGNED_PAYLOAD
}
