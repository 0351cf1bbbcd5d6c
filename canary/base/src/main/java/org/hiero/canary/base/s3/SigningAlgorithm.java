// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

/**
 * The supported request signing algorithms.
 */
public enum SigningAlgorithm {
    /** Signature version 4 carried in the {@code Authorization} header. */
    SIGV4_HEADER
}
