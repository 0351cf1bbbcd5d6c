// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

/**
 * The outcome a part operation reports to its {@link MultipartTransferProcessor}.
 */
public enum PartFinishResponse {
    /** The part landed, it is retired. */
    DONE,
    /** The part failed, it is queued again. */
    RETRY
}
