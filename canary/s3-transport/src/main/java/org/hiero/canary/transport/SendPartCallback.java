// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.canary.base.http.RequestBody;
import org.hiero.canary.transport.multipart.TransferState;

/**
 * Supplies the content of upload parts. Called again for every retry of a part.
 */
@FunctionalInterface
public interface SendPartCallback {
    /**
     * @param transferState the part to upload
     * @return the body of the part
     */
    @NonNull
    RequestBody sendPart(@NonNull TransferState transferState);
}
