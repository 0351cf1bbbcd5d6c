// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.CompletableFuture;
import org.hiero.canary.base.http.Request;

/**
 * Signs outbound requests.
 */
@FunctionalInterface
public interface RequestSigner {
    /**
     * Sign a request. The given request is not modified.
     *
     * @param request the request to sign, must carry a {@code host} header
     * @param signingConfig how to sign it
     * @return a future completing with a signed copy of the request, or exceptionally if signing failed
     */
    @NonNull
    CompletableFuture<Request> sign(@NonNull Request request, @NonNull SigningConfig signingConfig);
}
