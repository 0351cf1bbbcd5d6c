// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.CompletableFuture;

/**
 * A source of credentials for request signing. Lookups may be asynchronous, e.g. when credentials are fetched from an
 * instance metadata service.
 */
@FunctionalInterface
public interface CredentialsProvider {
    /**
     * @return a future completing with the credentials, or exceptionally if none are available
     */
    @NonNull
    CompletableFuture<AwsCredentials> getCredentials();
}
