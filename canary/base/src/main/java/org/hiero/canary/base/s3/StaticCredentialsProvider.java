// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.hiero.canary.base.config.CredentialsConfig;

/**
 * A {@link CredentialsProvider} that always answers with the same credentials.
 */
public final class StaticCredentialsProvider implements CredentialsProvider {
    private final CompletableFuture<AwsCredentials> credentials;

    /**
     * @param credentials the credentials to hand out
     */
    public StaticCredentialsProvider(@NonNull final AwsCredentials credentials) {
        this.credentials = CompletableFuture.completedFuture(Objects.requireNonNull(credentials));
    }

    /**
     * Create a provider from configuration.
     *
     * @param config the credentials configuration, must be complete
     * @return a provider handing out the configured key pair
     * @throws IllegalStateException if the configuration lacks a key
     */
    @NonNull
    public static StaticCredentialsProvider from(@NonNull final CredentialsConfig config) {
        if (!config.isComplete()) {
            throw new IllegalStateException(
                    "Credentials are not configured, set canary.credentials or "
                            + "AWS_ACCESS_KEY_ID and AWS_SECRET_ACCESS_KEY");
        }
        return new StaticCredentialsProvider(new AwsCredentials(config.accessKey(), config.secretKey()));
    }

    @NonNull
    @Override
    public CompletableFuture<AwsCredentials> getCredentials() {
        // a copy so callers cannot complete or cancel the shared instance
        return credentials.copy();
    }
}
