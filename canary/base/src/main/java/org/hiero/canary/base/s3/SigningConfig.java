// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.Objects;
import org.hiero.canary.common.utils.Preconditions;

/**
 * Everything needed to sign one request.
 *
 * @param region the region the request is signed for
 * @param credentialsProvider the source of the signing key
 * @param service the service name in the credential scope, "s3" for object storage
 * @param bodySigningType whether the body is hashed into the signature
 * @param signingTime the time stamped into the request
 * @param algorithm the signing algorithm
 */
public record SigningConfig(
        @NonNull String region,
        @NonNull CredentialsProvider credentialsProvider,
        @NonNull String service,
        @NonNull BodySigningType bodySigningType,
        @NonNull Instant signingTime,
        @NonNull SigningAlgorithm algorithm) {
    /** The service name of S3. */
    public static final String S3_SERVICE = "s3";

    /**
     * Constructor.
     */
    public SigningConfig {
        Preconditions.requireNotBlank(region, "region is required");
        Objects.requireNonNull(credentialsProvider);
        Preconditions.requireNotBlank(service, "service is required");
        Objects.requireNonNull(bodySigningType);
        Objects.requireNonNull(signingTime);
        Objects.requireNonNull(algorithm);
    }

    /**
     * The configuration every S3 object transport request is signed with: unsigned payload, header based SigV4.
     *
     * @param region the bucket region
     * @param credentialsProvider the source of the signing key
     * @param signingTime the time of signing, usually now
     * @return the signing configuration
     */
    @NonNull
    public static SigningConfig forS3(
            @NonNull final String region,
            @NonNull final CredentialsProvider credentialsProvider,
            @NonNull final Instant signingTime) {
        return new SigningConfig(
                region,
                credentialsProvider,
                S3_SERVICE,
                BodySigningType.UNSIGNED_PAYLOAD,
                signingTime,
                SigningAlgorithm.SIGV4_HEADER);
    }
}
