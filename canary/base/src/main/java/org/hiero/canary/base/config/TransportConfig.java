// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.config;

import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import org.hiero.canary.base.Loggable;
import org.hiero.canary.common.utils.Preconditions;
import org.hiero.canary.common.utils.StringUtilities;

/**
 * Configuration for the S3 object transport.
 *
 * @param bucketName the bucket every transfer targets
 * @param regionName the region of the bucket, also used for request signing (e.g. us-east-1)
 * @param endpoint the logical endpoint hostname, blank to derive {@code <bucket>.s3.<region>.amazonaws.com}
 * @param sendEncrypted connect on port 443 with TLS when true, on port 80 in plain text otherwise
 * @param transfersPerAddress how many consecutive transfers share one resolved address
 * @param maxStreams the ceiling of concurrently in-flight part streams per part processor
 * @param maxConnections the ceiling of pooled connections per connection manager
 * @param connectTimeout the socket connect timeout of every connection manager
 * @param dnsPollInterval the interval between address count polls while warming the DNS cache
 * @param maxPartRetries how many times one part may be retried before its transfer fails, 0 for unbounded
 * @param seedAddress a fixed address to seed the address cache with instead of resolving, blank for none
 * @param workerThreads the number of threads dispatching part work
 */
@ConfigSection("canary.transport")
public record TransportConfig(
        @Loggable @NonNull String bucketName,
        @Loggable @NonNull String regionName,
        @Loggable @NonNull String endpoint,
        @Loggable boolean sendEncrypted,
        @Loggable int transfersPerAddress,
        @Loggable int maxStreams,
        @Loggable int maxConnections,
        @Loggable @NonNull Duration connectTimeout,
        @Loggable @NonNull Duration dnsPollInterval,
        @Loggable int maxPartRetries,
        @Loggable @NonNull String seedAddress,
        @Loggable int workerThreads) {
    /** The config path this record is read from. */
    public static final String PATH = "canary.transport";

    /**
     * Constructor.
     */
    public TransportConfig {
        Preconditions.requireNotBlank(bucketName, "bucketName is required");
        Preconditions.requireNotBlank(regionName, "regionName is required");
        endpoint = Objects.requireNonNullElse(endpoint, StringUtilities.EMPTY);
        Preconditions.requirePositive(transfersPerAddress);
        Preconditions.requirePositive(maxStreams);
        Preconditions.requirePositive(maxConnections);
        Preconditions.requirePositive(connectTimeout);
        Preconditions.requirePositive(dnsPollInterval);
        Preconditions.requireWhole(maxPartRetries);
        seedAddress = Objects.requireNonNullElse(seedAddress, StringUtilities.EMPTY);
        Preconditions.requirePositive(workerThreads);
    }

    /**
     * Read the transport configuration from the {@value #PATH} section of the given configuration.
     *
     * @param config the loaded configuration, usually {@code ConfigFactory.load()}
     * @return the transport configuration
     */
    @NonNull
    public static TransportConfig from(@NonNull final Config config) {
        final Config section = config.getConfig(PATH);
        return new TransportConfig(
                section.getString("bucketName"),
                section.getString("regionName"),
                section.getString("endpoint"),
                section.getBoolean("sendEncrypted"),
                section.getInt("transfersPerAddress"),
                section.getInt("maxStreams"),
                section.getInt("maxConnections"),
                section.getDuration("connectTimeout"),
                section.getDuration("dnsPollInterval"),
                section.getInt("maxPartRetries"),
                section.getString("seedAddress"),
                section.getInt("workerThreads"));
    }

    /**
     * @return the logical endpoint hostname of the bucket
     */
    @NonNull
    public String resolvedEndpoint() {
        if (StringUtilities.isBlank(endpoint)) {
            return bucketName + ".s3." + regionName + ".amazonaws.com";
        }
        return endpoint;
    }

    /**
     * @return the port connections are made on
     */
    public int port() {
        return sendEncrypted ? 443 : 80;
    }
}
