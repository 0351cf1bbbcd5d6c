// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.hiero.canary.base.dns.AddressRecordType;
import org.hiero.canary.base.dns.HostAddress;
import org.hiero.canary.base.dns.HostResolver;
import org.hiero.canary.base.metrics.MetricName;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The IPv4 addresses of the endpoint that connection managers are spawned for. The list is replaced as a whole, so a
 * reader sees either the old or the new list, never a partial one. Warming and spawning must still not overlap, as a
 * spawn during a warm may see the old list.
 */
public final class AddressCache {
    private static final Logger LOGGER = System.getLogger(AddressCache.class.getName());

    private final String endpoint;
    private final HostResolver hostResolver;
    private final MetricsPublisher metrics;
    private final int transfersPerAddress;
    private final Duration pollInterval;
    private volatile List<String> addresses = List.of();

    /**
     * @param endpoint the host name to resolve
     * @param hostResolver resolves and caches the endpoint's addresses
     * @param metrics receives the address count on every poll
     * @param transfersPerAddress how many consecutive transfers share one address
     * @param pollInterval the wait between address count polls
     */
    public AddressCache(
            @NonNull final String endpoint,
            @NonNull final HostResolver hostResolver,
            @NonNull final MetricsPublisher metrics,
            final int transfersPerAddress,
            @NonNull final Duration pollInterval) {
        this.endpoint = Preconditions.requireNotBlank(endpoint);
        this.hostResolver = Objects.requireNonNull(hostResolver);
        this.metrics = Objects.requireNonNull(metrics);
        this.transfersPerAddress = Preconditions.requirePositive(transfersPerAddress);
        this.pollInterval = Preconditions.requirePositive(pollInterval);
    }

    /**
     * @param numTransfers the number of concurrent transfers planned
     * @param transfersPerAddress how many transfers share one address
     * @return the number of addresses needed, {@code ceil(numTransfers / transfersPerAddress)}
     */
    public static int desiredAddressCount(final int numTransfers, final int transfersPerAddress) {
        Preconditions.requirePositive(transfersPerAddress);
        return (int) ((Preconditions.requireWhole(numTransfers) + transfersPerAddress - 1L) / transfersPerAddress);
    }

    /**
     * Block until enough addresses for the given number of transfers are known, then refill this cache with them.
     * There is no timeout: if the endpoint never resolves to enough addresses this method does not return.
     *
     * @param numTransfers the number of concurrent transfers planned, must be positive
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void warm(final int numTransfers) throws InterruptedException {
        final int desired = desiredAddressCount(Preconditions.requirePositive(numTransfers), transfersPerAddress);
        LOGGER.log(INFO, "Warming DNS cache for {0}, {1} addresses wanted", endpoint, desired);
        CompletableFuture<List<HostAddress>> resolution = resolveAsync();
        while (true) {
            final int count = hostResolver.getHostAddressCount(endpoint, AddressRecordType.A);
            emitAddressCountMetric(count);
            if (count >= desired) {
                break;
            }
            Thread.sleep(pollInterval.toMillis());
            if (resolution.isDone()) {
                resolution = resolveAsync();
            }
        }

        final List<String> refilled = new ArrayList<>(desired);
        while (refilled.size() < desired) {
            try {
                for (final HostAddress address : hostResolver.resolve(endpoint).get()) {
                    // repeated addresses are kept, each entry carries its own share of transfers
                    if (address.recordType() == AddressRecordType.A) {
                        refilled.add(address.address());
                    }
                }
            } catch (final ExecutionException e) {
                LOGGER.log(WARNING, "Resolving %s failed, retrying".formatted(endpoint), e.getCause());
                Thread.sleep(pollInterval.toMillis());
            }
        }
        addresses = List.copyOf(refilled);
        LOGGER.log(INFO, "DNS cache for {0} warmed with {1} addresses", endpoint, refilled.size());
    }

    /**
     * Replace the cache with one fixed address, skipping resolution.
     *
     * @param address the address to use for every transfer
     */
    public void seed(@NonNull final String address) {
        addresses = List.of(Preconditions.requireNotBlank(address));
        LOGGER.log(INFO, "Address cache for {0} seeded with {1}", endpoint, address);
    }

    /**
     * @param transferIndex the index of a transfer
     * @return the address the transfer uses, {@code (transferIndex / transfersPerAddress) mod size}
     * @throws IllegalStateException if the cache is empty
     */
    @NonNull
    public String addressForTransfer(final int transferIndex) {
        Preconditions.requireWhole(transferIndex);
        final List<String> current = addresses;
        if (current.isEmpty()) {
            throw new IllegalStateException("Address cache for " + endpoint + " is empty");
        }
        return current.get((transferIndex / transfersPerAddress) % current.size());
    }

    /**
     * @return a snapshot of the cached addresses, in resolution order
     */
    @NonNull
    public List<String> addresses() {
        return addresses;
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }

    /**
     * Publish an address count data point.
     *
     * @param count the number of addresses known
     */
    public void emitAddressCountMetric(final int count) {
        LOGGER.log(INFO, "Emitting S3 address count metric: {0}", count);
        metrics.addDataPoint(MetricName.S3_ADDRESS_COUNT, count);
    }

    private CompletableFuture<List<HostAddress>> resolveAsync() {
        final CompletableFuture<List<HostAddress>> resolution = hostResolver.resolve(endpoint);
        resolution.whenComplete((result, error) -> {
            if (error != null) {
                LOGGER.log(WARNING, "Resolving %s failed".formatted(endpoint), error);
            }
        });
        return resolution;
    }
}
