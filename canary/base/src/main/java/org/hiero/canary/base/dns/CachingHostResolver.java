// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.dns;

import static java.lang.System.Logger.Level.DEBUG;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.System.Logger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.hiero.canary.common.utils.Preconditions;

/**
 * A {@link HostResolver} that looks hosts up with the platform resolver and accumulates every distinct address it has
 * seen per host. Load balanced endpoints answer each query with a few addresses out of a larger set, so repeated
 * resolutions grow the cache until enough distinct addresses are known.
 */
public final class CachingHostResolver implements HostResolver {
    private static final Logger LOGGER = System.getLogger(CachingHostResolver.class.getName());

    /**
     * The blocking lookup used by the resolver.
     */
    @FunctionalInterface
    public interface AddressLookup {
        /**
         * @param host the host name
         * @return all addresses of the host
         * @throws UnknownHostException if the host cannot be resolved
         */
        InetAddress[] lookup(String host) throws UnknownHostException;
    }

    private final Executor executor;
    private final AddressLookup addressLookup;
    private final Map<String, Set<HostAddress>> cache = new ConcurrentHashMap<>();

    /**
     * Create a resolver using {@link InetAddress#getAllByName(String)}.
     *
     * @param executor runs the blocking lookups
     */
    public CachingHostResolver(@NonNull final Executor executor) {
        this(executor, InetAddress::getAllByName);
    }

    /**
     * @param executor runs the blocking lookups
     * @param addressLookup the lookup to use
     */
    public CachingHostResolver(@NonNull final Executor executor, @NonNull final AddressLookup addressLookup) {
        this.executor = Objects.requireNonNull(executor);
        this.addressLookup = Objects.requireNonNull(addressLookup);
    }

    @NonNull
    @Override
    public CompletableFuture<List<HostAddress>> resolve(@NonNull final String host) {
        Preconditions.requireNotBlank(host);
        return CompletableFuture.supplyAsync(
                () -> {
                    final InetAddress[] addresses;
                    try {
                        addresses = addressLookup.lookup(host);
                    } catch (final UnknownHostException e) {
                        throw new CompletionException(e);
                    }
                    final Set<HostAddress> known = cache.computeIfAbsent(host, h -> new LinkedHashSet<>());
                    synchronized (known) {
                        for (final InetAddress address : addresses) {
                            known.add(new HostAddress(host, address.getHostAddress(), AddressRecordType.of(address)));
                        }
                        LOGGER.log(DEBUG, "Resolved {0}, {1} distinct addresses known", host, known.size());
                        return List.copyOf(known);
                    }
                },
                executor);
    }

    @Override
    public int getHostAddressCount(@NonNull final String host, @NonNull final AddressRecordType recordType) {
        final Set<HostAddress> known = cache.get(host);
        if (known == null) {
            return 0;
        }
        synchronized (known) {
            return (int) known.stream()
                    .filter(address -> address.recordType() == recordType)
                    .count();
        }
    }
}
