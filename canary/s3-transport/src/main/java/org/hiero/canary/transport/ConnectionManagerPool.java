// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.canary.base.config.TransportConfig;
import org.hiero.canary.base.http.ConnectionManager;
import org.hiero.canary.base.http.ConnectionManagerFactory;
import org.hiero.canary.base.http.ConnectionManagerOptions;
import org.hiero.canary.base.s3.ErrorType;
import org.hiero.canary.base.s3.S3TransportException;

/**
 * One connection manager per cached address. Requests pick a manager with a shared use counter, so
 * {@code transfersPerAddress} consecutive requests go to the same address before the next address takes over.
 */
public final class ConnectionManagerPool {
    private static final Logger LOGGER = System.getLogger(ConnectionManagerPool.class.getName());

    private final AddressCache addressCache;
    private final ConnectionManagerFactory factory;
    private final TransportConfig config;
    private final AtomicLong useCount = new AtomicLong();
    private volatile List<ConnectionManager> managers = List.of();

    /**
     * @param addressCache the addresses to spawn managers for
     * @param factory creates the managers
     * @param config supplies port, timeouts, TLS server name and connection ceiling
     */
    public ConnectionManagerPool(
            @NonNull final AddressCache addressCache,
            @NonNull final ConnectionManagerFactory factory,
            @NonNull final TransportConfig config) {
        this.addressCache = Objects.requireNonNull(addressCache);
        this.factory = Objects.requireNonNull(factory);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Discard all managers and create a new one for each cached address.
     */
    public synchronized void spawn() {
        purge();
        final String tlsServerName = config.sendEncrypted() ? config.resolvedEndpoint() : null;
        final List<ConnectionManager> spawned = new ArrayList<>();
        for (final String address : addressCache.addresses()) {
            LOGGER.log(INFO, "Spawning connection manager for address {0}", address);
            spawned.add(factory.create(new ConnectionManagerOptions(
                    address, config.port(), config.connectTimeout(), tlsServerName, config.maxConnections())));
        }
        managers = List.copyOf(spawned);
    }

    /**
     * Close and drop all managers and reset the use counter.
     */
    public synchronized void purge() {
        final List<ConnectionManager> old = managers;
        managers = List.of();
        useCount.set(0);
        old.forEach(ConnectionManager::close);
        if (!old.isEmpty()) {
            LOGGER.log(DEBUG, "Purged {0} connection managers", old.size());
        }
    }

    /**
     * Select the manager for the next request. An empty pool is first filled from a single resolved address.
     *
     * @return the selected manager
     * @throws S3TransportException if the pool was empty and could not be filled
     */
    @NonNull
    public ConnectionManager getNext() throws S3TransportException {
        List<ConnectionManager> current = managers;
        if (current.isEmpty()) {
            current = spawnSingle();
        }
        final long use = useCount.incrementAndGet();
        return current.get((int) ((use / config.transfersPerAddress()) % current.size()));
    }

    /**
     * @return the number of managers
     */
    public int size() {
        return managers.size();
    }

    private synchronized List<ConnectionManager> spawnSingle() throws S3TransportException {
        if (managers.isEmpty()) {
            LOGGER.log(WARNING, "No connection managers spawned, warming the DNS cache with a single address");
            try {
                if (addressCache.isEmpty()) {
                    addressCache.warm(1);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new S3TransportException(
                        ErrorType.RESOLUTION_INCOMPLETE, "Interrupted while resolving " + config.resolvedEndpoint(), e);
            }
            spawn();
        }
        final List<ConnectionManager> current = managers;
        if (current.isEmpty()) {
            throw new S3TransportException(
                    ErrorType.RESOLUTION_INCOMPLETE, "No addresses known for " + config.resolvedEndpoint());
        }
        return current;
    }
}
