// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.System.Logger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;

/**
 * A {@link ConnectionManager} backed by one {@link HttpClient} bound to a single address. The client keeps its own
 * keep-alive pool; this manager bounds how many exchanges run at once with a permit count and queues acquisitions
 * beyond that bound in arrival order.
 */
public final class JdkHttpConnectionManager implements ConnectionManager {
    private static final Logger LOGGER = System.getLogger(JdkHttpConnectionManager.class.getName());

    /* The host header names the logical endpoint while the URI names the address, so it must be settable */
    static {
        System.setProperty("jdk.httpclient.allowRestrictedHeaders", "Host,Content-Length");
    }

    private static final String CONTENT_LENGTH = "content-length";

    private final ConnectionManagerOptions options;
    private final HttpClient httpClient;
    private final String baseUri;
    private final Object permitLock = new Object();
    private final Deque<CompletableFuture<Connection>> waiters = new ArrayDeque<>();
    private int leased;
    private boolean closed;

    /**
     * @param options the settings of this manager
     * @param executor runs the client's asynchronous tasks and response callbacks
     */
    public JdkHttpConnectionManager(@NonNull final ConnectionManagerOptions options, @NonNull final Executor executor) {
        this.options = Objects.requireNonNull(options);
        final HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(options.connectTimeout())
                .executor(Objects.requireNonNull(executor));
        if (options.isEncrypted()) {
            final SSLParameters sslParameters = new SSLParameters();
            sslParameters.setServerNames(List.of(new SNIHostName(options.tlsServerName())));
            builder.sslParameters(sslParameters);
        }
        this.httpClient = builder.build();
        final String host = options.address().indexOf(':') >= 0 ? "[" + options.address() + "]" : options.address();
        this.baseUri = (options.isEncrypted() ? "https" : "http") + "://" + host + ":" + options.port();
    }

    /**
     * @param executor shared by every manager the factory creates
     * @return a factory creating managers of this type
     */
    @NonNull
    public static ConnectionManagerFactory factory(@NonNull final Executor executor) {
        Objects.requireNonNull(executor);
        return options -> new JdkHttpConnectionManager(options, executor);
    }

    @NonNull
    @Override
    public CompletableFuture<Connection> acquireConnection() {
        synchronized (permitLock) {
            if (closed) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Connection manager for " + options.address() + " is closed"));
            }
            if (leased < options.maxConnections()) {
                leased++;
                return CompletableFuture.completedFuture(new LeasedConnection());
            }
            final CompletableFuture<Connection> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    @NonNull
    @Override
    public ConnectionManagerOptions options() {
        return options;
    }

    @Override
    public int leasedConnectionCount() {
        synchronized (permitLock) {
            return leased;
        }
    }

    @Override
    public void close() {
        final List<CompletableFuture<Connection>> pending;
        synchronized (permitLock) {
            closed = true;
            pending = List.copyOf(waiters);
            waiters.clear();
        }
        final IllegalStateException closedException =
                new IllegalStateException("Connection manager for " + options.address() + " was closed");
        pending.forEach(waiter -> waiter.completeExceptionally(closedException));
        LOGGER.log(
                DEBUG,
                "Closed connection manager for {0}, {1} acquisitions cancelled",
                options.address(),
                pending.size());
    }

    /**
     * Pass the permit of a returned lease to the oldest waiter, or give it back.
     */
    private void release() {
        CompletableFuture<Connection> next;
        do {
            synchronized (permitLock) {
                next = waiters.pollFirst();
                if (next == null) {
                    leased--;
                    return;
                }
            }
            // a waiter that was cancelled does not take the permit
        } while (!next.complete(new LeasedConnection()));
    }

    private HttpRequest toHttpRequest(final Request request) {
        final RequestBody body = request.body();
        final BodyPublisher publisher;
        if (body == null || body.contentLength() == 0) {
            publisher = BodyPublishers.noBody();
        } else {
            publisher = BodyPublishers.fromPublisher(
                    BodyPublishers.ofInputStream(body::openStream), body.contentLength());
        }
        final HttpRequest.Builder builder =
                HttpRequest.newBuilder(URI.create(baseUri + request.path())).method(request.method(), publisher);
        // the body publisher declares the content length itself
        request.headers().forEach((name, value) -> {
            if (!CONTENT_LENGTH.equals(name)) {
                builder.header(name, value);
            }
        });
        return builder.build();
    }

    /**
     * One lease on the manager's permit count.
     */
    private final class LeasedConnection implements Connection {
        private final AtomicBoolean used = new AtomicBoolean();
        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public boolean isOpen() {
            return !used.get() && !released.get();
        }

        @Nullable
        @Override
        public CompletableFuture<Void> stream(@NonNull final Request request, @NonNull final StreamHandler handler) {
            Objects.requireNonNull(request);
            Objects.requireNonNull(handler);
            if (released.get() || !used.compareAndSet(false, true)) {
                return null;
            }
            final HttpRequest httpRequest;
            try {
                httpRequest = toHttpRequest(request);
            } catch (final IllegalArgumentException e) {
                LOGGER.log(WARNING, "Cannot create a stream for %s: %s".formatted(request, e.getMessage()));
                releaseOnce();
                return null;
            }
            final AtomicInteger status = new AtomicInteger();
            final HttpResponse.BodyHandler<Void> bodyHandler = responseInfo -> {
                status.set(responseInfo.statusCode());
                handler.onResponseHeaders(responseInfo.statusCode(), responseInfo.headers());
                return BodySubscribers.fromSubscriber(new ForwardingSubscriber(handler));
            };
            return httpClient
                    .sendAsync(httpRequest, bodyHandler)
                    .handle((response, error) -> {
                        releaseOnce();
                        handler.onStreamComplete(response != null ? response.statusCode() : status.get(), error);
                        return null;
                    });
        }

        @Override
        public void close() {
            if (used.compareAndSet(false, true)) {
                releaseOnce();
            }
        }

        private void releaseOnce() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }

    /**
     * Hands every body chunk to a {@link StreamHandler}.
     */
    private static final class ForwardingSubscriber implements Flow.Subscriber<List<ByteBuffer>> {
        private final StreamHandler handler;

        private ForwardingSubscriber(final StreamHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onSubscribe(final Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(final List<ByteBuffer> item) {
            for (final ByteBuffer buffer : item) {
                handler.onResponseBody(buffer);
            }
        }

        @Override
        public void onError(final Throwable throwable) {
            // reported through the completion of sendAsync
        }

        @Override
        public void onComplete() {
            // reported through the completion of sendAsync
        }
    }
}
