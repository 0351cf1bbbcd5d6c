// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import static java.lang.System.Logger.Level.ERROR;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.System.Logger;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.hiero.canary.base.http.Connection;
import org.hiero.canary.base.http.ConnectionManager;
import org.hiero.canary.base.http.Request;
import org.hiero.canary.base.http.StreamHandler;
import org.hiero.canary.base.s3.CredentialsProvider;
import org.hiero.canary.base.s3.ErrorType;
import org.hiero.canary.base.s3.RequestSigner;
import org.hiero.canary.base.s3.S3ClientException;
import org.hiero.canary.base.s3.S3TransportException;
import org.hiero.canary.base.s3.SigningConfig;

/**
 * Signs a request, acquires a connection from the pool and streams the request on it. The number of streams in
 * flight is tracked from just before a stream is created until it completes.
 */
public final class SignedRequestPipeline {
    private static final Logger LOGGER = System.getLogger(SignedRequestPipeline.class.getName());

    /**
     * Told whether a request made it onto a connection.
     */
    @FunctionalInterface
    public interface RequestIssuedCallback {
        /**
         * Called exactly once per request. When the error is null the stream was created and its outcome arrives
         * through the stream handler; otherwise the stream handler is never called.
         *
         * @param connection the connection the request went out on, null if none was acquired
         * @param error the reason the request was not sent, null if it was
         */
        void onRequestIssued(@Nullable Connection connection, @Nullable S3ClientException error);
    }

    private final String region;
    private final CredentialsProvider credentialsProvider;
    private final RequestSigner signer;
    private final ConnectionManagerPool pool;
    private final Clock clock;
    private final AtomicInteger activeRequests = new AtomicInteger();

    /**
     * @param region the region requests are signed for
     * @param credentialsProvider the signing key source
     * @param signer signs every request
     * @param pool selects the connection manager for every request
     * @param clock supplies the signing time
     */
    public SignedRequestPipeline(
            @NonNull final String region,
            @NonNull final CredentialsProvider credentialsProvider,
            @NonNull final RequestSigner signer,
            @NonNull final ConnectionManagerPool pool,
            @NonNull final Clock clock) {
        this.region = Objects.requireNonNull(region);
        this.credentialsProvider = Objects.requireNonNull(credentialsProvider);
        this.signer = Objects.requireNonNull(signer);
        this.pool = Objects.requireNonNull(pool);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Sign and send a request.
     *
     * @param request the unsigned request
     * @param handler receives the response events once the stream is created
     * @param callback told whether the request went out
     */
    public void makeSignedRequest(
            @NonNull final Request request,
            @NonNull final StreamHandler handler,
            @NonNull final RequestIssuedCallback callback) {
        final SigningConfig signingConfig = SigningConfig.forS3(region, credentialsProvider, clock.instant());
        CompletableFuture<Request> signing;
        try {
            signing = signer.sign(request, signingConfig);
        } catch (final RuntimeException e) {
            signing = CompletableFuture.failedFuture(e);
        }
        signing.whenComplete((signed, error) -> {
            if (error != null) {
                final Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                LOGGER.log(ERROR, "Signing %s failed".formatted(request), cause);
                callback.onRequestIssued(
                        null,
                        new S3TransportException(ErrorType.SIGNING_FAILURE, "Signing " + request + " failed", cause));
            } else {
                acquireAndSend(signed, handler, callback);
            }
        });
    }

    /**
     * @return the number of streams in flight
     */
    public int getActiveRequestCount() {
        return activeRequests.get();
    }

    private void acquireAndSend(
            final Request signed, final StreamHandler handler, final RequestIssuedCallback callback) {
        final ConnectionManager manager;
        try {
            manager = pool.getNext();
        } catch (final S3TransportException e) {
            callback.onRequestIssued(null, e);
            return;
        }
        manager.acquireConnection().whenComplete((connection, error) -> {
            if (error != null || connection == null || !connection.isOpen()) {
                if (connection != null) {
                    connection.close();
                }
                callback.onRequestIssued(
                        null,
                        new S3TransportException(
                                ErrorType.CONNECTION_ACQUIRE_FAILURE,
                                "No connection to " + manager.options().address() + " for " + signed,
                                error));
                return;
            }
            activeRequests.incrementAndGet();
            CompletableFuture<Void> stream;
            try {
                stream = connection.stream(signed, new CountingStreamHandler(handler));
            } catch (final RuntimeException e) {
                LOGGER.log(ERROR, "Creating a stream for %s failed".formatted(signed), e);
                stream = null;
            }
            if (stream == null) {
                activeRequests.decrementAndGet();
                connection.close();
                LOGGER.log(ERROR, "Unable to open stream for S3ObjectTransport operation.");
                callback.onRequestIssued(
                        connection,
                        new S3TransportException(
                                ErrorType.STREAM_CREATE_FAILURE, "Unable to open stream for " + signed));
                return;
            }
            callback.onRequestIssued(connection, null);
        });
    }

    /**
     * Releases the active request count before the caller sees the stream complete.
     */
    private final class CountingStreamHandler implements StreamHandler {
        private final StreamHandler delegate;

        private CountingStreamHandler(final StreamHandler delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onResponseHeaders(final int statusCode, @NonNull final HttpHeaders headers) {
            delegate.onResponseHeaders(statusCode, headers);
        }

        @Override
        public void onResponseBody(@NonNull final ByteBuffer data) {
            delegate.onResponseBody(data);
        }

        @Override
        public void onStreamComplete(final int statusCode, @Nullable final Throwable error) {
            activeRequests.decrementAndGet();
            delegate.onStreamComplete(statusCode, error);
        }
    }
}
