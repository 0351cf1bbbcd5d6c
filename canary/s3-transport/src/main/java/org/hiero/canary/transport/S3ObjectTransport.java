// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.lang.System.Logger;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hiero.canary.base.config.ConfigLogger;
import org.hiero.canary.base.config.CredentialsConfig;
import org.hiero.canary.base.config.TransportConfig;
import org.hiero.canary.base.dns.CachingHostResolver;
import org.hiero.canary.base.dns.HostResolver;
import org.hiero.canary.base.http.ConnectionManagerFactory;
import org.hiero.canary.base.http.JdkHttpConnectionManager;
import org.hiero.canary.base.http.Request;
import org.hiero.canary.base.http.RequestBody;
import org.hiero.canary.base.http.StreamHandler;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.base.metrics.MicrometerMetricsPublisher;
import org.hiero.canary.base.s3.CredentialsProvider;
import org.hiero.canary.base.s3.ErrorType;
import org.hiero.canary.base.s3.RequestSigner;
import org.hiero.canary.base.s3.S3ClientException;
import org.hiero.canary.base.s3.S3ResponseException;
import org.hiero.canary.base.s3.S3TransportException;
import org.hiero.canary.base.s3.SigV4RequestSigner;
import org.hiero.canary.base.s3.StaticCredentialsProvider;
import org.hiero.canary.base.threading.DefaultThreadPoolManager;
import org.hiero.canary.base.threading.ThreadPoolManager;
import org.hiero.canary.common.utils.Preconditions;
import org.hiero.canary.transport.multipart.MultipartDownloadState;
import org.hiero.canary.transport.multipart.MultipartTransferProcessor;
import org.hiero.canary.transport.multipart.MultipartTransferState;
import org.hiero.canary.transport.multipart.MultipartUploadState;
import org.hiero.canary.transport.multipart.PartFinishResponse;
import org.hiero.canary.transport.multipart.TransferState;

/**
 * Moves objects to and from one S3 bucket. Single object requests go straight through the signed request pipeline;
 * multipart transfers are split into parts that an upload and a download {@link MultipartTransferProcessor} drive
 * with bounded concurrency. Every operation is asynchronous and reports through its callback exactly once.
 *
 * <p>Before steady state, {@link #warmDnsCache(int)} (or {@link #seedAddressCache(String)}) followed by
 * {@link #spawnConnectionManagers()} spreads requests over enough addresses; without them the first request resolves
 * a single address.
 */
public final class S3ObjectTransport implements AutoCloseable {
    private static final Logger LOGGER = System.getLogger(S3ObjectTransport.class.getName());

    private static final String CONTENT_TYPE = "text/plain";
    private static final String UPLOAD_ID_OPEN_TAG = "<UploadId>";
    private static final String UPLOAD_ID_CLOSE_TAG = "</UploadId>";
    private static final int MAX_KEPT_BODY_BYTES = 1024 * 1024;
    private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (name, value) -> true);

    private final String endpoint;
    private final MetricsPublisher metrics;
    private final AddressCache addressCache;
    private final ConnectionManagerPool connectionManagerPool;
    private final SignedRequestPipeline pipeline;
    private final ExecutorService partExecutor;
    private final List<ExecutorService> ownedExecutors = new CopyOnWriteArrayList<>();
    private final MultipartTransferProcessor uploadProcessor;
    private final MultipartTransferProcessor downloadProcessor;

    /**
     * @param config the transport configuration
     * @param hostResolver resolves the endpoint
     * @param connectionManagerFactory creates one connection manager per address
     * @param signer signs every request
     * @param credentialsProvider supplies the signing key
     * @param metrics receives address counts, byte counts and part outcomes
     * @param threadPoolManager creates the part dispatch executor
     * @param clock supplies signing times
     */
    public S3ObjectTransport(
            @NonNull final TransportConfig config,
            @NonNull final HostResolver hostResolver,
            @NonNull final ConnectionManagerFactory connectionManagerFactory,
            @NonNull final RequestSigner signer,
            @NonNull final CredentialsProvider credentialsProvider,
            @NonNull final MetricsPublisher metrics,
            @NonNull final ThreadPoolManager threadPoolManager,
            @NonNull final Clock clock) {
        this.endpoint = config.resolvedEndpoint();
        this.metrics = Objects.requireNonNull(metrics);
        this.addressCache = new AddressCache(
                endpoint, hostResolver, metrics, config.transfersPerAddress(), config.dnsPollInterval());
        this.connectionManagerPool = new ConnectionManagerPool(addressCache, connectionManagerFactory, config);
        this.pipeline = new SignedRequestPipeline(
                config.regionName(), credentialsProvider, signer, connectionManagerPool, clock);
        this.partExecutor = threadPoolManager.createFixedThreadPool("s3-transport-parts", config.workerThreads());
        this.uploadProcessor = new MultipartTransferProcessor(
                "upload-processor", config.maxStreams(), config.maxPartRetries(), partExecutor);
        this.downloadProcessor = new MultipartTransferProcessor(
                "download-processor", config.maxStreams(), config.maxPartRetries(), partExecutor);
        if (!config.seedAddress().isBlank()) {
            seedAddressCache(config.seedAddress());
        }
    }

    /**
     * Build a transport with the default collaborators: platform DNS, JDK HTTP client connections, SigV4 signing with
     * the configured static credentials and Micrometer metrics.
     *
     * @param config the loaded configuration, holding the canary.transport and canary.credentials sections
     * @param meterRegistry the registry metrics are recorded in
     * @return a new transport
     */
    @NonNull
    public static S3ObjectTransport create(@NonNull final Config config, @NonNull final MeterRegistry meterRegistry) {
        final TransportConfig transportConfig = TransportConfig.from(config);
        final CredentialsConfig credentialsConfig = CredentialsConfig.from(config);
        ConfigLogger.log(transportConfig, credentialsConfig);
        final ThreadPoolManager threadPoolManager = new DefaultThreadPoolManager();
        final ExecutorService ioExecutor =
                threadPoolManager.createFixedThreadPool("s3-transport-io", transportConfig.workerThreads());
        final S3ObjectTransport transport = new S3ObjectTransport(
                transportConfig,
                new CachingHostResolver(ioExecutor),
                JdkHttpConnectionManager.factory(ioExecutor),
                new SigV4RequestSigner(),
                StaticCredentialsProvider.from(credentialsConfig),
                new MicrometerMetricsPublisher(meterRegistry),
                threadPoolManager,
                Clock.systemUTC());
        transport.ownedExecutors.add(ioExecutor);
        return transport;
    }

    // ==== Address cache and connection managers ======================================================================

    /**
     * Block until enough addresses for the given number of concurrent transfers are cached.
     *
     * @param numTransfers the number of concurrent transfers planned
     * @throws InterruptedException if interrupted while waiting for resolution
     */
    public void warmDnsCache(final int numTransfers) throws InterruptedException {
        addressCache.warm(numTransfers);
    }

    /**
     * Use one fixed address for every transfer instead of resolving the endpoint.
     *
     * @param address the address
     */
    public void seedAddressCache(@NonNull final String address) {
        addressCache.seed(address);
    }

    /**
     * @param transferIndex the index of a transfer
     * @return the cached address the transfer maps to
     */
    @NonNull
    public String getAddressForTransfer(final int transferIndex) {
        return addressCache.addressForTransfer(transferIndex);
    }

    /**
     * @param count the address count to publish
     */
    public void emitS3AddressCountMetric(final int count) {
        addressCache.emitAddressCountMetric(count);
    }

    /**
     * Replace all connection managers with one per cached address.
     */
    public void spawnConnectionManagers() {
        connectionManagerPool.spawn();
    }

    /**
     * Close and drop all connection managers.
     */
    public void purgeConnectionManagers() {
        connectionManagerPool.purge();
    }

    /**
     * @return the number of requests currently streaming
     */
    public int getOpenConnectionCount() {
        return pipeline.getActiveRequestCount();
    }

    @NonNull
    public String endpoint() {
        return endpoint;
    }

    // ==== Single object operations ===================================================================================

    /**
     * Upload one object.
     *
     * @param key the object key
     * @param body the object content
     * @param flags a combination of {@link PutObjectFlags}
     * @param finished receives the result
     */
    public void putObject(
            @NonNull final String key,
            @NonNull final RequestBody body,
            final int flags,
            @NonNull final PutObjectFinished finished) {
        putObjectAtPath(objectPath(key), body, flags, finished);
    }

    /**
     * Download one object or one part of it.
     *
     * @param key the object key
     * @param partNumber the 1-based part to fetch, 0 for the whole object
     * @param receiver receives the body chunks
     * @param finished receives the result
     */
    public void getObject(
            @NonNull final String key,
            final int partNumber,
            @NonNull final ObjectBodyReceiver receiver,
            @NonNull final GetObjectFinished finished) {
        Preconditions.requireWhole(partNumber);
        Objects.requireNonNull(receiver);
        Objects.requireNonNull(finished);
        final String path = partNumber > 0 ? objectPath(key) + "?partNumber=" + partNumber : objectPath(key);
        final int expectedStatus = partNumber > 0 ? 206 : 200;
        final Request request = Request.newBuilder("GET", path).header("host", endpoint).build();
        execute("GetObject", request, expectedStatus, false, receiver, (error, exchange) -> {
            if (error == null) {
                LOGGER.log(DEBUG, "GetObject finished for path {0}", path);
            } else {
                LOGGER.log(ERROR, "GetObject failed for path %s: %s".formatted(path, error.getMessage()));
            }
            finished.onFinished(error);
        });
    }

    // ==== Multipart operations =======================================================================================

    /**
     * Upload one object in parts. The upload is created first; if that fails no part is sent. Once every part landed
     * the upload is completed. If the upload fails after it was created it is aborted before the result is reported.
     *
     * @param key the object key
     * @param objectSize the size of the object in bytes
     * @param numParts the number of parts
     * @param sendPart supplies each part's content
     * @param finished receives the result and the number of parts
     */
    public void putObjectMultipart(
            @NonNull final String key,
            final long objectSize,
            final int numParts,
            @NonNull final SendPartCallback sendPart,
            @NonNull final PutObjectMultipartFinished finished) {
        Objects.requireNonNull(sendPart);
        Objects.requireNonNull(finished);
        final MultipartUploadState state = new MultipartUploadState(key, objectSize, numParts, metrics);
        LOGGER.log(INFO, "Put object multipart for {0}, object size {1}, {2} parts", key, state.objectSize(), numParts);
        state.setFinishedCallback(error -> {
            if (error == null) {
                LOGGER.log(INFO, "Multipart upload of {0} finished, {1} parts", key, numParts);
                finished.onFinished(null, numParts);
            } else if (state.uploadId() != null) {
                abortMultipartUpload(key, state.uploadId(), abortError -> finished.onFinished(error, numParts));
            } else {
                finished.onFinished(error, numParts);
            }
        });
        state.setProcessPartCallback((part, partFinished) -> uploadPart(state, part, sendPart, partFinished));
        createMultipartUpload(key, (error, uploadId) -> {
            if (error != null) {
                state.setFinished(error);
            } else {
                state.setUploadId(uploadId);
                uploadProcessor.pushQueue(state);
            }
        });
    }

    /**
     * Download one object in parts. Parts arrive in any order.
     *
     * @param key the object key
     * @param numParts the number of parts the object was uploaded with
     * @param receivePart receives each part's content
     * @param finished receives the result once every part arrived
     */
    public void getObjectMultipart(
            @NonNull final String key,
            final int numParts,
            @NonNull final ReceivePartCallback receivePart,
            @NonNull final GetObjectMultipartFinished finished) {
        Objects.requireNonNull(receivePart);
        Objects.requireNonNull(finished);
        final MultipartDownloadState state = new MultipartDownloadState(key, numParts, metrics);
        state.setFinishedCallback(finished::onFinished);
        state.setProcessPartCallback((part, partFinished) -> getPart(state, part, receivePart, partFinished));
        downloadProcessor.pushQueue(state);
    }

    /**
     * Start a multipart upload.
     *
     * @param key the object key
     * @param finished receives the upload id
     */
    public void createMultipartUpload(
            @NonNull final String key, @NonNull final CreateMultipartUploadFinished finished) {
        Objects.requireNonNull(finished);
        final String path = objectPath(key) + "?uploads";
        final Request request = Request.newBuilder("POST", path)
                .header("host", endpoint)
                .header("content-type", CONTENT_TYPE)
                .header("content-length", "0")
                .build();
        execute("CreateMultipartUpload", request, 200, false, null, (error, exchange) -> {
            if (error != null) {
                LOGGER.log(ERROR, "CreateMultipartUpload failed for %s: %s".formatted(path, error.getMessage()));
                finished.onFinished(error, null);
                return;
            }
            final String uploadId = extractUploadId(new String(exchange.body(), StandardCharsets.UTF_8));
            if (uploadId == null) {
                LOGGER.log(ERROR, "CreateMultipartUpload response for {0} has no UploadId", path);
                finished.onFinished(
                        new S3TransportException(
                                ErrorType.MISSING_RESPONSE_METADATA,
                                "CreateMultipartUpload response for " + path + " has no UploadId"),
                        null);
                return;
            }
            LOGGER.log(DEBUG, "Created multipart upload {0} for {1}", uploadId, key);
            finished.onFinished(null, uploadId);
        });
    }

    /**
     * Complete a multipart upload.
     *
     * @param key the object key
     * @param uploadId the upload id
     * @param etags the ETag of every part in part order
     * @param finished receives the result
     */
    public void completeMultipartUpload(
            @NonNull final String key,
            @NonNull final String uploadId,
            @NonNull final List<String> etags,
            @NonNull final CompleteMultipartUploadFinished finished) {
        Objects.requireNonNull(finished);
        final String path = uploadPath(key, uploadId);
        final RequestBody body = RequestBody.ofString(completeMultipartUploadBody(etags));
        final Request request = Request.newBuilder("POST", path)
                .header("host", endpoint)
                .header("content-type", CONTENT_TYPE)
                .header("content-length", Long.toString(body.contentLength()))
                .body(body)
                .build();
        execute("CompleteMultipartUpload", request, 200, false, null, (error, exchange) -> {
            if (error == null) {
                LOGGER.log(DEBUG, "Completed multipart upload {0} for {1}", uploadId, key);
            } else {
                LOGGER.log(ERROR, "CompleteMultipartUpload failed for %s: %s".formatted(path, error.getMessage()));
            }
            finished.onFinished(error);
        });
    }

    /**
     * Abort a multipart upload.
     *
     * @param key the object key
     * @param uploadId the upload id
     * @param finished receives the result
     */
    public void abortMultipartUpload(
            @NonNull final String key,
            @NonNull final String uploadId,
            @NonNull final AbortMultipartUploadFinished finished) {
        Objects.requireNonNull(finished);
        final String path = uploadPath(key, uploadId);
        final Request request = Request.newBuilder("DELETE", path).header("host", endpoint).build();
        execute("AbortMultipartUpload", request, 204, false, null, (error, exchange) -> {
            if (error == null) {
                LOGGER.log(DEBUG, "Aborted multipart upload {0} for {1}", uploadId, key);
            } else {
                LOGGER.log(ERROR, "AbortMultipartUpload failed for %s: %s".formatted(path, error.getMessage()));
            }
            finished.onFinished(error);
        });
    }

    /**
     * Purge the connection managers and stop dispatching parts. Executors this transport created for itself are shut
     * down as well.
     */
    @Override
    public void close() {
        connectionManagerPool.purge();
        partExecutor.shutdown();
        ownedExecutors.forEach(ExecutorService::shutdown);
    }

    // ==== Part operations ============================================================================================

    /**
     * @return the request path of an object, its key percent-encoded with slashes kept
     */
    private static String objectPath(final String key) {
        return "/" + SigV4RequestSigner.urlEncode(Preconditions.requireNotBlank(key), true);
    }

    private static String uploadPath(final String key, final String uploadId) {
        return objectPath(key) + "?uploadId="
                + SigV4RequestSigner.urlEncode(Preconditions.requireNotBlank(uploadId), false);
    }

    private void uploadPart(
            final MultipartUploadState state,
            final TransferState part,
            final SendPartCallback sendPart,
            final MultipartTransferState.PartFinishedCallback partFinished) {
        part.addDataUpMetric(0);
        final RequestBody body = sendPart.sendPart(part);
        final String path = objectPath(state.key()) + "?partNumber=" + part.partNumber() + "&uploadId="
                + SigV4RequestSigner.urlEncode(state.uploadId(), false);
        putObjectAtPath(path, body, PutObjectFlags.RETRIEVE_ETAG, (error, etag) -> {
            if (error == null) {
                state.setETag(part.partIndex(), etag);
                part.addDataUpMetric(body.contentLength());
                if (state.incNumPartsCompleted() && !state.isFinished()) {
                    completeMultipartUpload(state.key(), state.uploadId(), state.getETags(), state::setFinished);
                }
                LOGGER.log(
                        INFO,
                        "UploadPart for {0} part {1} of {2} succeeded",
                        state.key(),
                        part.partNumber(),
                        state.numParts());
                metrics.addTransferStatusDataPoint(true);
                part.flushDataUpMetrics();
                partFinished.onPartFinished(PartFinishResponse.DONE);
            } else {
                LOGGER.log(
                        ERROR,
                        "UploadPart for %s part %d failed, retrying: %s"
                                .formatted(state.key(), part.partNumber(), error.getMessage()));
                metrics.addTransferStatusDataPoint(false);
                part.flushDataUpMetrics();
                partFinished.onPartFinished(PartFinishResponse.RETRY);
            }
        });
    }

    private void getPart(
            final MultipartDownloadState state,
            final TransferState part,
            final ReceivePartCallback receivePart,
            final MultipartTransferState.PartFinishedCallback partFinished) {
        part.addDataDownMetric(0);
        getObject(
                state.key(),
                part.partNumber(),
                data -> {
                    part.addDataDownMetric(data.remaining());
                    receivePart.receivePart(part, data);
                },
                error -> {
                    if (error != null) {
                        LOGGER.log(
                                ERROR,
                                "GetPart for %s part %d failed, retrying: %s"
                                        .formatted(state.key(), part.partNumber(), error.getMessage()));
                        metrics.addTransferStatusDataPoint(false);
                        part.flushDataDownMetrics();
                        partFinished.onPartFinished(PartFinishResponse.RETRY);
                        return;
                    }
                    LOGGER.log(
                            INFO,
                            "GetPart for {0} part {1} of {2} received",
                            state.key(),
                            part.partNumber(),
                            state.numParts());
                    if (state.incNumPartsCompleted()) {
                        state.setFinished(null);
                    }
                    metrics.addTransferStatusDataPoint(true);
                    part.flushDataDownMetrics();
                    partFinished.onPartFinished(PartFinishResponse.DONE);
                });
    }

    // ==== Request plumbing ===========================================================================================

    private void putObjectAtPath(
            final String path, final RequestBody body, final int flags, final PutObjectFinished finished) {
        Objects.requireNonNull(body);
        Objects.requireNonNull(finished);
        final boolean retrieveEtag = PutObjectFlags.isSet(flags, PutObjectFlags.RETRIEVE_ETAG);
        final Request request = Request.newBuilder("PUT", path)
                .header("host", endpoint)
                .header("content-type", CONTENT_TYPE)
                .header("content-length", Long.toString(body.contentLength()))
                .body(body)
                .build();
        LOGGER.log(INFO, "PutObject initiated for path {0}", path);
        execute("PutObject", request, 200, retrieveEtag, null, (error, exchange) -> {
            if (error == null) {
                LOGGER.log(INFO, "PutObject finished for path {0}", path);
                finished.onFinished(null, retrieveEtag ? exchange.etag() : null);
            } else if (error instanceof S3ResponseException
                    || error.errorType() == ErrorType.MISSING_RESPONSE_METADATA) {
                LOGGER.log(ERROR, "PutObject failed for path %s: %s".formatted(path, error.getMessage()));
                finished.onFinished(error, null);
            } else {
                LOGGER.log(DEBUG, "PutObject failed for path %s: %s".formatted(path, error.getMessage()));
                finished.onFinished(error, null);
            }
        });
    }

    /**
     * The outcome of one exchange.
     *
     * @param statusCode the response status
     * @param headers the response headers
     * @param body the kept response body, empty when the body went to a receiver
     * @param etag the captured ETag, null if not requested or absent
     */
    private record Exchange(int statusCode, HttpHeaders headers, byte[] body, String etag) {}

    @FunctionalInterface
    private interface ExchangeCallback {
        void onExchangeFinished(@Nullable S3ClientException error, @Nullable Exchange exchange);
    }

    /**
     * Send a request and check its response.
     *
     * @param operation the operation name used in messages
     * @param request the unsigned request
     * @param expectedStatus the only status that counts as success
     * @param retrieveEtag whether a missing ETag header is a failure
     * @param receiver receives the body of a successful response, null to keep the body in the exchange
     * @param callback receives the result exactly once
     */
    private void execute(
            final String operation,
            final Request request,
            final int expectedStatus,
            final boolean retrieveEtag,
            @Nullable final ObjectBodyReceiver receiver,
            final ExchangeCallback callback) {
        final ExchangeHandler handler =
                new ExchangeHandler(operation, request, expectedStatus, retrieveEtag, receiver, callback);
        pipeline.makeSignedRequest(request, handler, (connection, error) -> {
            if (error != null) {
                LOGGER.log(ERROR, "Signed request for {0} {1} failed: {2}", operation, request, error.getMessage());
                handler.finish(error, null);
            }
        });
    }

    /**
     * Collects one response and turns it into an {@link Exchange} or an error.
     */
    private static final class ExchangeHandler implements StreamHandler {
        private final String operation;
        private final Request request;
        private final int expectedStatus;
        private final boolean retrieveEtag;
        private final ObjectBodyReceiver receiver;
        private final ExchangeCallback callback;
        private final AtomicBoolean finished = new AtomicBoolean();
        private final ByteArrayOutputStream keptBody = new ByteArrayOutputStream();
        private volatile int statusCode;
        private volatile HttpHeaders headers = NO_HEADERS;
        private volatile String etag;

        private ExchangeHandler(
                final String operation,
                final Request request,
                final int expectedStatus,
                final boolean retrieveEtag,
                @Nullable final ObjectBodyReceiver receiver,
                final ExchangeCallback callback) {
            this.operation = operation;
            this.request = request;
            this.expectedStatus = expectedStatus;
            this.retrieveEtag = retrieveEtag;
            this.receiver = receiver;
            this.callback = callback;
        }

        @Override
        public void onResponseHeaders(final int statusCode, @NonNull final HttpHeaders headers) {
            this.statusCode = statusCode;
            this.headers = headers;
            if (retrieveEtag) {
                etag = headers.firstValue("ETag").orElse(null);
            }
        }

        @Override
        public void onResponseBody(@NonNull final ByteBuffer data) {
            if (receiver != null && statusCode == expectedStatus) {
                receiver.onBody(data);
                return;
            }
            synchronized (keptBody) {
                final int room = MAX_KEPT_BODY_BYTES - keptBody.size();
                final int length = Math.min(room, data.remaining());
                if (length > 0) {
                    final byte[] chunk = new byte[length];
                    data.get(chunk);
                    keptBody.write(chunk, 0, length);
                }
            }
        }

        @Override
        public void onStreamComplete(final int statusCode, @Nullable final Throwable error) {
            final byte[] body;
            synchronized (keptBody) {
                body = keptBody.toByteArray();
            }
            if (error != null) {
                finish(
                        new S3TransportException(
                                ErrorType.TRANSPORT_FAILURE, operation + " " + request + " failed in transport", error),
                        null);
            } else if (statusCode != expectedStatus) {
                finish(
                        new S3ResponseException(
                                statusCode,
                                expectedStatus,
                                body,
                                headers,
                                "%s %s returned status %d, expected %d"
                                        .formatted(operation, request, statusCode, expectedStatus)),
                        null);
            } else if (retrieveEtag && etag == null) {
                finish(
                        new S3TransportException(
                                ErrorType.MISSING_RESPONSE_METADATA, operation + " " + request + " returned no ETag"),
                        null);
            } else {
                finish(null, new Exchange(statusCode, headers, body, etag));
            }
        }

        private void finish(@Nullable final S3ClientException error, @Nullable final Exchange exchange) {
            if (finished.compareAndSet(false, true)) {
                callback.onExchangeFinished(error, exchange);
            } else {
                LOGGER.log(WARNING, "{0} {1} reported a second result, ignored", operation, request);
            }
        }
    }

    /**
     * Find the upload id in a CreateMultipartUpload response. This is a plain search for the literal tags, not an XML
     * parse: a response without both tags, or with nothing between them, has no upload id.
     *
     * @param responseBody the response body
     * @return the upload id, or null if there is none
     */
    @Nullable
    static String extractUploadId(@NonNull final String responseBody) {
        final int open = responseBody.indexOf(UPLOAD_ID_OPEN_TAG);
        if (open < 0) {
            return null;
        }
        final int start = open + UPLOAD_ID_OPEN_TAG.length();
        final int end = responseBody.indexOf(UPLOAD_ID_CLOSE_TAG, start);
        if (end < 0 || end == start) {
            return null;
        }
        return responseBody.substring(start, end);
    }

    /**
     * Build the CompleteMultipartUpload request body.
     *
     * @param etags the ETag of every part in part order
     * @return the XML document
     */
    @NonNull
    static String completeMultipartUploadBody(@NonNull final List<String> etags) {
        final StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\" ?>\n");
        sb.append("<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">\n");
        for (int i = 0; i < etags.size(); i++) {
            sb.append("   <Part>\n");
            sb.append("       <ETag>").append(etags.get(i)).append("</ETag>\n");
            sb.append("       <PartNumber>").append(i + 1).append("</PartNumber>\n");
            sb.append("   </Part>\n");
        }
        sb.append("</CompleteMultipartUpload>");
        return sb.toString();
    }
}
