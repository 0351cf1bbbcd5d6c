// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.hiero.canary.base.config.TransportConfig;
import org.hiero.canary.base.dns.HostResolver;
import org.hiero.canary.base.http.Request;
import org.hiero.canary.base.http.RequestBody;
import org.hiero.canary.base.metrics.MetricName;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.base.s3.ErrorType;
import org.hiero.canary.base.s3.RequestSigner;
import org.hiero.canary.base.s3.S3ClientException;
import org.hiero.canary.base.s3.S3ResponseException;
import org.hiero.canary.transport.fixtures.DirectThreadPoolManager;
import org.hiero.canary.transport.fixtures.FakeS3;
import org.hiero.canary.transport.fixtures.FakeS3.FakeResponse;
import org.hiero.canary.transport.fixtures.TestConfigs;
import org.hiero.canary.transport.fixtures.TestSigning;
import org.hiero.canary.transport.fixtures.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link S3ObjectTransport} against an in-memory S3.
 */
class S3ObjectTransportTest {
    private static final String KEY = "object-1";
    private static final String UPLOAD_ID = "upload-7";
    private static final String CREATED_RESPONSE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<InitiateMultipartUploadResult><Bucket>canary-bucket</Bucket><Key>object-1</Key>"
            + "<UploadId>" + UPLOAD_ID + "</UploadId></InitiateMultipartUploadResult>";

    private FakeS3 fakeS3;
    private MetricsPublisher metrics;
    private S3ObjectTransport transport;

    @BeforeEach
    void setUp() {
        TestUtils.enableDebugLogging();
        fakeS3 = new FakeS3();
        metrics = mock(MetricsPublisher.class);
        transport = transport(TestConfigs.seeded(), TestSigning.PASS_THROUGH);
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    private S3ObjectTransport transport(final TransportConfig config, final RequestSigner signer) {
        return new S3ObjectTransport(
                config,
                mock(HostResolver.class),
                fakeS3,
                signer,
                TestSigning.CREDENTIALS,
                metrics,
                new DirectThreadPoolManager(),
                Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    /** The outcome of a put. */
    private static final class PutResult {
        private final AtomicInteger calls = new AtomicInteger();
        private volatile S3ClientException error;
        private volatile String etag;

        void record(final S3ClientException error, final String etag) {
            calls.incrementAndGet();
            this.error = error;
            this.etag = etag;
        }
    }

    /** The outcome of an operation without a value. */
    private static final class Outcome {
        private final AtomicInteger calls = new AtomicInteger();
        private volatile S3ClientException error;

        void record(final S3ClientException error) {
            calls.incrementAndGet();
            this.error = error;
        }
    }

    private static String text(final ByteBuffer data) {
        final byte[] bytes = new byte[data.remaining()];
        data.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static int partNumberOf(final Request request) {
        for (final String parameter : request.rawQuery().split("&")) {
            if (parameter.startsWith("partNumber=")) {
                return Integer.parseInt(parameter.substring("partNumber=".length()));
            }
        }
        throw new IllegalArgumentException("no part number in " + request);
    }

    private static boolean isCreate(final Request request) {
        return request.method().equals("POST") && "uploads".equals(request.rawQuery());
    }

    private static boolean isComplete(final Request request) {
        return request.method().equals("POST") && ("uploadId=" + UPLOAD_ID).equals(request.rawQuery());
    }

    @Nested
    @DisplayName("Single object operations")
    class SingleObject {
        /**
         * This test aims to verify that a put sends the object with host, content type and content length headers
         * and reports no ETag when none was asked for.
         */
        @Test
        @DisplayName("Put without ETag retrieval")
        void testPutObject() {
            fakeS3.respondWith(request ->
                    CompletableFuture.completedFuture(FakeResponse.of(200).withHeader("ETag", "\"abc\"")));
            final PutResult result = new PutResult();

            transport.putObject(KEY, RequestBody.ofString("hello"), PutObjectFlags.NONE, result::record);

            assertThat(result.calls).hasValue(1);
            assertThat(result.error).isNull();
            assertThat(result.etag).isNull();
            final Request sent = fakeS3.requests().get(0);
            assertThat(sent.method()).isEqualTo("PUT");
            assertThat(sent.path()).isEqualTo("/" + KEY);
            assertThat(sent.header("host")).isEqualTo(TestConfigs.ENDPOINT);
            assertThat(sent.header("content-type")).isEqualTo("text/plain");
            assertThat(sent.header("content-length")).isEqualTo("5");
            assertThat(FakeS3.bodyOf(sent)).isEqualTo("hello");
        }

        /**
         * This test aims to verify that the ETag header is reported when it was asked for.
         */
        @Test
        @DisplayName("Put with ETag retrieval")
        void testPutObjectRetrievesEtag() {
            fakeS3.respondWith(request ->
                    CompletableFuture.completedFuture(FakeResponse.of(200).withHeader("ETag", "\"abc\"")));
            final PutResult result = new PutResult();

            transport.putObject(KEY, RequestBody.ofString("hello"), PutObjectFlags.RETRIEVE_ETAG, result::record);

            assertThat(result.error).isNull();
            assertThat(result.etag).isEqualTo("\"abc\"");
        }

        /**
         * This test aims to verify that a successful put without the ETag it was asked to retrieve fails.
         */
        @Test
        @DisplayName("Put missing a requested ETag fails")
        void testPutObjectMissingEtag() {
            final PutResult result = new PutResult();

            transport.putObject(KEY, RequestBody.ofString("hello"), PutObjectFlags.RETRIEVE_ETAG, result::record);

            assertThat(result.calls).hasValue(1);
            assertThat(result.error.errorType()).isEqualTo(ErrorType.MISSING_RESPONSE_METADATA);
            assertThat(result.etag).isNull();
        }

        /**
         * This test aims to verify that any status other than 200 fails a put with the status and response body.
         */
        @Test
        @DisplayName("Put with unexpected status fails")
        void testPutObjectBadStatus() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(
                    FakeResponse.of(503, "<Error><Code>SlowDown</Code></Error>")));
            final PutResult result = new PutResult();

            transport.putObject(KEY, RequestBody.ofString("hello"), PutObjectFlags.NONE, result::record);

            assertThat(result.error).isInstanceOf(S3ResponseException.class);
            final S3ResponseException error = (S3ResponseException) result.error;
            assertThat(error.errorType()).isEqualTo(ErrorType.UNEXPECTED_STATUS);
            assertThat(error.getStatusCode()).isEqualTo(503);
            assertThat(error.getExpectedStatusCode()).isEqualTo(200);
            assertThat(new String(error.getResponseBody(), StandardCharsets.UTF_8)).contains("SlowDown");
        }

        /**
         * This test aims to verify that a transport error fails a put.
         */
        @Test
        @DisplayName("Put with transport error fails")
        void testPutObjectTransportError() {
            fakeS3.respondWith(request -> CompletableFuture.failedFuture(new IllegalStateException("reset")));
            final PutResult result = new PutResult();

            transport.putObject(KEY, RequestBody.ofString("hello"), PutObjectFlags.NONE, result::record);

            assertThat(result.error.errorType()).isEqualTo(ErrorType.TRANSPORT_FAILURE);
        }

        /**
         * This test aims to verify that a whole object get expects 200 and hands the body to the receiver.
         */
        @Test
        @DisplayName("Get whole object")
        void testGetObject() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(200, "content")));
            final StringBuilder received = new StringBuilder();
            final Outcome outcome = new Outcome();

            transport.getObject(KEY, 0, data -> received.append(text(data)), outcome::record);

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error).isNull();
            assertThat(received).hasToString("content");
            final Request sent = fakeS3.requests().get(0);
            assertThat(sent.method()).isEqualTo("GET");
            assertThat(sent.path()).isEqualTo("/" + KEY);
            assertThat(sent.header("host")).isEqualTo(TestConfigs.ENDPOINT);
        }

        /**
         * This test aims to verify that a part get asks for the part number and expects 206, so a 200 answer is a
         * failure whose body never reaches the receiver.
         */
        @Test
        @DisplayName("Get part expects partial content")
        void testGetObjectPart() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(206, "part-3")));
            final StringBuilder received = new StringBuilder();
            final Outcome outcome = new Outcome();

            transport.getObject(KEY, 3, data -> received.append(text(data)), outcome::record);

            assertThat(outcome.error).isNull();
            assertThat(received).hasToString("part-3");
            assertThat(fakeS3.requests().get(0).path()).isEqualTo("/" + KEY + "?partNumber=3");

            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(200, "whole")));
            final Outcome wrongStatus = new Outcome();
            transport.getObject(KEY, 3, data -> received.append(text(data)), wrongStatus::record);

            assertThat(wrongStatus.error.errorType()).isEqualTo(ErrorType.UNEXPECTED_STATUS);
            assertThat(received).hasToString("part-3");
        }

        /**
         * This test aims to verify that a key with a space is percent-encoded in the request path, slashes kept, and
         * that put and get of such a key succeed.
         */
        @Test
        @DisplayName("Key with a space is encoded in the path")
        void testEncodedKey() {
            final String key = "reports/2026 q1.txt";
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(
                    request.method().equals("PUT") ? FakeResponse.of(200) : FakeResponse.of(200, "quarter")));
            final PutResult put = new PutResult();
            final StringBuilder received = new StringBuilder();
            final Outcome get = new Outcome();

            transport.putObject(key, RequestBody.ofString("quarter"), PutObjectFlags.NONE, put::record);
            transport.getObject(key, 0, data -> received.append(text(data)), get::record);

            assertThat(put.error).isNull();
            assertThat(get.error).isNull();
            assertThat(received).hasToString("quarter");
            final List<Request> sent = fakeS3.requests();
            assertThat(sent).hasSize(2);
            assertThat(sent.get(0).path()).isEqualTo("/reports/2026%20q1.txt");
            assertThat(sent.get(1).path()).isEqualTo("/reports/2026%20q1.txt");
        }

        /**
         * This test aims to verify that a signing failure is reported without sending anything.
         */
        @Test
        @DisplayName("Signing failure fails the operation")
        void testSigningFailure() {
            transport.close();
            transport = transport(TestConfigs.seeded(), TestSigning.FAILING);
            final Outcome outcome = new Outcome();

            transport.getObject(KEY, 0, data -> {}, outcome::record);

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error.errorType()).isEqualTo(ErrorType.SIGNING_FAILURE);
            assertThat(fakeS3.requests()).isEmpty();
        }

        /**
         * This test aims to verify that connection and stream failures are reported as such.
         */
        @Test
        @DisplayName("Connection and stream failures fail the operation")
        void testConnectionFailures() {
            fakeS3.setConnectionsOpen(false);
            final Outcome notOpen = new Outcome();
            transport.getObject(KEY, 0, data -> {}, notOpen::record);
            assertThat(notOpen.error.errorType()).isEqualTo(ErrorType.CONNECTION_ACQUIRE_FAILURE);

            fakeS3.setConnectionsOpen(true);
            fakeS3.setStreamsAvailable(false);
            final Outcome noStream = new Outcome();
            transport.getObject(KEY, 0, data -> {}, noStream::record);
            assertThat(noStream.error.errorType()).isEqualTo(ErrorType.STREAM_CREATE_FAILURE);
            assertThat(noStream.calls).hasValue(1);
            assertThat(transport.getOpenConnectionCount()).isZero();
        }

        /**
         * This test aims to verify that the open connection count follows requests in flight.
         */
        @Test
        @DisplayName("Open connection count follows requests in flight")
        void testOpenConnectionCount() {
            final List<CompletableFuture<FakeResponse>> pending = new CopyOnWriteArrayList<>();
            fakeS3.respondWith(request -> {
                final CompletableFuture<FakeResponse> response = new CompletableFuture<>();
                pending.add(response);
                return response;
            });

            transport.getObject(KEY, 0, data -> {}, error -> {});
            transport.getObject(KEY, 0, data -> {}, error -> {});
            assertThat(transport.getOpenConnectionCount()).isEqualTo(2);

            pending.get(0).complete(FakeResponse.of(200));
            assertThat(transport.getOpenConnectionCount()).isEqualTo(1);
            pending.get(1).complete(FakeResponse.of(500));
            assertThat(transport.getOpenConnectionCount()).isZero();
        }

        /**
         * This test aims to verify that the seeded address is used for every transfer and every connection.
         */
        @Test
        @DisplayName("Seeded address serves every transfer")
        void testSeededAddress() {
            assertThat(transport.getAddressForTransfer(0)).isEqualTo(TestConfigs.SEED_ADDRESS);
            assertThat(transport.getAddressForTransfer(99)).isEqualTo(TestConfigs.SEED_ADDRESS);
            assertThat(transport.endpoint()).isEqualTo(TestConfigs.ENDPOINT);

            transport.spawnConnectionManagers();
            transport.getObject(KEY, 0, data -> {}, error -> {});

            assertThat(fakeS3.managers()).hasSize(1);
            assertThat(fakeS3.managers().get(0).options().address()).isEqualTo(TestConfigs.SEED_ADDRESS);

            transport.purgeConnectionManagers();
            assertThat(fakeS3.managers().get(0).isClosed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Multipart upload")
    class MultipartUpload {
        /**
         * This test aims to verify that parts finishing out of order still complete the upload with the ETags in
         * part order, and that completion happens only after the last part.
         */
        @Test
        @DisplayName("Complete lists ETags in part order")
        void testETagOrder() {
            final Map<Integer, CompletableFuture<FakeResponse>> parts = new ConcurrentHashMap<>();
            fakeS3.respondWith(request -> {
                if (isCreate(request)) {
                    return CompletableFuture.completedFuture(FakeResponse.of(200, CREATED_RESPONSE));
                }
                if (request.method().equals("PUT")) {
                    final CompletableFuture<FakeResponse> response = new CompletableFuture<>();
                    parts.put(partNumberOf(request), response);
                    return response;
                }
                return CompletableFuture.completedFuture(FakeResponse.of(200));
            });
            final AtomicInteger finishedCalls = new AtomicInteger();
            final AtomicReference<S3ClientException> finishedError = new AtomicReference<>();
            final AtomicInteger reportedParts = new AtomicInteger();

            transport.putObjectMultipart(
                    KEY,
                    15,
                    3,
                    part -> RequestBody.ofString("part-" + part.partNumber()),
                    (error, numParts) -> {
                        finishedCalls.incrementAndGet();
                        finishedError.set(error);
                        reportedParts.set(numParts);
                    });

            assertThat(parts).containsOnlyKeys(1, 2, 3);
            parts.get(2).complete(FakeResponse.of(200).withHeader("ETag", "etag-2"));
            parts.get(1).complete(FakeResponse.of(200).withHeader("ETag", "etag-1"));
            assertThat(fakeS3.requests(S3ObjectTransportTest::isComplete)).isEmpty();
            assertThat(finishedCalls).hasValue(0);
            parts.get(3).complete(FakeResponse.of(200).withHeader("ETag", "etag-3"));

            assertThat(finishedCalls).hasValue(1);
            assertThat(finishedError.get()).isNull();
            assertThat(reportedParts).hasValue(3);
            final List<Request> complete = fakeS3.requests(S3ObjectTransportTest::isComplete);
            assertThat(complete).hasSize(1);
            assertThat(FakeS3.bodyOf(complete.get(0)))
                    .isEqualTo("<?xml version=\"1.0\" encoding=\"UTF-8\" ?>\n"
                            + "<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">\n"
                            + "   <Part>\n       <ETag>etag-1</ETag>\n       <PartNumber>1</PartNumber>\n   </Part>\n"
                            + "   <Part>\n       <ETag>etag-2</ETag>\n       <PartNumber>2</PartNumber>\n   </Part>\n"
                            + "   <Part>\n       <ETag>etag-3</ETag>\n       <PartNumber>3</PartNumber>\n   </Part>\n"
                            + "</CompleteMultipartUpload>");
            assertThat(fakeS3.requests(request -> request.method().equals("DELETE"))).isEmpty();
            final Request firstPart = fakeS3.requests(request -> request.method().equals("PUT")).get(0);
            assertThat(firstPart.rawQuery()).endsWith("&uploadId=" + UPLOAD_ID);
            verify(metrics, times(3)).addTransferStatusDataPoint(true);
            verify(metrics, atLeastOnce()).addDataPoint(MetricName.BYTES_UP, 6.0);
        }

        /**
         * This test aims to verify that the create request is a POST with the uploads query and an empty body.
         */
        @Test
        @DisplayName("Create multipart upload reads the upload id")
        void testCreate() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(200, CREATED_RESPONSE)));
            final AtomicReference<String> uploadId = new AtomicReference<>();
            final Outcome outcome = new Outcome();

            transport.createMultipartUpload(KEY, (error, id) -> {
                outcome.record(error);
                uploadId.set(id);
            });

            assertThat(outcome.error).isNull();
            assertThat(uploadId.get()).isEqualTo(UPLOAD_ID);
            final Request sent = fakeS3.requests().get(0);
            assertThat(sent.method()).isEqualTo("POST");
            assertThat(sent.path()).isEqualTo("/" + KEY + "?uploads");
            assertThat(sent.header("content-length")).isEqualTo("0");
            assertThat(sent.header("content-type")).isEqualTo("text/plain");
        }

        /**
         * This test aims to verify that a create response without an upload id fails the upload before any part
         * is sent and nothing is aborted.
         */
        @Test
        @DisplayName("Missing upload id fails before any part")
        void testMissingUploadId() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(
                    FakeResponse.of(200, "<InitiateMultipartUploadResult></InitiateMultipartUploadResult>")));
            final Outcome outcome = new Outcome();
            final AtomicInteger partsRequested = new AtomicInteger();

            transport.putObjectMultipart(
                    KEY,
                    10,
                    2,
                    part -> {
                        partsRequested.incrementAndGet();
                        return RequestBody.ofString("x");
                    },
                    (error, numParts) -> outcome.record(error));

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error.errorType()).isEqualTo(ErrorType.MISSING_RESPONSE_METADATA);
            assertThat(partsRequested).hasValue(0);
            assertThat(fakeS3.requests()).hasSize(1);
        }

        /**
         * This test aims to verify that a failed create fails the upload without sending parts.
         */
        @Test
        @DisplayName("Failed create fails before any part")
        void testCreateFails() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(403, "denied")));
            final Outcome outcome = new Outcome();

            transport.putObjectMultipart(
                    KEY, 10, 2, part -> RequestBody.ofString("x"), (error, n) -> outcome.record(error));

            assertThat(outcome.error).isInstanceOf(S3ResponseException.class);
            assertThat(fakeS3.requests()).singleElement().matches(S3ObjectTransportTest::isCreate);
        }

        /**
         * This test aims to verify that a part failing more often than allowed aborts the upload exactly once, and
         * the abort happens before the original error is reported, even when the abort itself fails.
         */
        @Test
        @DisplayName("Exhausted part aborts once before reporting")
        void testAbortBeforeFinish() {
            transport.close();
            transport = transport(TestConfigs.config(10, 500, 2, TestConfigs.SEED_ADDRESS), TestSigning.PASS_THROUGH);
            final List<String> events = new CopyOnWriteArrayList<>();
            fakeS3.respondWith(request -> {
                if (isCreate(request)) {
                    return CompletableFuture.completedFuture(FakeResponse.of(200, CREATED_RESPONSE));
                }
                if (request.method().equals("DELETE")) {
                    events.add("abort");
                    return CompletableFuture.completedFuture(FakeResponse.of(500));
                }
                if (request.method().equals("PUT") && partNumberOf(request) == 2) {
                    return CompletableFuture.completedFuture(FakeResponse.of(500));
                }
                return CompletableFuture.completedFuture(FakeResponse.of(200).withHeader("ETag", "e"));
            });
            final AtomicReference<S3ClientException> finishedError = new AtomicReference<>();

            transport.putObjectMultipart(KEY, 30, 3, part -> RequestBody.ofString("0123456789"), (error, n) -> {
                events.add("finished");
                finishedError.set(error);
            });

            assertThat(events).containsExactly("abort", "finished");
            assertThat(finishedError.get().errorType()).isEqualTo(ErrorType.RETRIES_EXHAUSTED);
            final List<Request> aborts = fakeS3.requests(request -> request.method().equals("DELETE"));
            assertThat(aborts).hasSize(1);
            assertThat(aborts.get(0).path()).isEqualTo("/" + KEY + "?uploadId=" + UPLOAD_ID);
            assertThat(fakeS3.requests(S3ObjectTransportTest::isComplete)).isEmpty();
            verify(metrics, times(3)).addTransferStatusDataPoint(false);
        }

        /**
         * This test aims to verify that a complete answered with an unexpected status after every part landed aborts
         * the upload exactly once before the complete's error and the part count are reported, even when the abort
         * itself fails.
         */
        @Test
        @DisplayName("Failed complete aborts once before reporting")
        void testCompleteFailsAborts() {
            final List<String> events = new CopyOnWriteArrayList<>();
            fakeS3.respondWith(request -> {
                if (isCreate(request)) {
                    return CompletableFuture.completedFuture(FakeResponse.of(200, CREATED_RESPONSE));
                }
                if (isComplete(request)) {
                    events.add("complete");
                    return CompletableFuture.completedFuture(FakeResponse.of(500, "<Error>InternalError</Error>"));
                }
                if (request.method().equals("DELETE")) {
                    events.add("abort");
                    return CompletableFuture.completedFuture(FakeResponse.of(500));
                }
                return CompletableFuture.completedFuture(FakeResponse.of(200).withHeader("ETag", "e"));
            });
            final AtomicReference<S3ClientException> finishedError = new AtomicReference<>();
            final AtomicInteger reportedParts = new AtomicInteger();

            transport.putObjectMultipart(KEY, 30, 3, part -> RequestBody.ofString("0123456789"), (error, n) -> {
                events.add("finished");
                finishedError.set(error);
                reportedParts.set(n);
            });

            assertThat(events).containsExactly("complete", "abort", "finished");
            assertThat(finishedError.get()).isInstanceOf(S3ResponseException.class);
            final S3ResponseException error = (S3ResponseException) finishedError.get();
            assertThat(error.errorType()).isEqualTo(ErrorType.UNEXPECTED_STATUS);
            assertThat(error.getExpectedStatusCode()).isEqualTo(200);
            assertThat(new String(error.getResponseBody(), StandardCharsets.UTF_8)).contains("InternalError");
            assertThat(reportedParts).hasValue(3);
            final List<Request> aborts = fakeS3.requests(request -> request.method().equals("DELETE"));
            assertThat(aborts).hasSize(1);
            assertThat(aborts.get(0).path()).isEqualTo("/" + KEY + "?uploadId=" + UPLOAD_ID);
            verify(metrics, times(3)).addTransferStatusDataPoint(true);
        }

        /**
         * This test aims to verify that a part failing once is retried and the upload still succeeds.
         */
        @Test
        @DisplayName("Transient part failure is retried")
        void testPartRetried() {
            final AtomicInteger secondPartAttempts = new AtomicInteger();
            fakeS3.respondWith(request -> {
                if (isCreate(request)) {
                    return CompletableFuture.completedFuture(FakeResponse.of(200, CREATED_RESPONSE));
                }
                if (request.method().equals("PUT")
                        && partNumberOf(request) == 2
                        && secondPartAttempts.incrementAndGet() == 1) {
                    return CompletableFuture.completedFuture(FakeResponse.of(500));
                }
                return CompletableFuture.completedFuture(FakeResponse.of(200).withHeader("ETag", "e"));
            });
            final Outcome outcome = new Outcome();

            transport.putObjectMultipart(
                    KEY, 3, 3, part -> RequestBody.ofString("x"), (error, n) -> outcome.record(error));

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error).isNull();
            assertThat(secondPartAttempts).hasValue(2);
            assertThat(fakeS3.requests(request -> request.method().equals("PUT"))).hasSize(4);
            verify(metrics).addTransferStatusDataPoint(false);
            verify(metrics, times(3)).addTransferStatusDataPoint(true);
        }

        /**
         * This test aims to verify that the explicit complete and abort operations address the upload by id and
         * check their statuses.
         */
        @Test
        @DisplayName("Complete and abort address the upload")
        void testCompleteAndAbort() {
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(
                    FakeResponse.of(request.method().equals("DELETE") ? 204 : 200)));
            final Outcome completed = new Outcome();
            final Outcome aborted = new Outcome();

            transport.completeMultipartUpload(KEY, UPLOAD_ID, List.of("a"), completed::record);
            transport.abortMultipartUpload(KEY, UPLOAD_ID, aborted::record);

            assertThat(completed.error).isNull();
            assertThat(aborted.error).isNull();
            final List<Request> sent = fakeS3.requests();
            assertThat(sent.get(0).method()).isEqualTo("POST");
            assertThat(sent.get(0).path()).isEqualTo("/" + KEY + "?uploadId=" + UPLOAD_ID);
            assertThat(sent.get(0).header("content-length"))
                    .isEqualTo(Integer.toString(FakeS3.bodyOf(sent.get(0)).length()));
            assertThat(sent.get(1).method()).isEqualTo("DELETE");
            assertThat(sent.get(1).path()).isEqualTo("/" + KEY + "?uploadId=" + UPLOAD_ID);

            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(200)));
            final Outcome abortWithOk = new Outcome();
            transport.abortMultipartUpload(KEY, UPLOAD_ID, abortWithOk::record);
            assertThat(abortWithOk.error.errorType()).isEqualTo(ErrorType.UNEXPECTED_STATUS);
        }
    }

    @Nested
    @DisplayName("Multipart download")
    class MultipartDownload {
        /**
         * This test aims to verify that parts arriving out of order are each handed over with their part state and
         * the download finishes exactly once, after the last part.
         */
        @Test
        @DisplayName("Download finishes after the last part")
        void testOutOfOrder() {
            final Map<Integer, CompletableFuture<FakeResponse>> parts = new ConcurrentHashMap<>();
            fakeS3.respondWith(request -> {
                final CompletableFuture<FakeResponse> response = new CompletableFuture<>();
                parts.put(partNumberOf(request), response);
                return response;
            });
            final Map<Integer, String> received = new ConcurrentHashMap<>();
            final Outcome outcome = new Outcome();

            transport.getObjectMultipart(
                    KEY,
                    3,
                    (part, data) -> received.merge(part.partNumber(), text(data), String::concat),
                    outcome::record);

            assertThat(parts).containsOnlyKeys(1, 2, 3);
            parts.get(3).complete(FakeResponse.of(206, "ccc"));
            parts.get(1).complete(FakeResponse.of(206, "a"));
            assertThat(outcome.calls).hasValue(0);
            parts.get(2).complete(FakeResponse.of(206, "bb"));

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error).isNull();
            assertThat(received).containsExactlyInAnyOrderEntriesOf(Map.of(1, "a", 2, "bb", 3, "ccc"));
            verify(metrics).addDataPoint(MetricName.BYTES_DOWN, 3.0);
            verify(metrics).addDataPoint(MetricName.BYTES_DOWN, 2.0);
            verify(metrics).addDataPoint(MetricName.BYTES_DOWN, 1.0);
        }

        /**
         * This test aims to verify that a failed part download is retried and does not finish the download early.
         */
        @Test
        @DisplayName("Failed part download is retried")
        void testPartRetried() {
            final AtomicInteger firstPartAttempts = new AtomicInteger();
            fakeS3.respondWith(request -> {
                if (partNumberOf(request) == 1 && firstPartAttempts.incrementAndGet() == 1) {
                    return CompletableFuture.completedFuture(FakeResponse.of(503, "busy"));
                }
                return CompletableFuture.completedFuture(FakeResponse.of(206, "data"));
            });
            final Outcome outcome = new Outcome();
            final AtomicInteger chunks = new AtomicInteger();

            transport.getObjectMultipart(KEY, 2, (part, data) -> chunks.incrementAndGet(), outcome::record);

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error).isNull();
            assertThat(firstPartAttempts).hasValue(2);
            assertThat(chunks).hasValue(2);
            verify(metrics).addTransferStatusDataPoint(false);
            verify(metrics, times(2)).addTransferStatusDataPoint(true);
        }

        /**
         * This test aims to verify that a download whose part keeps failing is failed once the retry limit is hit.
         */
        @Test
        @DisplayName("Download fails when retries run out")
        void testRetriesExhausted() {
            transport.close();
            transport = transport(TestConfigs.config(10, 500, 1, TestConfigs.SEED_ADDRESS), TestSigning.PASS_THROUGH);
            fakeS3.respondWith(request -> CompletableFuture.completedFuture(FakeResponse.of(500)));
            final Outcome outcome = new Outcome();

            transport.getObjectMultipart(KEY, 1, (part, data) -> {}, outcome::record);

            assertThat(outcome.calls).hasValue(1);
            assertThat(outcome.error.errorType()).isEqualTo(ErrorType.RETRIES_EXHAUSTED);
            assertThat(fakeS3.requests()).hasSize(2);
            verify(metrics, never()).addTransferStatusDataPoint(true);
            verify(metrics, atLeastOnce()).addDataPoint(eq(MetricName.BYTES_DOWN), anyDouble());
        }
    }

    @Nested
    @DisplayName("Response helpers")
    class Helpers {
        /**
         * This test aims to verify that the upload id is found by its tags and that a missing or empty id is none.
         */
        @Test
        @DisplayName("Upload id is extracted by its tags")
        void testExtractUploadId() {
            assertThat(S3ObjectTransport.extractUploadId(CREATED_RESPONSE)).isEqualTo(UPLOAD_ID);
            assertThat(S3ObjectTransport.extractUploadId("<UploadId>x</UploadId>")).isEqualTo("x");
            assertThat(S3ObjectTransport.extractUploadId("<UploadId></UploadId>")).isNull();
            assertThat(S3ObjectTransport.extractUploadId("<UploadId>dangling")).isNull();
            assertThat(S3ObjectTransport.extractUploadId("")).isNull();
        }

        /**
         * This test aims to verify that an upload without parts still produces a well formed complete body.
         */
        @Test
        @DisplayName("Complete body without parts")
        void testCompleteBodyEmpty() {
            assertThat(S3ObjectTransport.completeMultipartUploadBody(List.of()))
                    .isEqualTo("<?xml version=\"1.0\" encoding=\"UTF-8\" ?>\n"
                            + "<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">\n"
                            + "</CompleteMultipartUpload>");
        }

        /**
         * This test aims to verify that a transport built from configuration derives its endpoint and honours a
         * configured seed address without resolving anything.
         */
        @Test
        @DisplayName("Transport is built from configuration")
        void testCreateFromConfig() {
            final Config config = TestUtils.createTestConfiguration(Map.of(
                    "canary.transport.bucketName", "load-bucket",
                    "canary.transport.regionName", "eu-central-1",
                    "canary.transport.seedAddress", "192.0.2.44"));

            try (S3ObjectTransport created = S3ObjectTransport.create(config, new SimpleMeterRegistry())) {
                assertThat(created.endpoint()).isEqualTo("load-bucket.s3.eu-central-1.amazonaws.com");
                assertThat(created.getAddressForTransfer(12)).isEqualTo("192.0.2.44");
                assertThat(created.getOpenConnectionCount()).isZero();
            }
        }

        /**
         * This test aims to verify that the address count metric is published through the transport.
         */
        @Test
        @DisplayName("Address count metric is published")
        void testEmitAddressCount() {
            transport.emitS3AddressCountMetric(5);
            verify(metrics).addDataPoint(MetricName.S3_ADDRESS_COUNT, 5.0);
        }
    }
}
