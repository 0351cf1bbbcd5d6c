// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.hiero.canary.base.http.Request;
import org.hiero.canary.base.http.RequestBody;

/**
 * A {@link RequestSigner} implementing AWS signature version 4 with the signature in the {@code Authorization}
 * header. The signed copy of a request carries {@code x-amz-date}, {@code x-amz-content-sha256} and
 * {@code authorization} headers in addition to the original ones; every header of the original request is signed.
 */
public final class SigV4RequestSigner implements RequestSigner {
    /** The SHA-256 hash of an empty body. */
    static final String EMPTY_BODY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    /** The value of x-amz-content-sha256 for a body that is not signed. */
    static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";

    private static final String ALGORITHM_HMAC_SHA256 = "HmacSHA256";
    private static final String SCHEME = "AWS4";
    private static final String ALGORITHM = "HMAC-SHA256";
    private static final String TERMINATOR = "aws4_request";
    private static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_STAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final char QUERY_PARAMETER_SEPARATOR = '&';
    private static final char QUERY_PARAMETER_VALUE_SEPARATOR = '=';
    private static final String HOST_HEADER = "host";

    @NonNull
    @Override
    public CompletableFuture<Request> sign(@NonNull final Request request, @NonNull final SigningConfig signingConfig) {
        Objects.requireNonNull(request);
        Objects.requireNonNull(signingConfig);
        if (request.header(HOST_HEADER) == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Request has no host header and cannot be signed: " + request));
        }
        final CompletableFuture<AwsCredentials> credentials;
        try {
            credentials = Objects.requireNonNull(
                    signingConfig.credentialsProvider().getCredentials(), "credentials provider returned null");
        } catch (final RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return credentials.thenApply(creds -> signWith(request, signingConfig, creds));
    }

    /**
     * Build the signed copy of a request.
     */
    private static Request signWith(
            final Request request, final SigningConfig signingConfig, final AwsCredentials credentials) {
        final ZonedDateTime signingTime = signingConfig.signingTime().atZone(ZoneOffset.UTC);
        final String bodyHash = computeBodyHash(request.body(), signingConfig.bodySigningType());
        final Map<String, String> headers = new LinkedHashMap<>(request.headers());
        headers.put("x-amz-date", DATE_TIME_FORMATTER.format(signingTime));
        headers.put("x-amz-content-sha256", bodyHash);
        final String authorization = computeSignatureForAuthorizationHeader(
                request.method(),
                request.rawPath(),
                extractQueryParameters(request.rawQuery()),
                headers,
                bodyHash,
                signingTime,
                signingConfig.region(),
                signingConfig.service(),
                credentials);
        final Request.Builder builder = request.toBuilder();
        headers.forEach(builder::header);
        builder.header("authorization", authorization);
        return builder.build();
    }

    /**
     * Computes an AWS4 signature for a request, ready for inclusion as an 'Authorization' header.
     *
     * @param httpMethod the HTTP method (GET, POST, PUT, etc.)
     * @param path the percent-encoded request path without the query
     * @param queryParameters the decoded query parameters
     * @param headers all headers to sign, keyed by lower case name
     * @param bodyHash the value of the x-amz-content-sha256 header
     * @param signingTime the time of signing
     * @param regionName the region name
     * @param service the service name
     * @param credentials the signing key pair
     * @return the value of the 'Authorization' header
     */
    static String computeSignatureForAuthorizationHeader(
            final String httpMethod,
            final String path,
            final List<Entry<String, String>> queryParameters,
            final Map<String, String> headers,
            final String bodyHash,
            final ZonedDateTime signingTime,
            final String regionName,
            final String service,
            final AwsCredentials credentials) {
        final String dateTimeStamp = DATE_TIME_FORMATTER.format(signingTime);
        final String dateStamp = DATE_STAMP_FORMATTER.format(signingTime);

        // canonical header names are sorted and joined with ';'
        final String canonicalizedHeaderNames = headers.keySet().stream()
                .map(header -> header.toLowerCase(Locale.ENGLISH))
                .sorted()
                .collect(Collectors.joining(";"));
        // sequential white space in values is compressed to a single space
        final String canonicalizedHeaders = headers.entrySet().stream()
                        .sorted(Entry.comparingByKey(String.CASE_INSENSITIVE_ORDER))
                        .map(entry -> entry.getKey().toLowerCase(Locale.ENGLISH) + ":"
                                + entry.getValue().trim().replaceAll("\\s+", " "))
                        .collect(Collectors.joining("\n"))
                + "\n";

        final String canonicalizedQueryParameters = queryParameters.stream()
                .map(entry -> urlEncode(entry.getKey(), false) + "="
                        + (entry.getValue() == null ? "" : urlEncode(entry.getValue(), false)))
                .sorted()
                .collect(Collectors.joining("&"));

        final String canonicalizedResourcePath = path.isEmpty() ? "/" : path;
        final String canonicalRequest = httpMethod + "\n"
                + canonicalizedResourcePath + "\n"
                + canonicalizedQueryParameters + "\n"
                + canonicalizedHeaders + "\n"
                + canonicalizedHeaderNames + "\n"
                + bodyHash;

        final String scope = dateStamp + "/" + regionName + "/" + service + "/" + TERMINATOR;
        final String stringToSign = SCHEME + "-" + ALGORITHM + "\n" + dateTimeStamp + "\n" + scope + "\n"
                + HexFormat.of().formatHex(sha256(canonicalRequest.getBytes(StandardCharsets.UTF_8)));

        final byte[] kSecret = (SCHEME + credentials.secretKey()).getBytes(StandardCharsets.UTF_8);
        final byte[] kDate = hmac(dateStamp, kSecret);
        final byte[] kRegion = hmac(regionName, kDate);
        final byte[] kService = hmac(service, kRegion);
        final byte[] kSigning = hmac(TERMINATOR, kService);
        final byte[] signature = hmac(stringToSign, kSigning);

        return SCHEME + "-" + ALGORITHM + " Credential=" + credentials.accessKey() + "/" + scope
                + ", SignedHeaders=" + canonicalizedHeaderNames
                + ", Signature=" + HexFormat.of().formatHex(signature);
    }

    /**
     * Extract parameters from a raw query string, in the order they were found. A parameter without '=' has a null
     * value, e.g. {@code uploads} in {@code ?uploads}.
     *
     * @param rawQuery the query without the leading '?', may be null
     * @return the decoded parameters
     */
    static List<Entry<String, String>> extractQueryParameters(@Nullable final String rawQuery) {
        final List<Entry<String, String>> results = new ArrayList<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return results;
        }
        int index = 0;
        final int endIndex = rawQuery.length() - 1;
        while (index <= endIndex) {
            int parameterSeparatorIndex = rawQuery.indexOf(QUERY_PARAMETER_SEPARATOR, index);
            if (parameterSeparatorIndex < 0) {
                parameterSeparatorIndex = endIndex + 1;
            }
            final String pair = rawQuery.substring(index, parameterSeparatorIndex);
            final int nameValueSeparatorIndex = pair.indexOf(QUERY_PARAMETER_VALUE_SEPARATOR);
            final String name;
            final String value;
            if (nameValueSeparatorIndex < 0) {
                name = pair;
                value = null;
            } else {
                name = pair.substring(0, nameValueSeparatorIndex);
                value = pair.substring(nameValueSeparatorIndex + 1);
            }
            if (!name.isEmpty()) {
                results.add(new AbstractMap.SimpleImmutableEntry<>(
                        URLDecoder.decode(name, StandardCharsets.UTF_8),
                        value == null ? null : URLDecoder.decode(value, StandardCharsets.UTF_8)));
            }
            index = parameterSeparatorIndex + 1;
        }
        return results;
    }

    private static String computeBodyHash(@Nullable final RequestBody body, final BodySigningType bodySigningType) {
        if (bodySigningType == BodySigningType.UNSIGNED_PAYLOAD) {
            return UNSIGNED_PAYLOAD;
        }
        if (body == null || body.contentLength() == 0) {
            return EMPTY_BODY_SHA256;
        }
        try (InputStream in = body.openStream()) {
            final MessageDigest md = MessageDigest.getInstance("SHA-256");
            final byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                md.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Signs the given data using HMAC SHA256 with the specified key.
     */
    private static byte[] hmac(final String stringData, final byte[] key) {
        try {
            final Mac mac = Mac.getInstance(ALGORITHM_HMAC_SHA256);
            mac.init(new SecretKeySpec(key, ALGORITHM_HMAC_SHA256));
            return mac.doFinal(stringData.getBytes(StandardCharsets.UTF_8));
        } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Encodes the given value using UTF-8 percent encoding. Object keys are encoded this way before they become part
     * of a request path.
     *
     * @param url the value to encode
     * @param keepPathSlash true if slashes should be preserved
     * @return the encoded value
     */
    public static String urlEncode(final String url, final boolean keepPathSlash) {
        final String encoded = URLEncoder.encode(url, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
        return keepPathSlash ? encoded.replace("%2F", "/") : encoded;
    }

    private static byte[] sha256(final byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
