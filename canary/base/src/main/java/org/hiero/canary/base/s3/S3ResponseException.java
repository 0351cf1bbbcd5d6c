// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.s3;

import edu.umd.cs.findbugs.annotations.Nullable;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map.Entry;

/**
 * A checked exception thrown when an S3 response status is not the one the operation expects.
 */
public final class S3ResponseException extends S3ClientException {
    private static final int MAX_RESPONSE_BODY_STRING_LENGTH = 2048;
    private static final int MAX_HEADER_STRING_LENGTH = 2048;
    private static final String FOUR_SPACE_INDENT = "    ";
    private final int statusCode;
    private final int expectedStatusCode;
    private final byte[] responseBody;
    private final HttpHeaders headers;

    /**
     * @param statusCode the status code the server answered with
     * @param expectedStatusCode the status code the operation needed
     * @param responseBody the response body, if it was kept
     * @param headers the response headers, if any were received
     * @param message the detail message
     */
    public S3ResponseException(
            final int statusCode,
            final int expectedStatusCode,
            @Nullable final byte[] responseBody,
            @Nullable final HttpHeaders headers,
            final String message) {
        super(ErrorType.UNEXPECTED_STATUS, message);
        this.statusCode = statusCode;
        this.expectedStatusCode = expectedStatusCode;
        this.responseBody = responseBody;
        this.headers = headers;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getExpectedStatusCode() {
        return expectedStatusCode;
    }

    @Nullable
    public byte[] getResponseBody() {
        return responseBody;
    }

    @Nullable
    public HttpHeaders getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(getClass().getName());
        final String message = getLocalizedMessage();
        if (message != null) {
            sb.append(": ").append(message);
        }
        sb.append(System.lineSeparator())
                .append(FOUR_SPACE_INDENT)
                .append("Response status code: ")
                .append(statusCode)
                .append(" (expected ")
                .append(expectedStatusCode)
                .append(')');
        if (headers != null && !headers.map().isEmpty()) {
            sb.append(System.lineSeparator()).append(FOUR_SPACE_INDENT).append("Response headers:");
            appendHeaders(sb);
        }
        if (responseBody != null && responseBody.length > 0) {
            sb.append(System.lineSeparator()).append(FOUR_SPACE_INDENT).append("Response body: ");
            final int length = Math.min(responseBody.length, MAX_RESPONSE_BODY_STRING_LENGTH);
            sb.append(new String(responseBody, 0, length, StandardCharsets.UTF_8));
            if (length < responseBody.length) {
                sb.append(" ...");
            }
        }
        return sb.toString();
    }

    /** Append one line per header, stopping once the printed headers reach the size limit. */
    private void appendHeaders(final StringBuilder sb) {
        int printed = 0;
        for (final Entry<String, List<String>> entry : headers.map().entrySet()) {
            final String line = entry.getKey() + ": " + String.join(", ", entry.getValue());
            sb.append(System.lineSeparator()).append(FOUR_SPACE_INDENT.repeat(2));
            if (printed + line.length() > MAX_HEADER_STRING_LENGTH) {
                sb.append("...");
                return;
            }
            sb.append(line);
            printed += line.length();
        }
    }
}
