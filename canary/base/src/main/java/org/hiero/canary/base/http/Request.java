// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.hiero.canary.common.utils.Preconditions;

/**
 * An immutable outbound HTTP request: method, path with optional query, headers and an optional body. The request
 * carries no scheme or authority; the connection it is streamed on decides where it goes. Header names are stored in
 * lower case, in insertion order.
 */
public final class Request {
    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final RequestBody body;

    private Request(final Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
    }

    /**
     * @param method the HTTP method, e.g. PUT
     * @param path the path including any query, must start with '/'
     * @return a new builder
     */
    @NonNull
    public static Builder newBuilder(@NonNull final String method, @NonNull final String path) {
        return new Builder(method, path);
    }

    /**
     * @return a builder pre-filled with this request's values
     */
    @NonNull
    public Builder toBuilder() {
        final Builder builder = new Builder(method, path);
        builder.headers.putAll(headers);
        builder.body = body;
        return builder;
    }

    @NonNull
    public String method() {
        return method;
    }

    /**
     * @return the path including the query, e.g. {@code /key?partNumber=1&uploadId=abc}
     */
    @NonNull
    public String path() {
        return path;
    }

    /**
     * @return the path without the query
     */
    @NonNull
    public String rawPath() {
        final int queryStart = path.indexOf('?');
        return queryStart < 0 ? path : path.substring(0, queryStart);
    }

    /**
     * @return the query without the leading '?', or null if the path has none
     */
    @Nullable
    public String rawQuery() {
        final int queryStart = path.indexOf('?');
        return queryStart < 0 ? null : path.substring(queryStart + 1);
    }

    /**
     * @return all headers keyed by lower case name
     */
    @NonNull
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * @param name the header name, any case
     * @return the header value, or null if the header is not set
     */
    @Nullable
    public String header(@NonNull final String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Nullable
    public RequestBody body() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

    /**
     * Builder for {@link Request}.
     */
    public static final class Builder {
        private final String method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private RequestBody body;

        private Builder(final String method, final String path) {
            this.method = Preconditions.requireNotBlank(method).toUpperCase(Locale.ROOT);
            this.path = Objects.requireNonNull(path);
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException("Request path must start with '/': " + path);
            }
        }

        /**
         * Set a header, replacing any previous value of the same name.
         *
         * @param name the header name, any case
         * @param value the header value
         * @return this builder
         */
        @NonNull
        public Builder header(@NonNull final String name, @NonNull final String value) {
            headers.put(Preconditions.requireNotBlank(name).toLowerCase(Locale.ROOT), Objects.requireNonNull(value));
            return this;
        }

        /**
         * @param body the request body, null for none
         * @return this builder
         */
        @NonNull
        public Builder body(@Nullable final RequestBody body) {
            this.body = body;
            return this;
        }

        @NonNull
        public Request build() {
            return new Request(this);
        }
    }
}
