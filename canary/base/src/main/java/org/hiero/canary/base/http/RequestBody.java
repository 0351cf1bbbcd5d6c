// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The body of an outbound request. A body declares its length up front, the length becomes the
 * {@code content-length} header, and can be opened more than once so a failed part can be sent again.
 */
public interface RequestBody {
    /**
     * @return the number of bytes {@link #openStream()} yields
     */
    long contentLength();

    /**
     * Open a fresh stream over the body content.
     *
     * @return a new input stream positioned at the first byte
     */
    @NonNull
    InputStream openStream();

    /**
     * @param content the body content, not copied
     * @return a body backed by the given bytes
     */
    @NonNull
    static RequestBody ofBytes(@NonNull final byte[] content) {
        Objects.requireNonNull(content);
        return new RequestBody() {
            @Override
            public long contentLength() {
                return content.length;
            }

            @NonNull
            @Override
            public InputStream openStream() {
                return new ByteArrayInputStream(content);
            }
        };
    }

    /**
     * @param content the body text, encoded as UTF-8
     * @return a body backed by the encoded text
     */
    @NonNull
    static RequestBody ofString(@NonNull final String content) {
        return ofBytes(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param contentLength the declared length of every stream the supplier returns
     * @param streamSupplier opens a new stream over the content on each call
     * @return a body of the declared length read from the supplied streams
     */
    @NonNull
    static RequestBody ofInputStream(final long contentLength, @NonNull final Supplier<InputStream> streamSupplier) {
        Preconditions.requireWhole(contentLength);
        Objects.requireNonNull(streamSupplier);
        return new RequestBody() {
            @Override
            public long contentLength() {
                return contentLength;
            }

            @NonNull
            @Override
            public InputStream openStream() {
                return Objects.requireNonNull(streamSupplier.get(), "streamSupplier returned null");
            }
        };
    }
}
