// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;

/**
 * Receives the events of one request/response stream. Events arrive in order: headers once, body chunks zero or more
 * times, completion exactly once. Completion also arrives when the stream fails before headers were received.
 */
public interface StreamHandler {
    /**
     * Called once the response status and headers are known.
     *
     * @param statusCode the response status code
     * @param headers the response headers
     */
    default void onResponseHeaders(final int statusCode, @NonNull final HttpHeaders headers) {}

    /**
     * Called for each chunk of the response body. The buffer is only valid for the duration of the call.
     *
     * @param data the chunk
     */
    default void onResponseBody(@NonNull final ByteBuffer data) {}

    /**
     * Called once when the stream ends.
     *
     * @param statusCode the response status code, 0 if no response was received
     * @param error the transport error, null if the exchange completed
     */
    void onStreamComplete(int statusCode, @Nullable Throwable error);
}
