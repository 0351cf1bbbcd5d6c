// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.canary.base.metrics.MetricName;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The bookkeeping of one part of a multipart transfer. Byte counts accumulate while the part is in flight and are
 * published when flushed.
 */
public final class TransferState {
    private final int partIndex;
    private final MetricsPublisher metrics;
    private final AtomicLong pendingBytesUp = new AtomicLong();
    private final AtomicLong pendingBytesDown = new AtomicLong();
    private final AtomicInteger retryCount = new AtomicInteger();

    /**
     * @param partIndex the 0-based index of the part
     * @param metrics receives the flushed byte counts
     */
    public TransferState(final int partIndex, @NonNull final MetricsPublisher metrics) {
        this.partIndex = Preconditions.requireInRange(partIndex, 0, Integer.MAX_VALUE - 1);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * @return the 0-based index used for storage
     */
    public int partIndex() {
        return partIndex;
    }

    /**
     * @return the 1-based number used on the wire
     */
    public int partNumber() {
        return partIndex + 1;
    }

    public void addDataUpMetric(final long bytes) {
        pendingBytesUp.addAndGet(Preconditions.requireWhole(bytes));
    }

    public void addDataDownMetric(final long bytes) {
        pendingBytesDown.addAndGet(Preconditions.requireWhole(bytes));
    }

    /**
     * Publish the bytes sent since the last flush.
     */
    public void flushDataUpMetrics() {
        metrics.addDataPoint(MetricName.BYTES_UP, pendingBytesUp.getAndSet(0));
    }

    /**
     * Publish the bytes received since the last flush.
     */
    public void flushDataDownMetrics() {
        metrics.addDataPoint(MetricName.BYTES_DOWN, pendingBytesDown.getAndSet(0));
    }

    /**
     * @return how often this part has been retried
     */
    public int retryCount() {
        return retryCount.get();
    }

    int incrementRetryCount() {
        return retryCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "TransferState[partNumber=" + partNumber() + ", retries=" + retryCount.get() + "]";
    }
}
