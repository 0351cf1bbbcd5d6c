// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The sink for transport metrics. Implementations must be safe to call from any thread.
 */
public interface MetricsPublisher {
    /**
     * Record one numeric data point.
     *
     * @param name the metric
     * @param value the value of the data point
     */
    void addDataPoint(@NonNull MetricName name, double value);

    /**
     * Record the outcome of one part transfer.
     *
     * @param success true if the part succeeded
     */
    void addTransferStatusDataPoint(boolean success);
}
