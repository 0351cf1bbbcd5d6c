// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The metrics published by the object transport.
 */
public enum MetricName {
    S3_ADDRESS_COUNT("canary.s3.address.count", "addresses", "Distinct addresses resolved for the endpoint"),
    BYTES_UP("canary.transfer.bytes.up", "bytes", "Bytes sent by completed upload parts"),
    BYTES_DOWN("canary.transfer.bytes.down", "bytes", "Bytes received by download parts"),
    SUCCESSFUL_TRANSFER("canary.transfer.successful", "transfers", "Part transfers that succeeded"),
    FAILED_TRANSFER("canary.transfer.failed", "transfers", "Part transfers that failed and were retried");

    private final String meterName;
    private final String unit;
    private final String description;

    MetricName(final String meterName, final String unit, final String description) {
        this.meterName = meterName;
        this.unit = unit;
        this.description = description;
    }

    @NonNull
    public String meterName() {
        return meterName;
    }

    @NonNull
    public String unit() {
        return unit;
    }

    @NonNull
    public String description() {
        return description;
    }
}
