// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link MetricsPublisher} recording into a Micrometer {@link MeterRegistry}. Every data point feeds a
 * {@link DistributionSummary} of the metric's name; transfer outcomes feed the successful and failed transfer
 * counters. The last published address count is also exposed as a gauge.
 */
public final class MicrometerMetricsPublisher implements MetricsPublisher {
    private static final String ADDRESS_GAUGE_SUFFIX = ".current";

    private final Map<MetricName, DistributionSummary> summaries = new EnumMap<>(MetricName.class);
    private final Counter successfulTransfers;
    private final Counter failedTransfers;
    private final AtomicLong lastAddressCount = new AtomicLong();

    /**
     * @param registry the registry to register all meters with
     */
    public MicrometerMetricsPublisher(@NonNull final MeterRegistry registry) {
        Objects.requireNonNull(registry);
        for (final MetricName name : MetricName.values()) {
            summaries.put(
                    name,
                    DistributionSummary.builder(name.meterName())
                            .baseUnit(name.unit())
                            .description(name.description())
                            .register(registry));
        }
        successfulTransfers = Counter.builder(MetricName.SUCCESSFUL_TRANSFER.meterName() + ".count")
                .baseUnit(MetricName.SUCCESSFUL_TRANSFER.unit())
                .description(MetricName.SUCCESSFUL_TRANSFER.description())
                .register(registry);
        failedTransfers = Counter.builder(MetricName.FAILED_TRANSFER.meterName() + ".count")
                .baseUnit(MetricName.FAILED_TRANSFER.unit())
                .description(MetricName.FAILED_TRANSFER.description())
                .register(registry);
        Gauge.builder(MetricName.S3_ADDRESS_COUNT.meterName() + ADDRESS_GAUGE_SUFFIX, lastAddressCount, AtomicLong::get)
                .baseUnit(MetricName.S3_ADDRESS_COUNT.unit())
                .description("Distinct addresses resolved at the last poll")
                .register(registry);
    }

    @Override
    public void addDataPoint(@NonNull final MetricName name, final double value) {
        summaries.get(Objects.requireNonNull(name)).record(value);
        if (name == MetricName.S3_ADDRESS_COUNT) {
            lastAddressCount.set((long) value);
        }
    }

    @Override
    public void addTransferStatusDataPoint(final boolean success) {
        if (success) {
            successfulTransfers.increment();
            summaries.get(MetricName.SUCCESSFUL_TRANSFER).record(1);
        } else {
            failedTransfers.increment();
            summaries.get(MetricName.FAILED_TRANSFER).record(1);
        }
    }
}
