// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

import static java.lang.System.Logger.Level.DEBUG;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.hiero.canary.base.metrics.MetricsPublisher;
import org.hiero.canary.base.s3.S3ClientException;
import org.hiero.canary.common.utils.Preconditions;

/**
 * The state shared by all parts of one multipart transfer. Parts complete in any order; the transfer finishes
 * exactly once, either when the owner reports the final result or when it fails. Both callbacks are set by the owner
 * before the transfer is queued.
 */
public abstract class MultipartTransferState {
    private static final Logger LOGGER = System.getLogger(MultipartTransferState.class.getName());

    /**
     * Runs the operation of one part.
     */
    @FunctionalInterface
    public interface ProcessPartCallback {
        /**
         * Start the operation of one part. The operation must report exactly one outcome.
         *
         * @param transferState the part
         * @param partFinished receives the outcome
         */
        void processPart(@NonNull TransferState transferState, @NonNull PartFinishedCallback partFinished);
    }

    /**
     * Receives the outcome of one part operation.
     */
    @FunctionalInterface
    public interface PartFinishedCallback {
        void onPartFinished(@NonNull PartFinishResponse response);
    }

    /**
     * Receives the result of the whole transfer.
     */
    @FunctionalInterface
    public interface FinishedCallback {
        /**
         * @param error the failure, null on success
         */
        void onFinished(@Nullable S3ClientException error);
    }

    private final String key;
    private final int numParts;
    private final List<TransferState> parts;
    private final AtomicInteger numPartsCompleted = new AtomicInteger();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile ProcessPartCallback processPartCallback;
    private volatile FinishedCallback finishedCallback;

    protected MultipartTransferState(
            @NonNull final String key, final int numParts, @NonNull final MetricsPublisher metrics) {
        this.key = Preconditions.requireNotBlank(key);
        this.numParts = Preconditions.requirePositive(numParts);
        Objects.requireNonNull(metrics);
        final List<TransferState> partStates = new ArrayList<>(numParts);
        for (int i = 0; i < numParts; i++) {
            partStates.add(new TransferState(i, metrics));
        }
        this.parts = Collections.unmodifiableList(partStates);
    }

    @NonNull
    public String key() {
        return key;
    }

    public int numParts() {
        return numParts;
    }

    /**
     * @return the state of every part, in part order
     */
    @NonNull
    public List<TransferState> parts() {
        return parts;
    }

    /**
     * Set the operation run for each part. Must be set before the transfer is queued.
     *
     * @param processPartCallback the part operation
     */
    public void setProcessPartCallback(@NonNull final ProcessPartCallback processPartCallback) {
        this.processPartCallback = Objects.requireNonNull(processPartCallback);
    }

    /**
     * Set the callback receiving the result of the transfer. Must be set before the transfer can finish.
     *
     * @param finishedCallback called once when the transfer finishes
     */
    public void setFinishedCallback(@NonNull final FinishedCallback finishedCallback) {
        this.finishedCallback = Objects.requireNonNull(finishedCallback);
    }

    @NonNull
    ProcessPartCallback processPartCallback() {
        final ProcessPartCallback callback = processPartCallback;
        if (callback == null) {
            throw new IllegalStateException("No process part callback set for " + key);
        }
        return callback;
    }

    /**
     * Count one more completed part.
     *
     * @return true for exactly the call that completes the last part
     */
    public boolean incNumPartsCompleted() {
        return numPartsCompleted.incrementAndGet() == numParts;
    }

    public int numPartsCompleted() {
        return numPartsCompleted.get();
    }

    /**
     * @return true once the transfer has finished, successfully or not
     */
    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Finish the transfer. Only the first call has an effect.
     *
     * @param error the failure, null on success
     * @return true if this call finished the transfer
     */
    public boolean setFinished(@Nullable final S3ClientException error) {
        final FinishedCallback callback = finishedCallback;
        if (callback == null) {
            throw new IllegalStateException("No finished callback set for " + key);
        }
        if (!finished.compareAndSet(false, true)) {
            LOGGER.log(DEBUG, "Transfer of {0} already finished, ignoring result {1}", key, error);
            return false;
        }
        callback.onFinished(error);
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[key=" + key + ", parts=" + numPartsCompleted.get() + "/" + numParts
                + ", finished=" + finished.get() + "]";
    }
}
