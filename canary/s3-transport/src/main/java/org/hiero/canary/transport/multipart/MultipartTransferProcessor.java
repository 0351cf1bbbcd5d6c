// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.transport.multipart;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.System.Logger;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.hiero.canary.base.s3.ErrorType;
import org.hiero.canary.base.s3.S3TransportException;
import org.hiero.canary.common.utils.Preconditions;

/**
 * Drives the parts of multipart transfers with bounded concurrency. Every part of a queued transfer becomes one work
 * item; at most {@code maxStreams} items are in flight at once. A part reporting {@link PartFinishResponse#RETRY} is
 * queued again, one reporting {@link PartFinishResponse#DONE} is retired. Parts run in no particular order.
 *
 * <p>When {@code maxPartRetries} is positive a part retried more often than that fails its transfer with
 * {@link ErrorType#RETRIES_EXHAUSTED}. Queued parts of finished transfers are dropped without running.
 */
public final class MultipartTransferProcessor {
    private static final Logger LOGGER = System.getLogger(MultipartTransferProcessor.class.getName());

    /** One part waiting to run. */
    private record PartWork(MultipartTransferState transfer, TransferState part) {}

    private final String name;
    private final int maxStreams;
    private final int maxPartRetries;
    private final Executor executor;
    private final Queue<PartWork> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    /**
     * @param name the processor name used in log messages
     * @param maxStreams the ceiling of part operations in flight
     * @param maxPartRetries how often one part may be retried, 0 for unbounded
     * @param executor starts the part operations
     */
    public MultipartTransferProcessor(
            @NonNull final String name,
            final int maxStreams,
            final int maxPartRetries,
            @NonNull final Executor executor) {
        this.name = Preconditions.requireNotBlank(name);
        this.maxStreams = Preconditions.requirePositive(maxStreams);
        this.maxPartRetries = (int) Preconditions.requireWhole(maxPartRetries);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * Queue every part of a transfer.
     *
     * @param transfer the transfer, its process part callback must be set
     */
    public void pushQueue(@NonNull final MultipartTransferState transfer) {
        Objects.requireNonNull(transfer);
        transfer.processPartCallback();
        for (final TransferState part : transfer.parts()) {
            queue.add(new PartWork(transfer, part));
        }
        LOGGER.log(DEBUG, "{0} queued {1} parts of {2}", name, transfer.numParts(), transfer.key());
        drain();
    }

    /**
     * @return the number of part operations currently in flight
     */
    public int inFlightCount() {
        return inFlight.get();
    }

    /**
     * @return the number of parts waiting to run
     */
    public int queuedCount() {
        return queue.size();
    }

    /**
     * Start queued parts until the ceiling is reached or the queue is empty.
     */
    private void drain() {
        while (true) {
            final int current = inFlight.get();
            if (current >= maxStreams) {
                return;
            }
            if (!inFlight.compareAndSet(current, current + 1)) {
                continue;
            }
            final PartWork work = queue.poll();
            if (work == null) {
                inFlight.decrementAndGet();
                // a part queued between poll and release would otherwise wait for the next outcome
                if (queue.isEmpty()) {
                    return;
                }
                continue;
            }
            if (work.transfer().isFinished()) {
                inFlight.decrementAndGet();
                LOGGER.log(DEBUG, "{0} dropped {1} of finished {2}", name, work.part(), work.transfer().key());
                continue;
            }
            try {
                executor.execute(() -> dispatch(work));
            } catch (final RejectedExecutionException e) {
                inFlight.decrementAndGet();
                queue.add(work);
                LOGGER.log(WARNING, name + " could not start a part, executor rejected it", e);
                return;
            }
        }
    }

    private void dispatch(final PartWork work) {
        final AtomicBoolean reported = new AtomicBoolean();
        final MultipartTransferState.PartFinishedCallback partFinished = response -> {
            if (reported.compareAndSet(false, true)) {
                onPartFinished(work, response);
            } else {
                LOGGER.log(WARNING, "{0} ignored second outcome {1} for {2}", name, response, work.part());
            }
        };
        try {
            work.transfer().processPartCallback().processPart(work.part(), partFinished);
        } catch (final RuntimeException e) {
            LOGGER.log(ERROR, "Part operation for %s of %s failed".formatted(work.part(), work.transfer().key()), e);
            partFinished.onPartFinished(PartFinishResponse.RETRY);
        }
    }

    private void onPartFinished(final PartWork work, final PartFinishResponse response) {
        inFlight.decrementAndGet();
        if (response == PartFinishResponse.RETRY) {
            final int retries = work.part().incrementRetryCount();
            final MultipartTransferState transfer = work.transfer();
            if (maxPartRetries > 0 && retries > maxPartRetries) {
                LOGGER.log(
                        ERROR,
                        "{0} gave up on part {1} of {2} after {3} retries",
                        name,
                        work.part().partNumber(),
                        transfer.key(),
                        maxPartRetries);
                transfer.setFinished(new S3TransportException(
                        ErrorType.RETRIES_EXHAUSTED,
                        "Part %d of %s failed %d times"
                                .formatted(work.part().partNumber(), transfer.key(), retries)));
            } else if (!transfer.isFinished()) {
                queue.add(work);
            }
        }
        drain();
    }
}
