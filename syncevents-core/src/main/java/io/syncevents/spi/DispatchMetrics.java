package io.syncevents.spi;

import io.syncevents.dispatch.SkipReason;
import io.syncevents.event.EventTag;

/**
 * Observability hook for exporting dispatch counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implementations
 * that hold backend resources may also implement {@link AutoCloseable}; the
 * client closes them on shutdown.
 */
public interface DispatchMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    DispatchMetrics NOOP = new Noop();

    /**
     * Increments the count of handler invocations that completed normally.
     */
    void incrementHandlerSuccess();

    /**
     * Increments the count of handler invocations that reported a typed failure.
     */
    void incrementHandlerFailure();

    /**
     * Increments the count of handler invocations that terminated abnormally.
     */
    void incrementHandlerAborted();

    /**
     * Increments the count of envelopes delivered to at least one handler.
     */
    void incrementEnvelopeDelivered();

    /**
     * Increments the count of envelopes that reached no handler.
     *
     * @param reason why the envelope was skipped
     */
    void incrementEnvelopeSkipped(SkipReason reason);

    /**
     * Records the time spent in one handler invocation.
     *
     * @param tag           the tag the handler is registered under
     * @param durationNanos invocation time in nanoseconds (always non-negative)
     */
    default void recordHandlerDurationNanos(EventTag tag, long durationNanos) {
    }

    /**
     * Records the time spent dispatching one whole batch.
     *
     * @param durationMs pass duration in milliseconds (always non-negative)
     */
    default void recordBatchDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements DispatchMetrics {
        @Override
        public void incrementHandlerSuccess() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void incrementHandlerAborted() {
        }

        @Override
        public void incrementEnvelopeDelivered() {
        }

        @Override
        public void incrementEnvelopeSkipped(SkipReason reason) {
        }
    }
}
