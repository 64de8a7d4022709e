/**
 * Dispatch of sync batches to registered handlers.
 *
 * <p>{@link io.syncevents.dispatch.SyncDispatcher} walks a batch in a fixed
 * order, classifies each envelope, builds the contexts its handlers need, and
 * invokes them one after another. {@link io.syncevents.dispatch.ResultReporter}
 * turns each invocation into a {@link io.syncevents.dispatch.HandlerResult}.
 */
package io.syncevents.dispatch;
