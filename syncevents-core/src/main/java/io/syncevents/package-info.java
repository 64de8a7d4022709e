/**
 * Typed event dispatch for chat-protocol sync batches.
 *
 * <p>{@link io.syncevents.SyncClient} is the entry point: applications register
 * handlers per {@link io.syncevents.event.EventTag} and hand each
 * {@link io.syncevents.sync.SyncBatch} to {@link io.syncevents.SyncClient#handleSync}.
 */
package io.syncevents;
