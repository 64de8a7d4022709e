package io.syncevents.handler;

import io.syncevents.SyncEvent;

/**
 * Handler that receives the event only.
 *
 * <p>Throwing a checked exception reports a typed failure; an unchecked
 * exception is an abnormal termination. Either way the remaining handlers still
 * run.
 */
@FunctionalInterface
public interface EventHandler {

  void handle(SyncEvent event) throws Exception;
}
