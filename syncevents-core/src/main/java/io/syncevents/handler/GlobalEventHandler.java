package io.syncevents.handler;

import io.syncevents.SyncEvent;
import io.syncevents.context.GlobalEventContext;

/**
 * Handler of global events (account data, presence) that also receives the
 * client and the raw JSON.
 */
@FunctionalInterface
public interface GlobalEventHandler {

  void handle(SyncEvent event, GlobalEventContext context) throws Exception;
}
