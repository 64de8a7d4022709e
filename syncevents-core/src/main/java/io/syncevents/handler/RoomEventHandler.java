package io.syncevents.handler;

import io.syncevents.SyncEvent;
import io.syncevents.context.RoomEventContext;

/**
 * Handler of room-scoped events that also receives the client, the room and
 * the raw JSON.
 */
@FunctionalInterface
public interface RoomEventHandler {

  void handle(SyncEvent event, RoomEventContext context) throws Exception;
}
