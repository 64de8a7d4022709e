package io.syncevents.context;

import io.syncevents.SyncClient;
import io.syncevents.room.Room;

import java.util.Objects;

/**
 * Context for handlers of room-scoped events.
 *
 * @param client the client that dispatched the event
 * @param room   the room the event appeared in, never {@code null}
 * @param raw    the verbatim event JSON, for "view source"-like features
 */
public record RoomEventContext(SyncClient client, Room room, String raw) {

  public RoomEventContext {
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(room, "room");
    Objects.requireNonNull(raw, "raw");
  }
}
