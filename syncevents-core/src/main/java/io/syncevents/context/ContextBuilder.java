package io.syncevents.context;

import io.syncevents.SyncClient;
import io.syncevents.SyncEvent;
import io.syncevents.room.Room;

import java.util.Objects;

/**
 * Builds the contexts handed to {@link ContextShape#ROOM} and
 * {@link ContextShape#GLOBAL} handlers.
 *
 * <p>The dispatcher resolves the room before calling this class and builds
 * each context at most once per envelope.
 */
public class ContextBuilder {
  private final SyncClient client;

  public ContextBuilder(SyncClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * Builds a room context.
   *
   * @param event the event
   * @param room  the resolved room
   * @return the context
   * @throws IllegalStateException if {@code room} is {@code null}
   */
  public RoomEventContext roomContext(SyncEvent event, Room room) {
    if (room == null) {
      throw new IllegalStateException("Room context for " + event.tag()
          + " requested without a resolved room (roomId=" + event.roomId() + ")");
    }
    return new RoomEventContext(client, room, event.raw());
  }

  public GlobalEventContext globalContext(SyncEvent event) {
    return new GlobalEventContext(client, event.raw());
  }

  public SyncClient client() {
    return client;
  }
}
