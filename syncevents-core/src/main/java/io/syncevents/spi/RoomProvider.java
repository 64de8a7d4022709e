package io.syncevents.spi;

import io.syncevents.room.Room;

import java.util.Optional;

/**
 * Resolves room identifiers to room handles.
 *
 * <p>Resolution may fail when the room is not yet known locally, typically
 * because the room store has not caught up with the transport. The dispatcher
 * treats an empty result as a benign race and skips the event.
 *
 * @see io.syncevents.room.InMemoryRoomDirectory
 */
@FunctionalInterface
public interface RoomProvider {

  /**
   * Looks up a room.
   *
   * @param roomId the room id
   * @return the room handle, or empty if the room is not known locally
   */
  Optional<Room> getRoom(String roomId);
}
