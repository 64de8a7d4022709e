package io.syncevents.room;

import io.syncevents.spi.RoomProvider;
import io.syncevents.sync.SyncBatch;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, in-memory {@link RoomProvider}.
 *
 * <p>The transport layer calls {@link #apply(SyncBatch)} before handing the batch
 * to the client, so every room in the batch resolves with its current
 * membership. Rooms can also be added and removed directly.
 */
public final class InMemoryRoomDirectory implements RoomProvider {

  private final Map<String, Room> rooms = new ConcurrentHashMap<>();

  @Override
  public Optional<Room> getRoom(String roomId) {
    if (roomId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rooms.get(roomId));
  }

  /**
   * Adds or replaces a room.
   *
   * @param room the room handle
   */
  public void put(Room room) {
    Objects.requireNonNull(room, "room");
    rooms.put(room.roomId(), room);
  }

  /**
   * Removes a room.
   *
   * @param roomId the room id
   * @return {@code true} if the room was known
   */
  public boolean remove(String roomId) {
    return rooms.remove(roomId) != null;
  }

  /**
   * Records the membership of every room in the batch. Rooms already known with
   * the same membership keep their existing handle.
   *
   * @param batch the sync batch
   */
  public void apply(SyncBatch batch) {
    Objects.requireNonNull(batch, "batch");
    batch.joinedRooms().keySet().forEach(id -> update(id, RoomMembership.JOINED));
    batch.leftRooms().keySet().forEach(id -> update(id, RoomMembership.LEFT));
    batch.invitedRooms().keySet().forEach(id -> update(id, RoomMembership.INVITED));
  }

  private void update(String roomId, RoomMembership membership) {
    rooms.compute(roomId, (id, existing) ->
        existing != null && existing.membership() == membership ? existing : Room.of(id, membership));
  }

  public int size() {
    return rooms.size();
  }
}
