package io.syncevents.room;

import java.util.Objects;

/**
 * Handle of a room known to the local client.
 *
 * <p>Handles come from a {@link io.syncevents.spi.RoomProvider}; room-scoped
 * handlers receive one in their {@link io.syncevents.context.RoomEventContext}.
 * Implementations backed by a room store may expose more than the id and
 * membership.
 */
public interface Room {

  String roomId();

  RoomMembership membership();

  /**
   * Creates a plain handle with no backing store.
   *
   * @param roomId     the room id
   * @param membership the local user's membership
   * @return a new handle
   */
  static Room of(String roomId, RoomMembership membership) {
    return new Basic(roomId, membership);
  }

  /**
   * Value implementation returned by {@link #of}.
   */
  record Basic(String roomId, RoomMembership membership) implements Room {
    public Basic {
      Objects.requireNonNull(roomId, "roomId");
      Objects.requireNonNull(membership, "membership");
      if (roomId.isEmpty()) {
        throw new IllegalArgumentException("roomId cannot be empty");
      }
    }
  }
}
