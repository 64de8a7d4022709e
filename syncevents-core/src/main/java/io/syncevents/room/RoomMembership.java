package io.syncevents.room;

/**
 * Membership of the local user in a room, mirroring the joined, left and
 * invited buckets of a sync batch.
 */
public enum RoomMembership {
  JOINED,
  LEFT,
  INVITED
}
