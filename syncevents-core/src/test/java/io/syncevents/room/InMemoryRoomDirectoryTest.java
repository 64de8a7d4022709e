package io.syncevents.room;

import io.syncevents.sync.InvitedRoom;
import io.syncevents.sync.JoinedRoom;
import io.syncevents.sync.LeftRoom;
import io.syncevents.sync.SyncBatch;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRoomDirectoryTest {

  @Test
  void resolvesPutRooms() {
    InMemoryRoomDirectory rooms = new InMemoryRoomDirectory();
    rooms.put(Room.of("!a:localhost", RoomMembership.JOINED));

    assertEquals(RoomMembership.JOINED, rooms.getRoom("!a:localhost").orElseThrow().membership());
    assertTrue(rooms.getRoom("!b:localhost").isEmpty());
    assertTrue(rooms.getRoom(null).isEmpty());
  }

  @Test
  void applyTracksMembershipOfBatchRooms() {
    InMemoryRoomDirectory rooms = new InMemoryRoomDirectory();
    rooms.apply(SyncBatch.builder()
        .joinedRoom("!a:localhost", JoinedRoom.builder().build())
        .invitedRoom("!b:localhost", InvitedRoom.of())
        .build());
    Room joined = rooms.getRoom("!a:localhost").orElseThrow();

    rooms.apply(SyncBatch.builder()
        .joinedRoom("!a:localhost", JoinedRoom.builder().build())
        .leftRoom("!b:localhost", LeftRoom.builder().build())
        .build());

    assertSame(joined, rooms.getRoom("!a:localhost").orElseThrow());
    assertEquals(RoomMembership.LEFT, rooms.getRoom("!b:localhost").orElseThrow().membership());
    assertEquals(2, rooms.size());
  }

  @Test
  void removeForgetsRoom() {
    InMemoryRoomDirectory rooms = new InMemoryRoomDirectory();
    rooms.put(Room.of("!a:localhost", RoomMembership.INVITED));

    assertTrue(rooms.remove("!a:localhost"));
    assertFalse(rooms.remove("!a:localhost"));
  }

  @Test
  void roomRejectsEmptyId() {
    assertThrows(IllegalArgumentException.class, () -> Room.of("", RoomMembership.JOINED));
  }
}
