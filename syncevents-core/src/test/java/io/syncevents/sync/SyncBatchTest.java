package io.syncevents.sync;

import io.syncevents.EventEnvelope;
import io.syncevents.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncBatchTest {

  @Test
  void bindsEnvelopesToTheirRoom() {
    SyncBatch batch = SyncBatch.builder()
        .joinedRoom("!a:localhost", JoinedRoom.builder().timeline(TestEvents.textMessage("$1", "hi")).build())
        .leftRoom("!b:localhost", LeftRoom.builder().state(TestEvents.powerLevels("$2")).build())
        .invitedRoom("!c:localhost", InvitedRoom.of(TestEvents.stripped("m.room.name", "", "{}")))
        .build();

    assertEquals("!a:localhost", batch.joinedRooms().get("!a:localhost").timeline().get(0).roomId());
    assertEquals("!b:localhost", batch.leftRooms().get("!b:localhost").state().get(0).roomId());
    assertEquals("!c:localhost", batch.invitedRooms().get("!c:localhost").inviteState().get(0).roomId());
    assertEquals(3, batch.size());
  }

  @Test
  void collectionsAreImmutable() {
    SyncBatch batch = SyncBatch.builder()
        .presence(TestEvents.presence("@a:localhost"))
        .notifications("!a:localhost", TestEvents.notification("{}"))
        .build();
    EventEnvelope extra = TestEvents.presence("@b:localhost");

    assertThrows(UnsupportedOperationException.class, () -> batch.presence().add(extra));
    assertThrows(UnsupportedOperationException.class, () -> batch.notifications().get("!a:localhost").add(extra));
    assertThrows(UnsupportedOperationException.class, () -> batch.joinedRooms().clear());
  }

  @Test
  void replacingRoomKeepsPosition() {
    SyncBatch batch = SyncBatch.builder()
        .joinedRoom("!a:localhost", JoinedRoom.builder().build())
        .joinedRoom("!b:localhost", JoinedRoom.builder().build())
        .joinedRoom("!a:localhost", JoinedRoom.builder().timeline(TestEvents.textMessage("$1", "hi")).build())
        .build();

    assertEquals(List.of("!a:localhost", "!b:localhost"), List.copyOf(batch.joinedRooms().keySet()));
    assertEquals(1, batch.joinedRooms().get("!a:localhost").timeline().size());
  }

  @Test
  void rejectsEmptyRoomId() {
    assertThrows(IllegalArgumentException.class,
        () -> SyncBatch.builder().joinedRoom("", JoinedRoom.builder().build()));
    assertThrows(NullPointerException.class,
        () -> SyncBatch.builder().notifications(null, TestEvents.notification("{}")));
  }
}
