package io.syncevents.sync;

import io.syncevents.EventEnvelope;
import io.syncevents.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncResponseReaderTest {

  private static final String ROOM_ID = "!SVkFJHzfwvuaIEawgC:localhost";

  private final SyncResponseReader reader = new SyncResponseReader();

  @Test
  void readsJoinedRoomCollections() {
    SyncBatch batch = reader.read(Fixtures.load("joined_sync.json"));

    assertEquals("s526_47314_0_7_1_1_1_11444_1", batch.nextBatch());
    assertEquals(1, batch.accountData().size());
    assertEquals(1, batch.presence().size());
    JoinedRoom room = batch.joinedRooms().get(ROOM_ID);
    assertNotNull(room);
    assertEquals(1, room.ephemeral().size());
    assertEquals(1, room.accountData().size());
    assertEquals(5, room.state().size());
    assertEquals(3, room.timeline().size());
    assertEquals(1, batch.notifications().get(ROOM_ID).size());
    assertEquals(13, batch.size());
  }

  @Test
  void bindsRoomEnvelopesToTheirRoom() {
    SyncBatch batch = reader.read(Fixtures.load("joined_sync.json"));

    JoinedRoom room = batch.joinedRooms().get(ROOM_ID);
    for (EventEnvelope envelope : room.timeline()) {
      assertEquals(ROOM_ID, envelope.roomId());
    }
    assertEquals(ROOM_ID, batch.notifications().get(ROOM_ID).get(0).roomId());
    assertNull(batch.accountData().get(0).roomId());
  }

  @Test
  void takesTypeFromPayload() {
    SyncBatch batch = reader.read(Fixtures.load("joined_sync.json"));

    List<EventEnvelope> state = batch.joinedRooms().get(ROOM_ID).state();
    assertEquals("m.room.join_rules", state.get(0).eventType());
    assertEquals("m.room.canonical_alias", state.get(4).eventType());
    assertEquals("m.notification", batch.notifications().get(ROOM_ID).get(0).eventType());
  }

  @Test
  void readsInvitedRooms() {
    SyncBatch batch = reader.read(Fixtures.load("invite_sync.json"));

    InvitedRoom room = batch.invitedRooms().get("!696r7674:example.com");
    assertEquals(2, room.inviteState().size());
    assertTrue(batch.joinedRooms().isEmpty());
  }

  @Test
  void keepsRoomOrder() {
    SyncBatch batch = reader.read("{\"rooms\":{\"join\":{"
        + "\"!c:localhost\":{},\"!a:localhost\":{},\"!b:localhost\":{}}}}");

    assertEquals(List.of("!c:localhost", "!a:localhost", "!b:localhost"),
        List.copyOf(batch.joinedRooms().keySet()));
    assertTrue(batch.isEmpty());
  }

  @Test
  void nonObjectEventsBecomeUntypedEnvelopes() {
    SyncBatch batch = reader.read("{\"account_data\":{\"events\":[42,{\"type\":\"\",\"content\":{}}]}}");

    assertEquals(2, batch.accountData().size());
    assertEquals("42", batch.accountData().get(0).payloadJson());
    assertNull(batch.accountData().get(0).eventType());
    assertNull(batch.accountData().get(1).eventType());
  }

  @Test
  void oversizedEventIsDroppedAlone() {
    String body = "x".repeat(EventEnvelope.MAX_PAYLOAD_BYTES + 1);
    String json = "{\"presence\":{\"events\":[{\"type\":\"m.presence\",\"sender\":\"@a:localhost\","
        + "\"content\":{\"presence\":\"online\"}}]},"
        + "\"rooms\":{\"join\":{\"!a:localhost\":{\"timeline\":{\"events\":["
        + "{\"type\":\"m.room.message\",\"event_id\":\"$big\",\"sender\":\"@a:localhost\","
        + "\"content\":{\"msgtype\":\"m.text\",\"body\":\"" + body + "\"}},"
        + "{\"type\":\"m.room.message\",\"event_id\":\"$small\",\"sender\":\"@a:localhost\","
        + "\"content\":{\"msgtype\":\"m.text\",\"body\":\"hi\"}}]}}}}}";

    SyncBatch batch = reader.read(json);

    assertEquals(1, batch.presence().size());
    List<EventEnvelope> timeline = batch.joinedRooms().get("!a:localhost").timeline();
    assertEquals(1, timeline.size());
    assertTrue(timeline.get(0).payloadJson().contains("$small"));
  }

  @Test
  void emptyResponseYieldsEmptyBatch() {
    SyncBatch batch = reader.read("{}");

    assertTrue(batch.isEmpty());
    assertNull(batch.nextBatch());
  }

  @Test
  void rejectsNonObjectBody() {
    assertThrows(IllegalArgumentException.class, () -> reader.read("[]"));
    assertThrows(IllegalArgumentException.class, () -> reader.read("not json"));
    assertThrows(IllegalArgumentException.class, () -> reader.read(""));
  }
}
