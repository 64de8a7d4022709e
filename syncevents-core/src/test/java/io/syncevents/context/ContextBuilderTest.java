package io.syncevents.context;

import io.syncevents.EventEnvelope;
import io.syncevents.SyncClient;
import io.syncevents.SyncEvent;
import io.syncevents.TestEvents;
import io.syncevents.classify.EventClassifier;
import io.syncevents.event.EventCategory;
import io.syncevents.event.EventTypeTable;
import io.syncevents.handler.EventHandler;
import io.syncevents.handler.GlobalEventHandler;
import io.syncevents.handler.RoomEventHandler;
import io.syncevents.room.Room;
import io.syncevents.room.RoomMembership;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextBuilderTest {

  private final SyncClient client = SyncClient.builder().roomProvider(id -> Optional.empty()).build();
  private final ContextBuilder builder = new ContextBuilder(client);

  @AfterEach
  void tearDown() {
    client.close();
  }

  private static SyncEvent event(EventEnvelope envelope, EventCategory category) throws Exception {
    return new SyncEvent(envelope, new EventClassifier(EventTypeTable.defaults()).classify(envelope, category));
  }

  @Test
  void roomContextCarriesClientRoomAndRawJson() throws Exception {
    EventEnvelope envelope = TestEvents.textMessage("$1", "hi").withRoomId(TestEvents.ROOM_ID);
    Room room = Room.of(TestEvents.ROOM_ID, RoomMembership.JOINED);

    RoomEventContext context = builder.roomContext(event(envelope, EventCategory.TIMELINE), room);

    assertSame(client, context.client());
    assertSame(room, context.room());
    assertEquals(envelope.payloadJson(), context.raw());
  }

  @Test
  void globalContextCarriesClientAndRawJson() throws Exception {
    EventEnvelope envelope = TestEvents.presence("@a:localhost");

    GlobalEventContext context = builder.globalContext(event(envelope, EventCategory.PRESENCE));

    assertSame(client, context.client());
    assertEquals(envelope.payloadJson(), context.raw());
  }

  @Test
  void roomContextWithoutRoomFailsFast() throws Exception {
    SyncEvent event = event(TestEvents.textMessage("$2", "hi"), EventCategory.TIMELINE);

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> builder.roomContext(event, null));
    assertTrue(e.getMessage().contains("message:m.room.message"));
  }

  @Test
  void shapesBindCallbackInterfaces() {
    assertEquals(EventHandler.class, ContextShape.NONE.callbackType());
    assertEquals(RoomEventHandler.class, ContextShape.ROOM.callbackType());
    assertEquals(GlobalEventHandler.class, ContextShape.GLOBAL.callbackType());
  }
}
