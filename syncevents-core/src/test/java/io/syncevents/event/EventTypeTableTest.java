package io.syncevents.event;

import io.syncevents.context.ContextShape;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeTableTest {

  @Test
  void defaultsCoverEveryKindExceptCustom() {
    EventTypeTable table = EventTypeTable.defaults();

    assertTrue(table.isKnown(EventKind.GLOBAL_ACCOUNT_DATA, "m.ignored_user_list"));
    assertTrue(table.isKnown(EventKind.ROOM_ACCOUNT_DATA, "m.fully_read"));
    assertTrue(table.isKnown(EventKind.EPHEMERAL, "m.receipt"));
    assertTrue(table.isKnown(EventKind.STATE, "m.room.power_levels"));
    assertTrue(table.isKnown(EventKind.MESSAGE, "m.key.verification.done"));
    assertTrue(table.isKnown(EventKind.STRIPPED_STATE, "m.room.member"));
    assertTrue(table.isKnown(EventKind.PRESENCE, "m.presence"));
    assertTrue(table.isKnown(EventKind.NOTIFICATION, "m.notification"));
    assertTrue(table.typesOf(EventKind.CUSTOM).isEmpty());
  }

  @Test
  void sameTypeIsKnownPerKind() {
    EventTypeTable table = EventTypeTable.defaults();

    assertTrue(table.isKnown(EventKind.STATE, "m.room.topic"));
    assertFalse(table.isKnown(EventKind.STRIPPED_STATE, "m.room.topic"));
    assertFalse(table.isKnown(EventKind.MESSAGE, "m.room.member"));
  }

  @Test
  void customTagIsAlwaysRoutable() {
    EventTypeTable empty = EventTypeTable.builder().build();

    assertTrue(empty.isRoutable(EventTypes.CUSTOM_EVENT));
    assertFalse(empty.isRoutable(EventTypes.ROOM_MESSAGE));
    assertFalse(EventTypeTable.defaults().isRoutable(EventTag.of(EventKind.CUSTOM, "org.example.foo")));
  }

  @Test
  void addingRowExtendsCoverage() {
    EventTypeTable table = EventTypeTable.builder()
        .defaults()
        .add(EventKind.STATE, "org.example.room.settings")
        .build();

    assertTrue(table.isKnown(EventKind.STATE, "org.example.room.settings"));
    assertFalse(EventTypeTable.defaults().isKnown(EventKind.STATE, "org.example.room.settings"));
    assertTrue(table.isKnown(EventKind.STATE, "m.room.member"));
  }

  @Test
  void rejectsCustomRowsAndEmptyTypes() {
    assertThrows(IllegalArgumentException.class,
        () -> EventTypeTable.builder().add(EventKind.CUSTOM, "org.example.foo"));
    assertThrows(IllegalArgumentException.class,
        () -> EventTypeTable.builder().add(EventKind.STATE, ""));
    assertThrows(NullPointerException.class,
        () -> EventTypeTable.builder().add(null, "m.room.name"));
  }

  @Test
  void tagToStringUsesWireName() {
    assertEquals("stripped-state:m.room.member", EventTypes.STRIPPED_ROOM_MEMBER.toString());
    assertEquals("custom:*", EventTypes.CUSTOM_EVENT.toString());
  }

  @Test
  void kindsFixAllowedShapes() {
    assertTrue(EventKind.STATE.allows(ContextShape.ROOM));
    assertFalse(EventKind.STATE.allows(ContextShape.GLOBAL));
    assertTrue(EventKind.PRESENCE.allows(ContextShape.GLOBAL));
    assertFalse(EventKind.PRESENCE.allows(ContextShape.ROOM));
    assertEquals(3, EventKind.CUSTOM.allowedShapes().size());
  }
}
