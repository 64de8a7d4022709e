package io.syncevents.spring.boot;

import io.syncevents.EventEnvelope;
import io.syncevents.SyncClient;
import io.syncevents.SyncEvent;
import io.syncevents.context.GlobalEventContext;
import io.syncevents.context.RoomEventContext;
import io.syncevents.event.CustomEventKind;
import io.syncevents.event.EventKind;
import io.syncevents.handler.EventHandlerException;
import io.syncevents.room.InMemoryRoomDirectory;
import io.syncevents.room.Room;
import io.syncevents.room.RoomMembership;
import io.syncevents.sync.JoinedRoom;
import io.syncevents.sync.SyncBatch;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SyncEventHandlerRegistrarTest {

  private static final String ROOM_ID = "!SVkFJHzfwvuaIEawgC:localhost";

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(SyncEventsAutoConfiguration.class));

  @Test
  void registersEveryAnnotatedMethod() {
    runner.withUserConfiguration(RecordingConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertEquals(4, ctx.getBean(SyncClient.class).handlerCount());
    });
  }

  @Test
  void invokesHandlersWithTheirContextShape() {
    runner.withUserConfiguration(RecordingConfig.class).run(ctx -> {
      ctx.getBean(InMemoryRoomDirectory.class).put(Room.of(ROOM_ID, RoomMembership.JOINED));

      var summary = ctx.getBean(SyncClient.class).handleSync(batch());

      assertEquals(4, summary.invocations());
      assertEquals(0, summary.failures());
      assertEquals(0, summary.aborted());
      var seen = ctx.getBean(RecordingHandlers.class).seen;
      assertEquals(4, seen.size());
      // both message handlers share a tag; their relative order follows method discovery
      assertEquals(Set.of("room " + ROOM_ID + " $msg", "plain $msg"), Set.copyOf(seen.subList(0, 2)));
      assertEquals(List.of("custom message org.example.poll", "global @alice:localhost"), seen.subList(2, 4));
    });
  }

  @Test
  void checkedExceptionIsReportedAsFailure() {
    runner.withUserConfiguration(FailingConfig.class).run(ctx -> {
      ctx.getBean(InMemoryRoomDirectory.class).put(Room.of(ROOM_ID, RoomMembership.JOINED));

      var summary = ctx.getBean(SyncClient.class).handleSync(batch());

      assertEquals(2, summary.invocations());
      assertEquals(1, summary.failures());
      assertEquals(1, summary.aborted());
    });
  }

  @Test
  void failsWhenReturnTypeIsNotVoid() {
    runner.withUserConfiguration(NonVoidConfig.class).run(ctx ->
        assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure()));
  }

  @Test
  void failsOnUnsupportedParameters() {
    runner.withUserConfiguration(BadParametersConfig.class).run(ctx ->
        assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure()));
  }

  @Test
  void failsWhenTypeMissing() {
    runner.withUserConfiguration(MissingTypeConfig.class).run(ctx ->
        assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure()));
  }

  @Test
  void failsWhenShapeNotAllowedForKind() {
    runner.withUserConfiguration(WrongShapeConfig.class).run(ctx -> {
      var failure = ctx.getStartupFailure();
      assertInstanceOf(BeanCreationException.class, failure);
      assertInstanceOf(IllegalArgumentException.class, failure.getCause());
    });
  }

  @Test
  void failsWhenTypeIsNotRoutable() {
    runner.withUserConfiguration(UnknownTypeConfig.class).run(ctx ->
        assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure()));
  }

  // ── Test support ─────────────────────────────────────────────

  private static SyncBatch batch() {
    return SyncBatch.builder()
        .joinedRoom(ROOM_ID, JoinedRoom.builder()
            .timeline(
                EventEnvelope.of("m.room.message",
                    "{\"type\":\"m.room.message\",\"event_id\":\"$msg\",\"sender\":\"@example:localhost\","
                        + "\"content\":{\"msgtype\":\"m.text\",\"body\":\"hi\"}}"),
                EventEnvelope.of("org.example.poll",
                    "{\"type\":\"org.example.poll\",\"event_id\":\"$poll\",\"sender\":\"@example:localhost\","
                        + "\"content\":{}}"))
            .build())
        .presence(EventEnvelope.of("m.presence",
            "{\"type\":\"m.presence\",\"sender\":\"@alice:localhost\",\"content\":{\"presence\":\"online\"}}"))
        .build();
  }

  static class RecordingHandlers {
    final List<String> seen = new ArrayList<>();

    @SyncEventHandler(kind = EventKind.MESSAGE, type = "m.room.message")
    void onMessageInRoom(SyncEvent event, RoomEventContext ctx) {
      seen.add("room " + ctx.room().roomId() + " " + event.eventId());
    }

    @SyncEventHandler(kind = EventKind.MESSAGE, type = "m.room.message")
    public void onMessage(SyncEvent event) {
      seen.add("plain " + event.eventId());
    }

    @SyncEventHandler(kind = EventKind.CUSTOM)
    void onCustom(SyncEvent event) {
      assertEquals(CustomEventKind.MESSAGE, event.customKind());
      seen.add("custom " + event.customKind().wireName() + " " + event.eventType());
    }

    @SyncEventHandler(kind = EventKind.PRESENCE, type = "m.presence")
    void onPresence(SyncEvent event, GlobalEventContext ctx) {
      assertNotNull(ctx.client());
      seen.add("global " + event.sender());
    }

    void notAHandler(SyncEvent event) {
      seen.add("never");
    }
  }

  static class FailingHandlers {
    @SyncEventHandler(kind = EventKind.MESSAGE, type = "m.room.message")
    void rejects(SyncEvent event) throws EventHandlerException {
      throw new EventHandlerException("rejected " + event.eventId());
    }

    @SyncEventHandler(kind = EventKind.PRESENCE, type = "m.presence")
    void crashes(SyncEvent event) {
      throw new IllegalStateException("boom");
    }
  }

  static class NonVoidHandlers {
    @SyncEventHandler(kind = EventKind.MESSAGE, type = "m.room.message")
    String onMessage(SyncEvent event) {
      return "nope";
    }
  }

  static class BadParameterHandlers {
    @SyncEventHandler(kind = EventKind.MESSAGE, type = "m.room.message")
    void onMessage(String raw) {
    }
  }

  static class MissingTypeHandlers {
    @SyncEventHandler(kind = EventKind.STATE)
    void onState(SyncEvent event) {
    }
  }

  static class WrongShapeHandlers {
    @SyncEventHandler(kind = EventKind.PRESENCE, type = "m.presence")
    void onPresence(SyncEvent event, RoomEventContext ctx) {
    }
  }

  static class UnknownTypeHandlers {
    @SyncEventHandler(kind = EventKind.MESSAGE, type = "org.example.unknown")
    void onUnknown(SyncEvent event) {
    }
  }

  @Configuration
  static class RecordingConfig {
    @Bean
    RecordingHandlers recordingHandlers() {
      return new RecordingHandlers();
    }
  }

  @Configuration
  static class FailingConfig {
    @Bean
    FailingHandlers failingHandlers() {
      return new FailingHandlers();
    }
  }

  @Configuration
  static class NonVoidConfig {
    @Bean
    NonVoidHandlers nonVoidHandlers() {
      return new NonVoidHandlers();
    }
  }

  @Configuration
  static class BadParametersConfig {
    @Bean
    BadParameterHandlers badParameterHandlers() {
      return new BadParameterHandlers();
    }
  }

  @Configuration
  static class MissingTypeConfig {
    @Bean
    MissingTypeHandlers missingTypeHandlers() {
      return new MissingTypeHandlers();
    }
  }

  @Configuration
  static class WrongShapeConfig {
    @Bean
    WrongShapeHandlers wrongShapeHandlers() {
      return new WrongShapeHandlers();
    }
  }

  @Configuration
  static class UnknownTypeConfig {
    @Bean
    UnknownTypeHandlers unknownTypeHandlers() {
      return new UnknownTypeHandlers();
    }
  }
}
