package io.syncevents.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncevents.EventEnvelope;
import io.syncevents.util.JsonCodec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Converts a {@code /sync} response body into a {@link SyncBatch}.
 *
 * <p>Only the structure is read: which collection each event sits in, its
 * {@code type} and the room it belongs to. Event payloads are not validated
 * here; an element that is not an object still becomes an envelope and is
 * dropped later by the classifier. An event above
 * {@link EventEnvelope#MAX_PAYLOAD_BYTES} is dropped here, alone. Notifications
 * are read from an optional top-level {@code notifications} object mapping room ids to arrays, as written
 * by a push-rule evaluator.
 */
public final class SyncResponseReader {
  private static final Logger logger = Logger.getLogger(SyncResponseReader.class.getName());

  private final JsonCodec codec;

  public SyncResponseReader() {
    this(JsonCodec.getDefault());
  }

  public SyncResponseReader(JsonCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Reads one response body.
   *
   * @param body the JSON response body
   * @return the batch
   * @throws IllegalArgumentException if the body is not a JSON object
   */
  public SyncBatch read(String body) {
    JsonNode root = codec.parse(body);
    if (!root.isObject()) {
      throw new IllegalArgumentException("sync response is not a JSON object");
    }
    SyncBatch.Builder batch = SyncBatch.builder()
        .nextBatch(JsonCodec.text(root, "next_batch"))
        .accountData(events(root.path("account_data")))
        .presence(events(root.path("presence")));

    JsonNode rooms = root.path("rooms");
    for (Iterator<Map.Entry<String, JsonNode>> it = rooms.path("join").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> room = it.next();
      JsonNode node = room.getValue();
      batch.joinedRoom(room.getKey(), JoinedRoom.builder()
          .ephemeral(events(node.path("ephemeral")))
          .accountData(events(node.path("account_data")))
          .state(events(node.path("state")))
          .timeline(events(node.path("timeline")))
          .build());
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = rooms.path("leave").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> room = it.next();
      JsonNode node = room.getValue();
      batch.leftRoom(room.getKey(), LeftRoom.builder()
          .accountData(events(node.path("account_data")))
          .state(events(node.path("state")))
          .timeline(events(node.path("timeline")))
          .build());
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = rooms.path("invite").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> room = it.next();
      batch.invitedRoom(room.getKey(), InvitedRoom.of(events(room.getValue().path("invite_state"))));
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = root.path("notifications").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> room = it.next();
      batch.notifications(room.getKey(), toEnvelopes(room.getValue(), "m.notification"));
    }
    return batch.build();
  }

  private EventEnvelope[] events(JsonNode container) {
    return toEnvelopes(container.path("events"), null);
  }

  private EventEnvelope[] toEnvelopes(JsonNode array, String defaultType) {
    if (array.isMissingNode() || array.isNull()) {
      return new EventEnvelope[0];
    }
    if (!array.isArray()) {
      logger.fine("Ignoring non-array event list: " + array.getNodeType());
      return new EventEnvelope[0];
    }
    List<EventEnvelope> envelopes = new ArrayList<>(array.size());
    for (JsonNode event : array) {
      String type = event.isObject() ? JsonCodec.text(event, "type") : null;
      if (type != null && type.isEmpty()) {
        type = null;
      }
      String payload = codec.write(event);
      try {
        envelopes.add(EventEnvelope.builder()
            .eventType(type != null ? type : defaultType)
            .payloadJson(payload)
            .build());
      } catch (IllegalArgumentException e) {
        String dropped = type;
        logger.fine(() -> "Dropping " + dropped + " event: " + e.getMessage());
      }
    }
    return envelopes.toArray(new EventEnvelope[0]);
  }
}
