package io.syncevents.classify;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncevents.EventEnvelope;
import io.syncevents.event.CustomEventKind;
import io.syncevents.event.EventCategory;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTag;
import io.syncevents.event.EventTypeTable;
import io.syncevents.event.EventTypes;
import io.syncevents.util.JsonCodec;

import java.util.Objects;

/**
 * Decides, per envelope, which {@link EventTag} its handlers are registered
 * under.
 *
 * <p>The category is structural (the collection the envelope came from); the
 * classifier adds the kind, checks the type against the {@link EventTypeTable}
 * and validates the fields the kind requires. A known type whose payload lacks
 * those fields is still delivered, through {@link EventTypes#CUSTOM_EVENT}.
 *
 * <p>Stateless and thread-safe.
 */
public final class EventClassifier {

  private final EventTypeTable table;
  private final JsonCodec codec;

  public EventClassifier(EventTypeTable table) {
    this(table, JsonCodec.getDefault());
  }

  public EventClassifier(EventTypeTable table, JsonCodec codec) {
    this.table = Objects.requireNonNull(table, "table");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Classifies one envelope.
   *
   * @param envelope the envelope
   * @param category the collection it was drawn from
   * @return the classification; {@link Classification#isRoutable()} is false for
   *     unknown presence and notification types
   * @throws MalformedEventException if the payload is unusable
   */
  public Classification classify(EventEnvelope envelope, EventCategory category)
      throws MalformedEventException {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(category, "category");

    JsonNode json;
    try {
      json = codec.parse(envelope.payloadJson());
    } catch (IllegalArgumentException e) {
      throw new MalformedEventException(e.getMessage(), e);
    }
    if (!json.isObject()) {
      throw new MalformedEventException("event is not a JSON object");
    }

    if (category == EventCategory.NOTIFICATION) {
      return classifyNotification(envelope, json);
    }

    String declared = JsonCodec.text(json, "type");
    JsonNode content = json.get("content");
    if (declared == null || declared.isEmpty() || content == null || !content.isObject()) {
      throw new MalformedEventException("event lacks a string 'type' and an object 'content'");
    }
    String eventType = envelope.eventType() != null ? envelope.eventType() : declared;

    EventKind kind = kindOf(category, json);
    boolean redacted = category.isRedactable() && isRedacted(json);

    if (table.isKnown(kind, eventType) && hasRequiredFields(kind, json)) {
      return new Classification(eventType, category, kind, redacted, true,
          EventTag.of(kind, eventType), null, json);
    }
    CustomEventKind customKind = kind == EventKind.STATE ? CustomEventKind.STATE : category.customKind();
    if (customKind == null) {
      return new Classification(eventType, category, kind, redacted, false, null, null, json);
    }
    return new Classification(eventType, category, kind, redacted, false,
        EventTypes.CUSTOM_EVENT, customKind, json);
  }

  private Classification classifyNotification(EventEnvelope envelope, JsonNode json)
      throws MalformedEventException {
    JsonNode event = json.get("event");
    JsonNode actions = json.get("actions");
    if (event == null || !event.isObject() || actions == null || !actions.isArray()) {
      throw new MalformedEventException("notification lacks an object 'event' and an array 'actions'");
    }
    String eventType = envelope.eventType();
    if (eventType == null) {
      String declared = JsonCodec.text(json, "type");
      eventType = declared != null && !declared.isEmpty()
          ? declared : EventTypes.ROOM_NOTIFICATION.type();
    }
    EventKind kind = EventKind.NOTIFICATION;
    EventTag routeTag = table.isKnown(kind, eventType) ? EventTag.of(kind, eventType) : null;
    return new Classification(eventType, EventCategory.NOTIFICATION, kind, false,
        routeTag != null, routeTag, null, json);
  }

  static EventKind kindOf(EventCategory category, JsonNode json) {
    switch (category) {
      case GLOBAL_ACCOUNT_DATA:
        return EventKind.GLOBAL_ACCOUNT_DATA;
      case ROOM_ACCOUNT_DATA:
        return EventKind.ROOM_ACCOUNT_DATA;
      case EPHEMERAL:
        return EventKind.EPHEMERAL;
      case STATE:
        return EventKind.STATE;
      case TIMELINE:
        return json.hasNonNull("state_key") ? EventKind.STATE : EventKind.MESSAGE;
      case STRIPPED_STATE:
        return EventKind.STRIPPED_STATE;
      case PRESENCE:
        return EventKind.PRESENCE;
      case NOTIFICATION:
        return EventKind.NOTIFICATION;
      default:
        throw new IllegalArgumentException("Unsupported category: " + category);
    }
  }

  private static boolean hasRequiredFields(EventKind kind, JsonNode json) {
    switch (kind) {
      case STATE:
        return isText(json, "sender") && isText(json, "event_id") && isText(json, "state_key");
      case MESSAGE:
        return isText(json, "sender") && isText(json, "event_id");
      case STRIPPED_STATE:
        return isText(json, "sender") && isText(json, "state_key");
      default:
        return true;
    }
  }

  private static boolean isText(JsonNode json, String field) {
    JsonNode value = json.get(field);
    return value != null && value.isTextual();
  }

  private static boolean isRedacted(JsonNode json) {
    JsonNode unsigned = json.get("unsigned");
    return unsigned != null && unsigned.isObject() && unsigned.hasNonNull("redacted_because");
  }
}
