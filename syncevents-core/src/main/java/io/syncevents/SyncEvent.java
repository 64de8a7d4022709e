package io.syncevents;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncevents.classify.Classification;
import io.syncevents.event.CustomEventKind;
import io.syncevents.event.EventCategory;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTag;
import io.syncevents.util.JsonCodec;

import java.util.Objects;

/**
 * One classified event as seen by a handler.
 *
 * <p>Wraps the delivered {@link EventEnvelope} together with its category, the
 * tag it was routed under, and the parsed JSON tree. The tree is shared by all
 * handlers of the envelope and must not be modified.
 */
public final class SyncEvent {
  private final EventEnvelope envelope;
  private final Classification classification;

  public SyncEvent(EventEnvelope envelope, Classification classification) {
    this.envelope = Objects.requireNonNull(envelope, "envelope");
    this.classification = Objects.requireNonNull(classification, "classification");
  }

  public EventEnvelope envelope() {
    return envelope;
  }

  public EventCategory category() {
    return classification.category();
  }

  public EventKind kind() {
    return classification.kind();
  }

  /**
   * Returns the tag this event was routed under; {@link io.syncevents.event.EventTypes#CUSTOM_EVENT}
   * for unrecognized events.
   */
  public EventTag tag() {
    return classification.routeTag();
  }

  public String eventType() {
    return classification.eventType();
  }

  public String roomId() {
    return envelope.roomId();
  }

  /**
   * Returns the verbatim event JSON.
   *
   * @return the raw payload
   */
  public String raw() {
    return envelope.payloadJson();
  }

  public JsonNode json() {
    return classification.json();
  }

  /**
   * Returns the {@code content} object, or a missing node for notifications.
   *
   * @return the content node
   */
  public JsonNode content() {
    return classification.json().path("content");
  }

  public String eventId() {
    return JsonCodec.text(classification.json(), "event_id");
  }

  public String sender() {
    return JsonCodec.text(classification.json(), "sender");
  }

  /**
   * Returns the state key, or {@code null} for non-state events. An empty
   * string is a valid state key.
   *
   * @return the state key, or {@code null}
   */
  public String stateKey() {
    return JsonCodec.text(classification.json(), "state_key");
  }

  /**
   * Returns the discriminator of an event delivered through the custom tag,
   * or {@code null} if the event has a dedicated route.
   *
   * @return the custom discriminator, or {@code null}
   */
  public CustomEventKind customKind() {
    return classification.customKind();
  }

  public boolean isCustom() {
    return classification.isCustom();
  }

  @Override
  public String toString() {
    return "SyncEvent{tag=" + tag() + ", type=" + eventType()
        + ", category=" + category() + (roomId() != null ? ", roomId=" + roomId() : "") + '}';
  }
}
