package io.syncevents;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, still-serialized protocol event as delivered by one sync round.
 *
 * <p>An envelope holds the verbatim JSON of the event, the type tag the transport
 * extracted from it, and the room it was delivered for (if any). The payload is
 * not validated here; the {@linkplain io.syncevents.classify.EventClassifier classifier}
 * decides whether it is usable. Envelopes are shared read-only with handlers;
 * {@link #payloadBytes()} returns a copy that a handler may keep beyond the
 * dispatch pass.
 *
 * @see io.syncevents.sync.SyncBatch
 */
public final class EventEnvelope {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024 * 2;

  private final String eventType;
  private final String roomId;
  private final String payloadJson;
  private final byte[] payloadBytes;

  private EventEnvelope(Builder builder) {
    this.eventType = builder.eventType;
    if (eventType != null && eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    this.roomId = builder.roomId;

    if (builder.payloadJson == null && builder.payloadBytes == null) {
      throw new IllegalArgumentException("payloadJson or payloadBytes must be set");
    }
    if (builder.payloadJson != null && builder.payloadBytes != null) {
      throw new IllegalArgumentException("Set either payloadJson or payloadBytes, not both");
    }

    if (builder.payloadJson != null) {
      byte[] bytes = builder.payloadJson.getBytes(StandardCharsets.UTF_8);
      checkSize(bytes.length);
      this.payloadJson = builder.payloadJson;
      this.payloadBytes = bytes;
    } else {
      checkSize(builder.payloadBytes.length);
      this.payloadBytes = Arrays.copyOf(builder.payloadBytes, builder.payloadBytes.length);
      this.payloadJson = new String(this.payloadBytes, StandardCharsets.UTF_8);
    }
  }

  private static void checkSize(int length) {
    if (length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an envelope that is not bound to a room.
   *
   * @param eventType   the type tag, e.g. {@code m.presence}
   * @param payloadJson the verbatim event JSON
   * @return a new envelope
   */
  public static EventEnvelope of(String eventType, String payloadJson) {
    return builder().eventType(eventType).payloadJson(payloadJson).build();
  }

  /**
   * Creates an envelope delivered for a room.
   *
   * @param eventType   the type tag, e.g. {@code m.room.message}
   * @param roomId      the room the event was delivered for
   * @param payloadJson the verbatim event JSON
   * @return a new envelope
   */
  public static EventEnvelope of(String eventType, String roomId, String payloadJson) {
    return builder().eventType(eventType).roomId(roomId).payloadJson(payloadJson).build();
  }

  /**
   * Returns the type tag extracted by the transport, or {@code null} if the
   * transport could not extract one. The classifier then falls back to the
   * {@code type} field of the payload.
   *
   * @return the declared type tag, or {@code null}
   */
  public String eventType() {
    return eventType;
  }

  public String roomId() {
    return roomId;
  }

  public String payloadJson() {
    return payloadJson;
  }

  public byte[] payloadBytes() {
    return Arrays.copyOf(payloadBytes, payloadBytes.length);
  }

  /**
   * Returns a copy of this envelope bound to the given room. Used by the sync
   * reader, which learns the room id from the enclosing collection.
   *
   * @param roomId the room id
   * @return a new envelope, or this one if the room already matches
   */
  public EventEnvelope withRoomId(String roomId) {
    if (Objects.equals(this.roomId, roomId)) {
      return this;
    }
    return builder().eventType(eventType).roomId(roomId).payloadJson(payloadJson).build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventEnvelope)) return false;
    EventEnvelope that = (EventEnvelope) o;
    return Objects.equals(eventType, that.eventType)
        && Objects.equals(roomId, that.roomId)
        && payloadJson.equals(that.payloadJson);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventType, roomId, payloadJson);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("EventEnvelope{eventType=").append(eventType);
    if (roomId != null) {
      sb.append(", roomId=").append(roomId);
    }
    return sb.append(", bytes=").append(payloadBytes.length).append('}').toString();
  }

  /**
   * Builder for {@link EventEnvelope}.
   */
  public static final class Builder {
    private String eventType;
    private String roomId;
    private String payloadJson;
    private byte[] payloadBytes;

    private Builder() {
    }

    /**
     * Sets the type tag extracted by the transport.
     *
     * <p>Optional. When absent the classifier reads the payload's {@code type} field.
     *
     * @param eventType the type tag
     * @return this builder
     */
    public Builder eventType(String eventType) {
      this.eventType = eventType;
      return this;
    }

    /**
     * Sets the room the event was delivered for.
     *
     * <p>Optional. Defaults to {@code null} for events outside any room.
     *
     * @param roomId the room id
     * @return this builder
     */
    public Builder roomId(String roomId) {
      this.roomId = roomId;
      return this;
    }

    /**
     * Sets the verbatim JSON payload. Mutually exclusive with {@link #payloadBytes}.
     *
     * @param payloadJson the JSON string
     * @return this builder
     */
    public Builder payloadJson(String payloadJson) {
      this.payloadJson = Objects.requireNonNull(payloadJson, "payloadJson");
      return this;
    }

    /**
     * Sets the payload as UTF-8 bytes. Mutually exclusive with {@link #payloadJson}.
     *
     * @param payloadBytes the UTF-8 encoded JSON
     * @return this builder
     */
    public Builder payloadBytes(byte[] payloadBytes) {
      this.payloadBytes = Objects.requireNonNull(payloadBytes, "payloadBytes");
      return this;
    }

    public EventEnvelope build() {
      return new EventEnvelope(this);
    }
  }
}
