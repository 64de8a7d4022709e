package io.syncevents.sync;

import io.syncevents.EventEnvelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One sync round as delivered by the transport.
 *
 * <p>Envelopes are grouped by room bucket and by category. Room maps keep the
 * order rooms were added in, and every envelope of a room is bound to that
 * room's id when the batch is built. Batches are immutable and may be
 * dispatched any number of times.
 *
 * <pre>{@code
 * SyncBatch batch = SyncBatch.builder()
 *     .nextBatch("s72595_4483_1934")
 *     .joinedRoom("!room:example.org", JoinedRoom.builder()
 *         .timeline(EventEnvelope.of("m.room.message", json))
 *         .build())
 *     .build();
 * }</pre>
 */
public final class SyncBatch {
  private final String nextBatch;
  private final List<EventEnvelope> accountData;
  private final Map<String, JoinedRoom> joinedRooms;
  private final Map<String, LeftRoom> leftRooms;
  private final Map<String, InvitedRoom> invitedRooms;
  private final List<EventEnvelope> presence;
  private final Map<String, List<EventEnvelope>> notifications;

  private SyncBatch(Builder builder) {
    this.nextBatch = builder.nextBatch;
    this.accountData = List.copyOf(builder.accountData);
    this.joinedRooms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.joinedRooms));
    this.leftRooms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.leftRooms));
    this.invitedRooms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.invitedRooms));
    this.presence = List.copyOf(builder.presence);
    Map<String, List<EventEnvelope>> byRoom = new LinkedHashMap<>();
    builder.notifications.forEach((roomId, list) -> byRoom.put(roomId, List.copyOf(list)));
    this.notifications = Collections.unmodifiableMap(byRoom);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the token to resume syncing from, or {@code null} if the transport
   * did not supply one.
   *
   * @return the next batch token
   */
  public String nextBatch() {
    return nextBatch;
  }

  /** Global account data, in batch order. */
  public List<EventEnvelope> accountData() {
    return accountData;
  }

  public Map<String, JoinedRoom> joinedRooms() {
    return joinedRooms;
  }

  public Map<String, LeftRoom> leftRooms() {
    return leftRooms;
  }

  public Map<String, InvitedRoom> invitedRooms() {
    return invitedRooms;
  }

  public List<EventEnvelope> presence() {
    return presence;
  }

  /**
   * Returns the notifications computed for this round, keyed by room.
   *
   * @return the notifications per room, in room order
   */
  public Map<String, List<EventEnvelope>> notifications() {
    return notifications;
  }

  /**
   * Returns the total number of envelopes in the batch.
   *
   * @return the envelope count
   */
  public int size() {
    int total = accountData.size() + presence.size();
    for (JoinedRoom room : joinedRooms.values()) {
      total += room.size();
    }
    for (LeftRoom room : leftRooms.values()) {
      total += room.size();
    }
    for (InvitedRoom room : invitedRooms.values()) {
      total += room.inviteState().size();
    }
    for (List<EventEnvelope> list : notifications.values()) {
      total += list.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  static List<EventEnvelope> bind(List<EventEnvelope> envelopes, String roomId) {
    List<EventEnvelope> bound = new ArrayList<>(envelopes.size());
    for (EventEnvelope envelope : envelopes) {
      bound.add(envelope.withRoomId(roomId));
    }
    return bound;
  }

  @Override
  public String toString() {
    return "SyncBatch{nextBatch=" + nextBatch + ", joined=" + joinedRooms.size()
        + ", left=" + leftRooms.size() + ", invited=" + invitedRooms.size()
        + ", envelopes=" + size() + '}';
  }

  /**
   * Builder for {@link SyncBatch}. Adding a room id twice replaces the earlier
   * entry but keeps its position.
   */
  public static final class Builder {
    private String nextBatch;
    private final List<EventEnvelope> accountData = new ArrayList<>();
    private final Map<String, JoinedRoom> joinedRooms = new LinkedHashMap<>();
    private final Map<String, LeftRoom> leftRooms = new LinkedHashMap<>();
    private final Map<String, InvitedRoom> invitedRooms = new LinkedHashMap<>();
    private final List<EventEnvelope> presence = new ArrayList<>();
    private final Map<String, List<EventEnvelope>> notifications = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder nextBatch(String nextBatch) {
      this.nextBatch = nextBatch;
      return this;
    }

    public Builder accountData(EventEnvelope... envelopes) {
      for (EventEnvelope envelope : envelopes) {
        accountData.add(Objects.requireNonNull(envelope, "envelope"));
      }
      return this;
    }

    public Builder joinedRoom(String roomId, JoinedRoom room) {
      joinedRooms.put(requireRoomId(roomId), Objects.requireNonNull(room, "room").bind(roomId));
      return this;
    }

    public Builder leftRoom(String roomId, LeftRoom room) {
      leftRooms.put(requireRoomId(roomId), Objects.requireNonNull(room, "room").bind(roomId));
      return this;
    }

    public Builder invitedRoom(String roomId, InvitedRoom room) {
      invitedRooms.put(requireRoomId(roomId), Objects.requireNonNull(room, "room").bind(roomId));
      return this;
    }

    public Builder presence(EventEnvelope... envelopes) {
      for (EventEnvelope envelope : envelopes) {
        presence.add(Objects.requireNonNull(envelope, "envelope"));
      }
      return this;
    }

    /**
     * Appends notifications for a room. Envelopes are bound to the room id.
     *
     * @param roomId    the room the notifications belong to
     * @param envelopes the notification envelopes
     * @return this builder
     */
    public Builder notifications(String roomId, EventEnvelope... envelopes) {
      List<EventEnvelope> list = notifications.computeIfAbsent(requireRoomId(roomId), id -> new ArrayList<>());
      for (EventEnvelope envelope : envelopes) {
        list.add(Objects.requireNonNull(envelope, "envelope").withRoomId(roomId));
      }
      return this;
    }

    private static String requireRoomId(String roomId) {
      Objects.requireNonNull(roomId, "roomId");
      if (roomId.isEmpty()) {
        throw new IllegalArgumentException("roomId cannot be empty");
      }
      return roomId;
    }

    public SyncBatch build() {
      return new SyncBatch(this);
    }
  }
}
