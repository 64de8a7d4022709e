package io.syncevents.event;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static lookup table of the protocol types that have a dedicated route.
 *
 * <p>A type listed for a kind is routed to its own {@link EventTag}; any other
 * type of that kind goes to {@link EventTypes#CUSTOM_EVENT}. Extending protocol
 * coverage means adding a row:
 *
 * <pre>{@code
 * EventTypeTable table = EventTypeTable.builder()
 *     .defaults()
 *     .add(EventKind.STATE, "org.example.room.settings")
 *     .build();
 * }</pre>
 *
 * <p>Instances are immutable.
 */
public final class EventTypeTable {

  private static final EventTypeTable DEFAULTS = builder().defaults().build();

  private final Map<EventKind, Set<String>> rows;

  private EventTypeTable(Map<EventKind, Set<String>> rows) {
    EnumMap<EventKind, Set<String>> copy = new EnumMap<>(EventKind.class);
    for (Map.Entry<EventKind, Set<String>> row : rows.entrySet()) {
      copy.put(row.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(row.getValue())));
    }
    this.rows = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the table of all types declared in {@link EventTypes}.
   *
   * @return the default table
   */
  public static EventTypeTable defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether the type has a dedicated route for the given kind.
   *
   * @param kind the routing kind
   * @param type the protocol type string
   * @return {@code true} if the pair is a table row
   */
  public boolean isKnown(EventKind kind, String type) {
    Set<String> types = rows.get(kind);
    return types != null && types.contains(type);
  }

  /**
   * Returns whether the tag can be registered: either a table row or the custom tag.
   *
   * @param tag the tag
   * @return {@code true} if handlers for the tag can ever be invoked
   */
  public boolean isRoutable(EventTag tag) {
    return tag.equals(EventTypes.CUSTOM_EVENT) || isKnown(tag.kind(), tag.type());
  }

  /**
   * Returns the known types of one kind, in insertion order.
   *
   * @param kind the routing kind
   * @return the types, possibly empty
   */
  public Set<String> typesOf(EventKind kind) {
    return rows.getOrDefault(kind, Set.of());
  }

  /** Builder for {@link EventTypeTable}. */
  public static final class Builder {
    private final Map<EventKind, Set<String>> rows = new EnumMap<>(EventKind.class);

    private Builder() {
    }

    /**
     * Adds all rows of the default table.
     *
     * @return this builder
     */
    public Builder defaults() {
      add(EventTypes.IGNORED_USER_LIST, EventTypes.PUSH_RULES, EventTypes.DIRECT,
          EventTypes.FULLY_READ, EventTypes.TAG,
          EventTypes.TYPING, EventTypes.RECEIPT);
      add(EventTypes.ROOM_MEMBER, EventTypes.ROOM_NAME, EventTypes.ROOM_ALIASES,
          EventTypes.ROOM_AVATAR, EventTypes.ROOM_POWER_LEVELS, EventTypes.ROOM_JOIN_RULES,
          EventTypes.ROOM_CANONICAL_ALIAS, EventTypes.ROOM_TOMBSTONE, EventTypes.ROOM_CREATE,
          EventTypes.ROOM_ENCRYPTION, EventTypes.ROOM_GUEST_ACCESS, EventTypes.ROOM_HISTORY_VISIBILITY,
          EventTypes.ROOM_PINNED_EVENTS, EventTypes.ROOM_SERVER_ACL, EventTypes.ROOM_THIRD_PARTY_INVITE,
          EventTypes.ROOM_TOPIC, EventTypes.SPACE_CHILD, EventTypes.SPACE_PARENT,
          EventTypes.POLICY_RULE_ROOM, EventTypes.POLICY_RULE_SERVER, EventTypes.POLICY_RULE_USER);
      add(EventTypes.ROOM_MESSAGE, EventTypes.ROOM_MESSAGE_FEEDBACK, EventTypes.ROOM_REDACTION,
          EventTypes.REACTION, EventTypes.CALL_INVITE, EventTypes.CALL_ANSWER,
          EventTypes.CALL_CANDIDATES, EventTypes.CALL_HANGUP,
          EventTypes.KEY_VERIFICATION_READY, EventTypes.KEY_VERIFICATION_START,
          EventTypes.KEY_VERIFICATION_CANCEL, EventTypes.KEY_VERIFICATION_ACCEPT,
          EventTypes.KEY_VERIFICATION_KEY, EventTypes.KEY_VERIFICATION_MAC,
          EventTypes.KEY_VERIFICATION_DONE, EventTypes.ROOM_ENCRYPTED, EventTypes.STICKER);
      add(EventTypes.STRIPPED_ROOM_MEMBER, EventTypes.STRIPPED_ROOM_NAME,
          EventTypes.STRIPPED_ROOM_CANONICAL_ALIAS, EventTypes.STRIPPED_ROOM_ALIASES,
          EventTypes.STRIPPED_ROOM_AVATAR, EventTypes.STRIPPED_ROOM_POWER_LEVELS,
          EventTypes.STRIPPED_ROOM_JOIN_RULES);
      add(EventTypes.PRESENCE_EVENT, EventTypes.ROOM_NOTIFICATION);
      return this;
    }

    /**
     * Adds one row.
     *
     * @param kind the routing kind; {@link EventKind#CUSTOM} is rejected
     * @param type the protocol type string
     * @return this builder
     */
    public Builder add(EventKind kind, String type) {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(type, "type");
      if (kind == EventKind.CUSTOM) {
        throw new IllegalArgumentException("custom events have no table rows");
      }
      if (type.isEmpty()) {
        throw new IllegalArgumentException("type cannot be empty");
      }
      rows.computeIfAbsent(kind, ignored -> new LinkedHashSet<>()).add(type);
      return this;
    }

    /**
     * Adds one row per tag.
     *
     * @param tags the tags
     * @return this builder
     */
    public Builder add(EventTag... tags) {
      for (EventTag tag : tags) {
        add(tag.kind(), tag.type());
      }
      return this;
    }

    public EventTypeTable build() {
      return new EventTypeTable(rows);
    }
  }
}
