package io.syncevents.event;

import java.util.Objects;

/**
 * Registry key: the routing kind plus the protocol type string.
 *
 * <p>The same protocol type can appear under several kinds; {@code m.room.member}
 * as a full state event and as a stripped invite event are different tags. Use
 * the constants in {@link EventTypes} for statically known types.
 *
 * @param kind the routing family
 * @param type the protocol type string, e.g. {@code m.room.message}
 */
public record EventTag(EventKind kind, String type) {

  public EventTag {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(type, "type");
    if (type.isEmpty()) {
      throw new IllegalArgumentException("type cannot be empty");
    }
  }

  public static EventTag of(EventKind kind, String type) {
    return new EventTag(kind, type);
  }

  @Override
  public String toString() {
    return kind.wireName() + ":" + type;
  }
}
