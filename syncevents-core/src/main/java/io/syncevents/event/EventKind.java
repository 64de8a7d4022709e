package io.syncevents.event;

import io.syncevents.context.ContextShape;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Routing family of an {@link EventTag}.
 *
 * <p>Kinds follow the categories, except that timeline events split into
 * {@link #STATE} (they carry a {@code state_key}) and {@link #MESSAGE}, and that
 * unrecognized events of any category share {@link #CUSTOM}.
 *
 * <p>Each kind fixes the context shapes a handler may ask for: room-scoped kinds
 * allow {@link ContextShape#NONE} and {@link ContextShape#ROOM}, global kinds
 * allow {@link ContextShape#NONE} and {@link ContextShape#GLOBAL}, and
 * {@link #CUSTOM} allows all three.
 */
public enum EventKind {
  GLOBAL_ACCOUNT_DATA("global-account-data", ContextShape.NONE, ContextShape.GLOBAL),
  ROOM_ACCOUNT_DATA("room-account-data", ContextShape.NONE, ContextShape.ROOM),
  EPHEMERAL("ephemeral", ContextShape.NONE, ContextShape.ROOM),
  STATE("state", ContextShape.NONE, ContextShape.ROOM),
  MESSAGE("message", ContextShape.NONE, ContextShape.ROOM),
  STRIPPED_STATE("stripped-state", ContextShape.NONE, ContextShape.ROOM),
  PRESENCE("presence", ContextShape.NONE, ContextShape.GLOBAL),
  NOTIFICATION("notification", ContextShape.NONE, ContextShape.ROOM),
  CUSTOM("custom", ContextShape.NONE, ContextShape.ROOM, ContextShape.GLOBAL);

  private final String wireName;
  private final Set<ContextShape> allowedShapes;

  EventKind(String wireName, ContextShape first, ContextShape... rest) {
    this.wireName = wireName;
    this.allowedShapes = Collections.unmodifiableSet(EnumSet.of(first, rest));
  }

  public String wireName() {
    return wireName;
  }

  public Set<ContextShape> allowedShapes() {
    return allowedShapes;
  }

  public boolean allows(ContextShape shape) {
    return allowedShapes.contains(shape);
  }
}
