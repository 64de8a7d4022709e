package io.syncevents.context;

import io.syncevents.handler.EventHandler;
import io.syncevents.handler.GlobalEventHandler;
import io.syncevents.handler.RoomEventHandler;

/**
 * Parameter set a handler expects besides the event itself.
 *
 * <p>Each shape is bound to one callback interface. Registration checks that the
 * callback implements the interface of its declared shape.
 */
public enum ContextShape {
  /** Event only. */
  NONE(EventHandler.class),
  /** Event plus client, room and raw JSON. */
  ROOM(RoomEventHandler.class),
  /** Event plus client and raw JSON, never a room. */
  GLOBAL(GlobalEventHandler.class);

  private final Class<?> callbackType;

  ContextShape(Class<?> callbackType) {
    this.callbackType = callbackType;
  }

  /**
   * Returns the callback interface handlers of this shape must implement.
   *
   * @return the callback interface
   */
  public Class<?> callbackType() {
    return callbackType;
  }
}
