package io.syncevents.handler;

import io.syncevents.context.ContextShape;
import io.syncevents.event.EventTag;

import java.util.List;

/**
 * Registry mapping event tags to their ordered handlers.
 *
 * <p>Mutation may happen concurrently with dispatch. {@link #lookup(EventTag)}
 * returns a snapshot that never reflects a partial edit.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Appends a handler to the list of the tag.
   *
   * @param tag      the tag
   * @param shape    the context shape the callback expects
   * @param callback the callback, implementing {@code shape.callbackType()}
   * @return the handle identifying this registration
   * @throws IllegalArgumentException if the callback does not match the shape,
   *     the shape is not allowed for the tag's kind, or the tag can never be routed
   */
  EventHandlerHandle register(EventTag tag, ContextShape shape, Object callback);

  /**
   * Removes exactly the handler identified by the handle.
   *
   * @param handle the handle returned by {@link #register}
   * @return {@code true} if a handler was removed, {@code false} if it was already gone
   */
  boolean unregister(EventHandlerHandle handle);

  /**
   * Returns the handlers of a tag in registration order.
   *
   * @param tag the tag
   * @return an immutable snapshot, empty if none are registered
   */
  List<HandlerEntry> lookup(EventTag tag);

  /** Removes all handlers. */
  void clear();

  default EventHandlerHandle on(EventTag tag, EventHandler handler) {
    return register(tag, ContextShape.NONE, handler);
  }

  default EventHandlerHandle onRoom(EventTag tag, RoomEventHandler handler) {
    return register(tag, ContextShape.ROOM, handler);
  }

  default EventHandlerHandle onGlobal(EventTag tag, GlobalEventHandler handler) {
    return register(tag, ContextShape.GLOBAL, handler);
  }
}
