package io.syncevents.handler;

import io.syncevents.SyncEvent;
import io.syncevents.context.ContextShape;
import io.syncevents.context.GlobalEventContext;
import io.syncevents.context.RoomEventContext;
import io.syncevents.event.EventTag;

import java.util.Objects;

/**
 * One registered handler: the tag, the context shape it asked for, the
 * callback and its registration sequence.
 *
 * <p>Entries are immutable. The callback is checked against
 * {@link ContextShape#callbackType()} on construction.
 *
 * @param tag      the tag
 * @param shape    the context shape
 * @param callback an {@link EventHandler}, {@link RoomEventHandler} or {@link GlobalEventHandler}
 * @param seq      the registration sequence
 */
public record HandlerEntry(EventTag tag, ContextShape shape, Object callback, long seq) {

  public HandlerEntry {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(callback, "callback");
    if (!shape.callbackType().isInstance(callback)) {
      throw new IllegalArgumentException("Handler for " + tag + " with shape " + shape
          + " must implement " + shape.callbackType().getSimpleName());
    }
  }

  public EventHandlerHandle handle() {
    return new EventHandlerHandle(tag, seq);
  }

  /**
   * Invokes the callback. The context matching {@link #shape()} must be non-null.
   *
   * @param event         the event
   * @param roomContext   the room context, or {@code null} if not built
   * @param globalContext the global context, or {@code null} if not built
   * @throws Exception whatever the callback throws
   */
  public void invoke(SyncEvent event, RoomEventContext roomContext, GlobalEventContext globalContext)
      throws Exception {
    switch (shape) {
      case NONE:
        ((EventHandler) callback).handle(event);
        break;
      case ROOM:
        ((RoomEventHandler) callback).handle(event, Objects.requireNonNull(roomContext, "roomContext"));
        break;
      case GLOBAL:
        ((GlobalEventHandler) callback).handle(event, Objects.requireNonNull(globalContext, "globalContext"));
        break;
      default:
        throw new IllegalStateException("Unknown shape " + shape);
    }
  }
}
