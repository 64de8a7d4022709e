package io.syncevents.handler;

import io.syncevents.event.EventTag;

import java.util.Objects;

/**
 * Opaque token identifying one registration. Pass it to
 * {@link HandlerRegistry#unregister(EventHandlerHandle)} to remove exactly that
 * handler.
 *
 * @param tag the tag the handler was registered under
 * @param seq the registration sequence number, unique per registry
 */
public record EventHandlerHandle(EventTag tag, long seq) {

  public EventHandlerHandle {
    Objects.requireNonNull(tag, "tag");
  }
}
