package io.syncevents.handler;

/**
 * Checked exception a handler throws to report a typed failure.
 *
 * <p>The failure is logged once with the handler's tag and this message; it
 * never stops the dispatch pass.
 */
public class EventHandlerException extends Exception {

  public EventHandlerException(String message) {
    super(message);
  }

  public EventHandlerException(String message, Throwable cause) {
    super(message, cause);
  }
}
