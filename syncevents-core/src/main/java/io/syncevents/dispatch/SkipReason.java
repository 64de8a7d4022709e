package io.syncevents.dispatch;

/**
 * Why an envelope reached no handler.
 */
public enum SkipReason {
  /** No handler is registered for the envelope's route tag. */
  NO_HANDLERS,
  /** The event was redacted. */
  REDACTED,
  /** The payload is not valid JSON or lacks the generic event shape. */
  MALFORMED,
  /** An unknown presence or notification type; these have no custom route. */
  UNROUTABLE,
  /** The room the event belongs to is not known locally. */
  ROOM_UNRESOLVED,
  /** Building a handler context violated its contract. */
  CONTEXT_FAILURE
}
