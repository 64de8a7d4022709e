package io.syncevents.classify;

/**
 * Thrown when an envelope cannot be used at all: its payload is not valid JSON
 * or lacks the generic event shape (a string {@code type} and an object
 * {@code content}).
 *
 * <p>The dispatcher drops such envelopes without aborting the batch.
 */
public final class MalformedEventException extends Exception {

  public MalformedEventException(String message) {
    super(message);
  }

  public MalformedEventException(String message, Throwable cause) {
    super(message, cause);
  }
}
