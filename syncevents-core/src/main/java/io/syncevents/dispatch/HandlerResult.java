package io.syncevents.dispatch;

import io.syncevents.event.EventTag;

import java.util.Objects;

/**
 * Normalized outcome of one handler invocation.
 *
 * <ul>
 *   <li>{@link Success}: the callback returned normally.</li>
 *   <li>{@link Failure}: the callback threw a checked exception, typically an
 *       {@link io.syncevents.handler.EventHandlerException}.</li>
 *   <li>{@link Aborted}: the callback threw an unchecked exception or an error.</li>
 * </ul>
 *
 * @see ResultReporter
 */
public sealed interface HandlerResult permits HandlerResult.Success, HandlerResult.Failure, HandlerResult.Aborted {

    /**
     * Singleton indicating normal completion.
     */
    Success SUCCESS = new Success();

    /**
     * Normalizes a throwable raised by a handler.
     *
     * <p>A {@link VirtualMachineError} is never normalized; it is rethrown.
     *
     * @param tag   the tag the handler is registered under
     * @param error what the handler threw
     * @return a {@link Failure} for checked exceptions, otherwise an {@link Aborted}
     */
    static HandlerResult of(EventTag tag, Throwable error) {
        if (error instanceof VirtualMachineError vmError) {
            throw vmError;
        }
        if (error instanceof Exception && !(error instanceof RuntimeException)) {
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            return new Failure(tag, message, error);
        }
        return new Aborted(tag, error);
    }

    /**
     * Handler completed normally.
     */
    record Success() implements HandlerResult {
    }

    /**
     * Handler reported a typed failure.
     *
     * @param tag     the tag the handler is registered under
     * @param message the failure message
     * @param cause   the exception thrown by the handler
     */
    record Failure(EventTag tag, String message, Throwable cause) implements HandlerResult {
        public Failure {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * Handler terminated abnormally.
     *
     * @param tag   the tag the handler is registered under
     * @param error the unchecked exception or error
     */
    record Aborted(EventTag tag, Throwable error) implements HandlerResult {
        public Aborted {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(error, "error");
        }
    }
}
