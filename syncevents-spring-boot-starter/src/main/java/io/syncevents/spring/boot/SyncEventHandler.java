package io.syncevents.spring.boot;

import io.syncevents.event.EventKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as a sync event handler.
 *
 * <p>The context shape is taken from the method's parameters:
 * <ul>
 *   <li>{@code (SyncEvent)}: no context</li>
 *   <li>{@code (SyncEvent, RoomEventContext)}: room context</li>
 *   <li>{@code (SyncEvent, GlobalEventContext)}: global context</li>
 * </ul>
 * The method must return {@code void}. It may throw checked exceptions; they are
 * reported as handler failures.
 *
 * <pre>{@code
 * @Component
 * public class Greeter {
 *   @SyncEventHandler(kind = EventKind.STATE, type = "m.room.member")
 *   public void onMember(SyncEvent event, RoomEventContext ctx) { ... }
 *
 *   @SyncEventHandler(kind = EventKind.CUSTOM)
 *   public void onUnknown(SyncEvent event) { ... }
 * }
 * }</pre>
 *
 * <p>{@code type} is required for every kind except {@link EventKind#CUSTOM},
 * which has a single tag.
 *
 * @see SyncEventHandlerRegistrar
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SyncEventHandler {

    /**
     * Routing kind of the events to handle.
     */
    EventKind kind();

    /**
     * Protocol type string, e.g. {@code m.room.message}. Ignored for custom events.
     */
    String type() default "";
}
