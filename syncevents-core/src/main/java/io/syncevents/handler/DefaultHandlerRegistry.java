package io.syncevents.handler;

import io.syncevents.context.ContextShape;
import io.syncevents.event.EventTag;
import io.syncevents.event.EventTypeTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Copy-on-write {@link HandlerRegistry}.
 *
 * <p>Each tag maps to an immutable list that is replaced wholesale under
 * {@link ConcurrentHashMap#compute}. Lookups read the current list without
 * locking.
 *
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry(EventTypeTable.defaults());
 * EventHandlerHandle handle = registry.on(EventTypes.ROOM_MESSAGE, event -> ...);
 * registry.unregister(handle);
 * }</pre>
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final EventTypeTable table;
  private final Map<EventTag, List<HandlerEntry>> handlers = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  public DefaultHandlerRegistry(EventTypeTable table) {
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  public EventHandlerHandle register(EventTag tag, ContextShape shape, Object callback) {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(callback, "callback");
    if (!tag.kind().allows(shape)) {
      throw new IllegalArgumentException("Context shape " + shape + " is not allowed for " + tag
          + "; allowed: " + tag.kind().allowedShapes());
    }
    if (!table.isRoutable(tag)) {
      throw new IllegalArgumentException("Unknown event type " + tag
          + "; unrecognized events are delivered through the custom tag");
    }
    HandlerEntry entry = new HandlerEntry(tag, shape, callback, sequence.incrementAndGet());
    handlers.compute(tag, (key, current) -> {
      List<HandlerEntry> next = current == null ? new ArrayList<>(1) : new ArrayList<>(current);
      next.add(entry);
      return List.copyOf(next);
    });
    return entry.handle();
  }

  @Override
  public boolean unregister(EventHandlerHandle handle) {
    Objects.requireNonNull(handle, "handle");
    AtomicBoolean removed = new AtomicBoolean();
    handlers.computeIfPresent(handle.tag(), (key, current) -> {
      List<HandlerEntry> next = new ArrayList<>(current.size());
      for (HandlerEntry entry : current) {
        if (entry.seq() == handle.seq()) {
          removed.set(true);
        } else {
          next.add(entry);
        }
      }
      return next.isEmpty() ? null : List.copyOf(next);
    });
    return removed.get();
  }

  @Override
  public List<HandlerEntry> lookup(EventTag tag) {
    return handlers.getOrDefault(tag, List.of());
  }

  @Override
  public void clear() {
    handlers.clear();
  }

  /**
   * Returns the number of registered handlers across all tags.
   *
   * @return the handler count
   */
  public int size() {
    int total = 0;
    for (List<HandlerEntry> entries : handlers.values()) {
      total += entries.size();
    }
    return total;
  }
}
