package io.syncevents;

import io.syncevents.classify.EventClassifier;
import io.syncevents.context.ContextBuilder;
import io.syncevents.context.ContextShape;
import io.syncevents.dispatch.DispatchSummary;
import io.syncevents.dispatch.SyncDispatcher;
import io.syncevents.event.EventTag;
import io.syncevents.event.EventTypeTable;
import io.syncevents.handler.DefaultHandlerRegistry;
import io.syncevents.handler.EventHandler;
import io.syncevents.handler.EventHandlerHandle;
import io.syncevents.handler.GlobalEventHandler;
import io.syncevents.handler.HandlerRegistry;
import io.syncevents.handler.RoomEventHandler;
import io.syncevents.room.Room;
import io.syncevents.spi.DispatchMetrics;
import io.syncevents.spi.RoomProvider;
import io.syncevents.sync.SyncBatch;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Composite entry point that owns a {@link HandlerRegistry} and a
 * {@link SyncDispatcher} and hands itself to every handler context.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SyncClient client = SyncClient.builder()
 *     .roomProvider(rooms)
 *     .build()) {
 *   client.onRoom(EventTypes.ROOM_MESSAGE, (event, ctx) ->
 *       log.info(ctx.room().roomId() + ": " + event.content().path("body").asText()));
 *   client.handleSync(batch);
 * }
 * }</pre>
 *
 * <p>Handlers may be added and removed from any thread, including from within
 * a handler; a running pass keeps the handler list it already looked up.
 * {@link #handleSync(SyncBatch)} serializes passes, so batches handed to the
 * same client never overlap.
 */
public final class SyncClient implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncClient.class.getName());

  private final RoomProvider roomProvider;
  private final EventTypeTable eventTypes;
  private final DefaultHandlerRegistry registry;
  private final SyncDispatcher dispatcher;
  private final DispatchMetrics metrics;
  private final ReentrantLock passLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SyncClient(Builder builder) {
    this.roomProvider = Objects.requireNonNull(builder.roomProvider, "roomProvider");
    this.eventTypes = builder.eventTypes != null ? builder.eventTypes : EventTypeTable.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : DispatchMetrics.NOOP;
    this.registry = new DefaultHandlerRegistry(eventTypes);
    // ContextBuilder only stores this reference; it is read once a pass runs, after construction.
    this.dispatcher = SyncDispatcher.builder()
        .registry(registry)
        .roomProvider(roomProvider)
        .contextBuilder(new ContextBuilder(this))
        .classifier(new EventClassifier(eventTypes))
        .metrics(metrics)
        .slowHandlerThreshold(builder.slowHandlerThreshold)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a handler.
   *
   * @param tag      the tag to listen for
   * @param shape    the context the callback expects
   * @param callback an {@link EventHandler}, {@link RoomEventHandler} or {@link GlobalEventHandler}
   * @return the handle to remove the handler with
   * @throws IllegalArgumentException if the registration is invalid
   * @throws IllegalStateException    if the client is closed
   */
  public EventHandlerHandle addEventHandler(EventTag tag, ContextShape shape, Object callback) {
    ensureOpen();
    EventHandlerHandle handle = registry.register(tag, shape, callback);
    logger.fine(() -> "Registered " + shape + " handler for " + tag);
    return handle;
  }

  public EventHandlerHandle on(EventTag tag, EventHandler handler) {
    return addEventHandler(tag, ContextShape.NONE, handler);
  }

  public EventHandlerHandle onRoom(EventTag tag, RoomEventHandler handler) {
    return addEventHandler(tag, ContextShape.ROOM, handler);
  }

  public EventHandlerHandle onGlobal(EventTag tag, GlobalEventHandler handler) {
    return addEventHandler(tag, ContextShape.GLOBAL, handler);
  }

  /**
   * Removes a handler. Removing it twice is a no-op.
   *
   * @param handle the handle returned on registration
   * @return {@code true} if the handler was removed by this call
   */
  public boolean removeEventHandler(EventHandlerHandle handle) {
    return registry.unregister(handle);
  }

  /**
   * Dispatches one sync batch to the registered handlers, on the calling thread.
   *
   * @param batch the batch
   * @return the counters of the pass
   * @throws IllegalStateException if the client is closed
   */
  public DispatchSummary handleSync(SyncBatch batch) {
    Objects.requireNonNull(batch, "batch");
    ensureOpen();
    passLock.lock();
    try {
      return dispatcher.dispatch(batch);
    } finally {
      passLock.unlock();
    }
  }

  /**
   * Looks up a room through the configured {@link RoomProvider}.
   *
   * @param roomId the room id
   * @return the room, or empty if it is not known locally
   */
  public Optional<Room> getRoom(String roomId) {
    return roomProvider.getRoom(roomId);
  }

  public EventTypeTable eventTypes() {
    return eventTypes;
  }

  /**
   * Returns the number of registered handlers.
   *
   * @return the handler count
   */
  public int handlerCount() {
    return registry.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("SyncClient is closed");
    }
  }

  /**
   * Drops all handlers and closes the metrics exporter if it is {@link AutoCloseable}.
   * Further calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    registry.clear();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      }
    }
  }

  /** Builder for {@link SyncClient}. Each builder builds one client. */
  public static final class Builder {
    private RoomProvider roomProvider;
    private EventTypeTable eventTypes;
    private DispatchMetrics metrics;
    private Duration slowHandlerThreshold = Duration.ofSeconds(1);
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the provider that resolves room ids.
     *
     * <p><b>Required.</b>
     *
     * @param roomProvider the room provider
     * @return this builder
     */
    public Builder roomProvider(RoomProvider roomProvider) {
      this.roomProvider = roomProvider;
      return this;
    }

    /**
     * Sets the table of event types with dedicated routes.
     *
     * <p>Optional. Defaults to {@link EventTypeTable#defaults()}.
     *
     * @param eventTypes the type table
     * @return this builder
     */
    public Builder eventTypes(EventTypeTable eventTypes) {
      this.eventTypes = eventTypes;
      return this;
    }

    /**
     * Sets the metrics exporter. An exporter that is {@link AutoCloseable} is
     * closed with the client.
     *
     * <p>Optional. Defaults to {@link DispatchMetrics#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(DispatchMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long a handler may run before a warning is logged.
     *
     * <p>Optional. Defaults to one second.
     *
     * @param slowHandlerThreshold the warning threshold
     * @return this builder
     */
    public Builder slowHandlerThreshold(Duration slowHandlerThreshold) {
      this.slowHandlerThreshold = slowHandlerThreshold;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return a new client
     * @throws IllegalStateException if this builder was already used
     */
    public SyncClient build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new SyncClient(this);
    }
  }
}
