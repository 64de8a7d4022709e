package io.syncevents.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import io.syncevents.EventEnvelope;
import io.syncevents.SyncEvent;
import io.syncevents.classify.Classification;
import io.syncevents.classify.EventClassifier;
import io.syncevents.classify.MalformedEventException;
import io.syncevents.context.ContextBuilder;
import io.syncevents.context.ContextShape;
import io.syncevents.context.GlobalEventContext;
import io.syncevents.context.RoomEventContext;
import io.syncevents.event.EventCategory;
import io.syncevents.handler.HandlerEntry;
import io.syncevents.handler.HandlerRegistry;
import io.syncevents.room.Room;
import io.syncevents.spi.DispatchMetrics;
import io.syncevents.spi.RoomProvider;
import io.syncevents.sync.InvitedRoom;
import io.syncevents.sync.JoinedRoom;
import io.syncevents.sync.LeftRoom;
import io.syncevents.sync.SyncBatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-pass dispatcher of one {@link SyncBatch}.
 *
 * <p>Envelopes are visited in a fixed order: global account data; joined rooms
 * (ephemeral, room account data, state, timeline); left rooms (room account
 * data, state, timeline); invited rooms (stripped state); presence; and
 * finally notifications. Rooms are visited in batch order.
 *
 * <p>For each envelope the dispatcher classifies it, takes one snapshot of the
 * handlers of its route tag, resolves the room for room-scoped categories,
 * builds each needed context once and invokes the handlers sequentially. No
 * envelope or handler outcome stops the pass. The dispatcher keeps no state
 * between passes, so dispatching the same batch twice produces the same calls.
 *
 * <p>Create instances via {@link #builder()}. A pass runs on the calling
 * thread; callers serialize passes themselves (see {@link io.syncevents.SyncClient}).
 *
 * @see SyncDispatcher.Builder
 */
public final class SyncDispatcher {
  private static final Logger logger = Logger.getLogger(SyncDispatcher.class.getName());

  private final HandlerRegistry registry;
  private final RoomProvider roomProvider;
  private final ContextBuilder contextBuilder;
  private final EventClassifier classifier;
  private final DispatchMetrics metrics;
  private final ResultReporter reporter;
  private final long slowHandlerThresholdNanos;

  private SyncDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.roomProvider = Objects.requireNonNull(builder.roomProvider, "roomProvider");
    this.contextBuilder = Objects.requireNonNull(builder.contextBuilder, "contextBuilder");
    this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
    this.metrics = builder.metrics != null ? builder.metrics : DispatchMetrics.NOOP;
    this.reporter = new ResultReporter(metrics);

    Duration threshold = Objects.requireNonNull(builder.slowHandlerThreshold, "slowHandlerThreshold");
    if (threshold.isNegative() || threshold.isZero()) {
      throw new IllegalArgumentException("slowHandlerThreshold must be positive");
    }
    this.slowHandlerThresholdNanos = threshold.toNanos();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches one batch.
   *
   * @param batch the batch
   * @return the counters of this pass
   */
  public DispatchSummary dispatch(SyncBatch batch) {
    Objects.requireNonNull(batch, "batch");
    long start = System.nanoTime();
    Pass pass = new Pass(UlidCreator.getMonotonicUlid().toString());

    dispatchAll(batch.accountData(), EventCategory.GLOBAL_ACCOUNT_DATA, pass);
    for (JoinedRoom room : batch.joinedRooms().values()) {
      dispatchAll(room.ephemeral(), EventCategory.EPHEMERAL, pass);
      dispatchAll(room.accountData(), EventCategory.ROOM_ACCOUNT_DATA, pass);
      dispatchAll(room.state(), EventCategory.STATE, pass);
      dispatchAll(room.timeline(), EventCategory.TIMELINE, pass);
    }
    for (LeftRoom room : batch.leftRooms().values()) {
      dispatchAll(room.accountData(), EventCategory.ROOM_ACCOUNT_DATA, pass);
      dispatchAll(room.state(), EventCategory.STATE, pass);
      dispatchAll(room.timeline(), EventCategory.TIMELINE, pass);
    }
    for (InvitedRoom room : batch.invitedRooms().values()) {
      dispatchAll(room.inviteState(), EventCategory.STRIPPED_STATE, pass);
    }
    dispatchAll(batch.presence(), EventCategory.PRESENCE, pass);
    for (List<EventEnvelope> notifications : batch.notifications().values()) {
      dispatchAll(notifications, EventCategory.NOTIFICATION, pass);
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    metrics.recordBatchDurationMs(durationMs);
    DispatchSummary summary = pass.summary(durationMs);
    logger.fine(() -> "Dispatch pass " + summary.passId() + " finished: " + summary);
    return summary;
  }

  private void dispatchAll(List<EventEnvelope> envelopes, EventCategory category, Pass pass) {
    for (EventEnvelope envelope : envelopes) {
      pass.envelopes++;
      dispatchEnvelope(envelope, category, pass);
    }
  }

  private void dispatchEnvelope(EventEnvelope envelope, EventCategory category, Pass pass) {
    Classification classification;
    try {
      classification = classifier.classify(envelope, category);
    } catch (MalformedEventException e) {
      logger.fine(() -> "Dropping malformed " + category + " event " + envelope + ": " + e.getMessage());
      skip(pass, SkipReason.MALFORMED);
      return;
    }
    if (!classification.isRoutable()) {
      logger.fine(() -> "Dropping unroutable " + category + " event of type " + classification.eventType());
      skip(pass, SkipReason.UNROUTABLE);
      return;
    }
    if (classification.redacted()) {
      logger.fine(() -> "Skipping redacted " + classification.routeTag() + " event " + envelope);
      skip(pass, SkipReason.REDACTED);
      return;
    }

    List<HandlerEntry> handlers = select(registry.lookup(classification.routeTag()), category);
    if (handlers.isEmpty()) {
      skip(pass, SkipReason.NO_HANDLERS);
      return;
    }

    Room room = null;
    if (category.isRoomScoped()) {
      Optional<Room> resolved = resolveRoom(envelope.roomId());
      if (resolved.isEmpty()) {
        logger.fine(() -> "Skipping " + classification.routeTag() + " event: room "
            + envelope.roomId() + " is not known locally");
        skip(pass, SkipReason.ROOM_UNRESOLVED);
        return;
      }
      room = resolved.get();
    }

    SyncEvent event = new SyncEvent(envelope, classification);
    RoomEventContext roomContext = null;
    GlobalEventContext globalContext = null;
    try {
      for (HandlerEntry entry : handlers) {
        if (entry.shape() == ContextShape.ROOM && roomContext == null) {
          roomContext = contextBuilder.roomContext(event, room);
        } else if (entry.shape() == ContextShape.GLOBAL && globalContext == null) {
          globalContext = contextBuilder.globalContext(event);
        }
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to build handler context for " + event, e);
      skip(pass, SkipReason.CONTEXT_FAILURE);
      return;
    }

    pass.delivered++;
    metrics.incrementEnvelopeDelivered();
    for (HandlerEntry entry : handlers) {
      pass.invocations++;
      HandlerResult result = invoke(entry, event, roomContext, globalContext);
      if (result instanceof HandlerResult.Failure) {
        pass.failures++;
      } else if (result instanceof HandlerResult.Aborted) {
        pass.aborted++;
      }
      reporter.report(result);
    }
  }

  private Optional<Room> resolveRoom(String roomId) {
    Optional<Room> resolved;
    try {
      resolved = roomProvider.getRoom(roomId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Room lookup for " + roomId + " failed", e);
      return Optional.empty();
    }
    return resolved != null ? resolved : Optional.empty();
  }

  private static List<HandlerEntry> select(List<HandlerEntry> snapshot, EventCategory category) {
    if (category.isRoomScoped() || snapshot.isEmpty()) {
      return snapshot;
    }
    List<HandlerEntry> selected = new ArrayList<>(snapshot.size());
    for (HandlerEntry entry : snapshot) {
      if (entry.shape() != ContextShape.ROOM) {
        selected.add(entry);
      }
    }
    return selected;
  }

  private HandlerResult invoke(HandlerEntry entry, SyncEvent event,
      RoomEventContext roomContext, GlobalEventContext globalContext) {
    long start = System.nanoTime();
    HandlerResult result;
    try {
      entry.invoke(event, roomContext, globalContext);
      result = HandlerResult.SUCCESS;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = HandlerResult.of(entry.tag(), e);
    } catch (Throwable t) {
      result = HandlerResult.of(entry.tag(), t);
    }
    long elapsed = System.nanoTime() - start;
    metrics.recordHandlerDurationNanos(entry.tag(), elapsed);
    if (elapsed > slowHandlerThresholdNanos) {
      logger.warning("Event handler for `" + entry.tag() + "` took "
          + TimeUnit.NANOSECONDS.toMillis(elapsed) + " ms; the sync loop was blocked meanwhile");
    }
    return result;
  }

  private void skip(Pass pass, SkipReason reason) {
    pass.skipped.merge(reason, 1, Integer::sum);
    metrics.incrementEnvelopeSkipped(reason);
  }

  /** Mutable counters of one pass. */
  private static final class Pass {
    private final String passId;
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    private int envelopes;
    private int delivered;
    private int invocations;
    private int failures;
    private int aborted;

    Pass(String passId) {
      this.passId = passId;
    }

    DispatchSummary summary(long durationMs) {
      return new DispatchSummary(passId, envelopes, delivered, skipped, invocations, failures,
          aborted, durationMs);
    }
  }

  /** Builder for {@link SyncDispatcher}. */
  public static final class Builder {
    private HandlerRegistry registry;
    private RoomProvider roomProvider;
    private ContextBuilder contextBuilder;
    private EventClassifier classifier;
    private DispatchMetrics metrics;
    private Duration slowHandlerThreshold = Duration.ofSeconds(1);

    private Builder() {}

    /**
     * Sets the registry handlers are looked up in.
     *
     * <p><b>Required.</b>
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(HandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the provider that resolves room ids of room-scoped events.
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
     * Sets the builder of handler contexts, which carries the client.
     *
     * <p><b>Required.</b>
     *
     * @param contextBuilder the context builder
     * @return this builder
     */
    public Builder contextBuilder(ContextBuilder contextBuilder) {
      this.contextBuilder = contextBuilder;
      return this;
    }

    /**
     * Sets the classifier, which carries the table of known event types.
     *
     * <p><b>Required.</b>
     *
     * @param classifier the event classifier
     * @return this builder
     */
    public Builder classifier(EventClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the metrics exporter.
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
     * Sets how long a single handler may run before a warning is logged.
     * Handlers are never interrupted.
     *
     * <p>Optional. Defaults to one second. Must be positive.
     *
     * @param slowHandlerThreshold the warning threshold
     * @return this builder
     */
    public Builder slowHandlerThreshold(Duration slowHandlerThreshold) {
      this.slowHandlerThreshold = slowHandlerThreshold;
      return this;
    }

    public SyncDispatcher build() {
      return new SyncDispatcher(this);
    }
  }
}
