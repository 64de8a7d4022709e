package io.syncevents.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.syncevents.dispatch.SkipReason;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTag;
import io.syncevents.spi.DispatchMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link DispatchMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code syncevents.handler.success}: handler invocations that completed normally</li>
 *   <li>{@code syncevents.handler.failure}: handler invocations that reported a typed failure</li>
 *   <li>{@code syncevents.handler.aborted}: handler invocations that terminated abnormally</li>
 *   <li>{@code syncevents.envelope.delivered}: envelopes that reached at least one handler</li>
 *   <li>{@code syncevents.envelope.skipped}: envelopes that reached no handler, tagged {@code reason}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code syncevents.handler.duration}: time per handler invocation, tagged {@code kind}</li>
 *   <li>{@code syncevents.batch.duration}: time per dispatched batch</li>
 * </ul>
 *
 * @see DispatchMetrics
 */
public final class MicrometerDispatchMetrics implements DispatchMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter handlerSuccess;
  private final Counter handlerFailure;
  private final Counter handlerAborted;
  private final Counter envelopeDelivered;
  private final Map<SkipReason, Counter> envelopeSkipped = new EnumMap<>(SkipReason.class);
  private final Map<EventKind, Timer> handlerDuration = new EnumMap<>(EventKind.class);
  private final Timer batchDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "syncevents"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerDispatchMetrics(MeterRegistry registry) {
    this(registry, "syncevents");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several clients
   * in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "bot.sync"})
   */
  public MicrometerDispatchMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.handlerSuccess = Counter.builder(namePrefix + ".handler.success")
        .description("Handler invocations that completed normally")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Handler invocations that reported a typed failure")
        .register(registry);
    this.handlerAborted = Counter.builder(namePrefix + ".handler.aborted")
        .description("Handler invocations that terminated abnormally")
        .register(registry);
    this.envelopeDelivered = Counter.builder(namePrefix + ".envelope.delivered")
        .description("Envelopes delivered to at least one handler")
        .register(registry);
    for (SkipReason reason : SkipReason.values()) {
      envelopeSkipped.put(reason, Counter.builder(namePrefix + ".envelope.skipped")
          .description("Envelopes that reached no handler")
          .tag("reason", reason.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    for (EventKind kind : EventKind.values()) {
      handlerDuration.put(kind, Timer.builder(namePrefix + ".handler.duration")
          .description("Time spent in one handler invocation")
          .tag("kind", kind.wireName())
          .register(registry));
    }
    this.batchDuration = Timer.builder(namePrefix + ".batch.duration")
        .description("Time spent dispatching one sync batch")
        .register(registry);
  }

  @Override
  public void incrementHandlerSuccess() {
    if (closed) return;
    handlerSuccess.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementHandlerAborted() {
    if (closed) return;
    handlerAborted.increment();
  }

  @Override
  public void incrementEnvelopeDelivered() {
    if (closed) return;
    envelopeDelivered.increment();
  }

  @Override
  public void incrementEnvelopeSkipped(SkipReason reason) {
    if (closed) return;
    envelopeSkipped.get(reason).increment();
  }

  @Override
  public void recordHandlerDurationNanos(EventTag tag, long durationNanos) {
    if (closed) return;
    handlerDuration.get(tag.kind()).record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void recordBatchDurationMs(long durationMs) {
    if (closed) return;
    batchDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link io.syncevents.SyncClient#close()}.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(handlerSuccess, handlerFailure, handlerAborted,
        envelopeDelivered, batchDuration));
    meters.addAll(envelopeSkipped.values());
    meters.addAll(handlerDuration.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
