package io.syncevents.dispatch;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counters of one dispatch pass.
 *
 * @param passId      ULID identifying the pass in logs
 * @param envelopes   envelopes visited
 * @param delivered   envelopes that reached at least one handler
 * @param skipped     envelopes skipped, by reason
 * @param invocations handler invocations
 * @param failures    invocations that reported a typed failure
 * @param aborted     invocations that terminated abnormally
 * @param durationMs  wall-clock time of the pass
 */
public record DispatchSummary(
    String passId,
    int envelopes,
    int delivered,
    Map<SkipReason, Integer> skipped,
    int invocations,
    int failures,
    int aborted,
    long durationMs) {

  public DispatchSummary {
    Objects.requireNonNull(passId, "passId");
    EnumMap<SkipReason, Integer> copy = new EnumMap<>(SkipReason.class);
    copy.putAll(skipped);
    skipped = Collections.unmodifiableMap(copy);
  }

  public int skipped(SkipReason reason) {
    return skipped.getOrDefault(reason, 0);
  }

  public int skippedTotal() {
    int total = 0;
    for (int count : skipped.values()) {
      total += count;
    }
    return total;
  }

  public int successes() {
    return invocations - failures - aborted;
  }
}
