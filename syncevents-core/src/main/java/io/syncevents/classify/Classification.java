package io.syncevents.classify;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncevents.event.CustomEventKind;
import io.syncevents.event.EventCategory;
import io.syncevents.event.EventKind;
import io.syncevents.event.EventTag;

import java.util.Objects;

/**
 * Outcome of classifying one envelope.
 *
 * @param eventType  the resolved type tag
 * @param category   the collection the envelope was drawn from
 * @param kind       the routing kind derived from the category (and {@code state_key} for timeline events)
 * @param redacted   whether the event has been redacted
 * @param known      whether the type has a dedicated route for its kind
 * @param routeTag   the registry key to look up, or {@code null} if the envelope cannot be routed
 * @param customKind the discriminator when routed to the custom tag, otherwise {@code null}
 * @param json       the parsed payload
 */
public record Classification(
    String eventType,
    EventCategory category,
    EventKind kind,
    boolean redacted,
    boolean known,
    EventTag routeTag,
    CustomEventKind customKind,
    JsonNode json) {

  public Classification {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(json, "json");
  }

  /**
   * Returns whether the envelope has a route at all. Unknown presence and
   * notification events have none.
   *
   * @return {@code true} if {@link #routeTag()} is set
   */
  public boolean isRoutable() {
    return routeTag != null;
  }

  public boolean isCustom() {
    return customKind != null;
  }
}
