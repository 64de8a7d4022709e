package io.syncevents.context;

import io.syncevents.SyncClient;

import java.util.Objects;

/**
 * Context for handlers of events outside any room's scope.
 *
 * <p>Carries no room even when the event was delivered for one, which happens
 * for custom handlers registered with {@link ContextShape#GLOBAL}.
 *
 * @param client the client that dispatched the event
 * @param raw    the verbatim event JSON
 */
public record GlobalEventContext(SyncClient client, String raw) {

  public GlobalEventContext {
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(raw, "raw");
  }
}
