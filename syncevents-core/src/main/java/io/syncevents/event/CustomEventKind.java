package io.syncevents.event;

/**
 * Discriminator delivered with events routed to the custom handlers, telling
 * which broad category the unrecognized event came from.
 */
public enum CustomEventKind {
  STATE("state"),
  MESSAGE("message"),
  BASIC_ACCOUNT_DATA("basic-account-data"),
  EPHEMERAL("ephemeral"),
  STRIPPED_STATE("stripped-state");

  private final String wireName;

  CustomEventKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
