package io.syncevents.event;

/**
 * Structural origin of an envelope: the sync-batch collection it was drawn from.
 *
 * <p>The category is never derived from the event content. Together with the
 * type tag it decides how the envelope is routed (see {@link EventKind}).
 */
public enum EventCategory {
  GLOBAL_ACCOUNT_DATA(false, CustomEventKind.BASIC_ACCOUNT_DATA),
  ROOM_ACCOUNT_DATA(true, CustomEventKind.BASIC_ACCOUNT_DATA),
  EPHEMERAL(true, CustomEventKind.EPHEMERAL),
  STATE(true, CustomEventKind.STATE),
  TIMELINE(true, CustomEventKind.MESSAGE),
  STRIPPED_STATE(true, CustomEventKind.STRIPPED_STATE),
  PRESENCE(false, null),
  NOTIFICATION(true, null);

  private final boolean roomScoped;
  private final CustomEventKind customKind;

  EventCategory(boolean roomScoped, CustomEventKind customKind) {
    this.roomScoped = roomScoped;
    this.customKind = customKind;
  }

  /**
   * Returns whether envelopes of this category belong to a room and need a
   * resolved room before any handler runs.
   *
   * @return {@code true} for room-scoped categories
   */
  public boolean isRoomScoped() {
    return roomScoped;
  }

  /**
   * Returns the discriminator used when an envelope of this category is routed
   * to the custom handlers, or {@code null} if unknown events of this category
   * are dropped instead.
   *
   * @return the custom discriminator, or {@code null}
   */
  public CustomEventKind customKind() {
    return customKind;
  }

  /**
   * Returns whether a redaction can apply to events of this category.
   *
   * @return {@code true} for state, timeline and stripped-state events
   */
  public boolean isRedactable() {
    return this == STATE || this == TIMELINE || this == STRIPPED_STATE;
  }
}
