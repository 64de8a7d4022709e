package io.syncevents.sync;

import io.syncevents.EventEnvelope;

import java.util.List;

/**
 * Pending invite: the stripped state the inviting server shared.
 */
public final class InvitedRoom {
  private final List<EventEnvelope> inviteState;

  private InvitedRoom(List<EventEnvelope> inviteState) {
    this.inviteState = List.copyOf(inviteState);
  }

  public static InvitedRoom of(EventEnvelope... inviteState) {
    return new InvitedRoom(List.of(inviteState));
  }

  public static InvitedRoom of(List<EventEnvelope> inviteState) {
    return new InvitedRoom(inviteState);
  }

  public List<EventEnvelope> inviteState() {
    return inviteState;
  }

  InvitedRoom bind(String roomId) {
    return new InvitedRoom(SyncBatch.bind(inviteState, roomId));
  }

  @Override
  public String toString() {
    return "InvitedRoom{inviteState=" + inviteState.size() + '}';
  }
}
