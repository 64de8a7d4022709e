package io.syncevents.sync;

import io.syncevents.EventEnvelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Final updates of a room the local user has left.
 */
public final class LeftRoom {
  private final List<EventEnvelope> accountData;
  private final List<EventEnvelope> state;
  private final List<EventEnvelope> timeline;

  private LeftRoom(List<EventEnvelope> accountData, List<EventEnvelope> state,
      List<EventEnvelope> timeline) {
    this.accountData = List.copyOf(accountData);
    this.state = List.copyOf(state);
    this.timeline = List.copyOf(timeline);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<EventEnvelope> accountData() {
    return accountData;
  }

  public List<EventEnvelope> state() {
    return state;
  }

  public List<EventEnvelope> timeline() {
    return timeline;
  }

  LeftRoom bind(String roomId) {
    return new LeftRoom(SyncBatch.bind(accountData, roomId), SyncBatch.bind(state, roomId),
        SyncBatch.bind(timeline, roomId));
  }

  int size() {
    return accountData.size() + state.size() + timeline.size();
  }

  @Override
  public String toString() {
    return "LeftRoom{accountData=" + accountData.size() + ", state=" + state.size()
        + ", timeline=" + timeline.size() + '}';
  }

  /** Builder for {@link LeftRoom}. */
  public static final class Builder {
    private final List<EventEnvelope> accountData = new ArrayList<>();
    private final List<EventEnvelope> state = new ArrayList<>();
    private final List<EventEnvelope> timeline = new ArrayList<>();

    private Builder() {
    }

    public Builder accountData(EventEnvelope... envelopes) {
      return add(accountData, envelopes);
    }

    public Builder state(EventEnvelope... envelopes) {
      return add(state, envelopes);
    }

    public Builder timeline(EventEnvelope... envelopes) {
      return add(timeline, envelopes);
    }

    private Builder add(List<EventEnvelope> target, EventEnvelope[] envelopes) {
      for (EventEnvelope envelope : envelopes) {
        target.add(Objects.requireNonNull(envelope, "envelope"));
      }
      return this;
    }

    public LeftRoom build() {
      return new LeftRoom(accountData, state, timeline);
    }
  }
}
