package io.syncevents.sync;

import io.syncevents.EventEnvelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Updates of one room the local user is joined to.
 */
public final class JoinedRoom {
  private final List<EventEnvelope> ephemeral;
  private final List<EventEnvelope> accountData;
  private final List<EventEnvelope> state;
  private final List<EventEnvelope> timeline;

  private JoinedRoom(List<EventEnvelope> ephemeral, List<EventEnvelope> accountData,
      List<EventEnvelope> state, List<EventEnvelope> timeline) {
    this.ephemeral = List.copyOf(ephemeral);
    this.accountData = List.copyOf(accountData);
    this.state = List.copyOf(state);
    this.timeline = List.copyOf(timeline);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<EventEnvelope> ephemeral() {
    return ephemeral;
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

  JoinedRoom bind(String roomId) {
    return new JoinedRoom(SyncBatch.bind(ephemeral, roomId), SyncBatch.bind(accountData, roomId),
        SyncBatch.bind(state, roomId), SyncBatch.bind(timeline, roomId));
  }

  int size() {
    return ephemeral.size() + accountData.size() + state.size() + timeline.size();
  }

  /** Builder for {@link JoinedRoom}. */
  public static final class Builder {
    private final List<EventEnvelope> ephemeral = new ArrayList<>();
    private final List<EventEnvelope> accountData = new ArrayList<>();
    private final List<EventEnvelope> state = new ArrayList<>();
    private final List<EventEnvelope> timeline = new ArrayList<>();

    private Builder() {
    }

    public Builder ephemeral(EventEnvelope... envelopes) {
      return add(ephemeral, envelopes);
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

    public JoinedRoom build() {
      return new JoinedRoom(ephemeral, accountData, state, timeline);
    }
  }

  @Override
  public String toString() {
    return "JoinedRoom{ephemeral=" + ephemeral.size() + ", accountData=" + accountData.size()
        + ", state=" + state.size() + ", timeline=" + timeline.size() + '}';
  }
}
