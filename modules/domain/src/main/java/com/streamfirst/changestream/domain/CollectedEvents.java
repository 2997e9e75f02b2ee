package com.streamfirst.changestream.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of pulling a bounded number of events from a stream. Fewer events than requested is a
 * valid outcome: it means the stream timed out or was closed before the batch filled up.
 *
 * @param events the delivered events, in delivery order
 * @param finalToken the stream position after the last delivered event (or the opening position
 *     when nothing was delivered)
 * @param requested how many events the caller asked for
 */
public record CollectedEvents(List<ChangeEvent> events, ResumeToken finalToken, int requested) {
  public CollectedEvents {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(finalToken, "finalToken");
    if (requested < 0) {
      throw new IllegalArgumentException("Requested count must not be negative: " + requested);
    }
    events = List.copyOf(events);
  }

  public int size() {
    return events.size();
  }

  /** True when every requested event was delivered. */
  public boolean isComplete() {
    return events.size() >= requested;
  }
}
