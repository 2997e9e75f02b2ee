package com.streamfirst.changestream.application;

import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.CollectedEvents;
import com.streamfirst.changestream.domain.ResumeToken;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls a bounded batch of events from a stream handle. The handle is only borrowed: the collector
 * advances its delivery position but never closes it and never touches the source.
 */
@Slf4j
public class EventCollector {

  /**
   * Collects up to {@code count} events. Stops early, without failing, when an event does not
   * arrive within {@code perEventTimeout} or when the handle turns out to be closed; the result
   * then holds the events delivered so far and the token after the last of them.
   *
   * @param handle the stream to pull from
   * @param count how many events to collect
   * @param perEventTimeout how long to wait for each event
   * @return the delivered events and the position after the last one
   * @throws ChangeStreamException.ResumeFailed if the source lost history the stream still needed
   */
  public CollectedEvents collect(StreamHandle handle, int count, Duration perEventTimeout) {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(perEventTimeout, "perEventTimeout");
    if (count < 0) {
      throw new IllegalArgumentException("Event count must not be negative: " + count);
    }

    List<ChangeEvent> events = new ArrayList<>(count);
    ResumeToken token = handle.currentToken();

    while (events.size() < count) {
      Optional<ChangeEvent> next;
      try {
        next = handle.next(perEventTimeout);
      } catch (ChangeStreamException.StreamClosed e) {
        log.warn(
            "Stream closed after {} of {} events: {}", events.size(), count, e.getMessage());
        break;
      }

      if (next.isEmpty()) {
        log.info(
            "No event within {} - stopping after {} of {} events",
            perEventTimeout,
            events.size(),
            count);
        break;
      }

      ChangeEvent event = next.get();
      events.add(event);
      token = event.getSequenceMarker();
      log.debug("Collected event {} of {}: {}", events.size(), count, event);
    }

    return new CollectedEvents(events, token, count);
  }
}
