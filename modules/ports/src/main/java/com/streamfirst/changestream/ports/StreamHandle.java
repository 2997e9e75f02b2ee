package com.streamfirst.changestream.ports;

import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;
import java.time.Duration;
import java.util.Optional;

/**
 * A live subscription to an {@link EventSourcePort}. A handle is open when created, yields events
 * while active and is closed either explicitly or by a fault. A closed handle is never reopened;
 * consumers open a new one from the last token they captured.
 *
 * <p>Handles are single-consumer: callers must not pull from one handle on several threads.
 */
public interface StreamHandle extends AutoCloseable {

  /**
   * Waits for the next event.
   *
   * @param timeout how long to wait before giving up
   * @return the next event, or empty if none arrived within {@code timeout}
   * @throws ChangeStreamException.StreamClosed if the handle has been closed
   * @throws ChangeStreamException.ResumeFailed if the source lost history the stream still needed
   */
  Optional<ChangeEvent> next(Duration timeout);

  /**
   * Returns the position immediately after the most recently delivered event, or the position the
   * handle was opened at if nothing has been delivered yet. Successive calls never move backwards.
   */
  ResumeToken currentToken();

  /** Releases the subscription. Calling it again has no effect. */
  @Override
  void close();

  boolean isClosed();
}
