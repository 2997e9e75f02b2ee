package com.streamfirst.changestream.adapters;

import com.streamfirst.changestream.domain.*;
import com.streamfirst.changestream.ports.EventSourcePort;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of EventSourcePort for testing and development. Keeps an ordered log of
 * insert events with a bounded retention window: events older than the window are evicted, and a
 * resume token pointing at evicted history is rejected the way a replicated store rejects a token
 * that has fallen off its oplog. Data is lost when the application stops.
 */
@Slf4j
public class InMemoryEventSourceAdapter implements EventSourcePort {

  public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition appended = lock.newCondition();

  private final NavigableMap<Long, ChangeEvent> events = new TreeMap<>();
  // sequence -> last instant a stream was opened there
  private final NavigableMap<Long, Instant> openedPositions = new TreeMap<>();
  private final AtomicLong handleCounter = new AtomicLong(1);
  private final Duration retention;
  private final Clock clock;

  private String epoch = newEpoch();
  private long lastSequence;
  // highest sequence evicted by retention in the current epoch, 0 while nothing was evicted
  private long evictedThrough;
  private volatile boolean connected = true;

  public InMemoryEventSourceAdapter() {
    this(DEFAULT_RETENTION, Clock.systemUTC());
  }

  public InMemoryEventSourceAdapter(Duration retention) {
    this(retention, Clock.systemUTC());
  }

  public InMemoryEventSourceAdapter(Duration retention, Clock clock) {
    this.retention = Objects.requireNonNull(retention, "retention");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("Retention window must be positive: " + retention);
    }
  }

  @Override
  public void prepare() {
    try {
      ensureConnected();
    } catch (ChangeStreamException.SourceUnavailable e) {
      throw new ChangeStreamException.SetupFailed("Cannot prepare " + target(), e);
    }
    lock.lock();
    try {
      int dropped = events.size();
      events.clear();
      openedPositions.clear();
      epoch = newEpoch();
      lastSequence = 0;
      evictedThrough = 0;
      // wake handles of the previous epoch so they notice the reset
      appended.signalAll();
      log.info("Prepared in-memory event source: dropped {} events, new epoch {}", dropped, epoch);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public StreamHandle open(StartPosition position) {
    Objects.requireNonNull(position, "position");
    ensureConnected();

    lock.lock();
    try {
      evictExpired();
      long start = position.isNow() ? lastSequence : resolveResumePosition(position);
      openedPositions.put(start, clock.instant());
      String handleId = "stream-" + handleCounter.getAndIncrement();
      log.debug("Opened {} at {} (sequence {})", handleId, position, start);
      return new InMemoryStreamHandle(handleId, epoch, start);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public SourceDocument append(Map<String, Object> payload) {
    Objects.requireNonNull(payload, "payload");
    ensureConnected();

    lock.lock();
    try {
      evictExpired();
      long sequence = ++lastSequence;
      String documentKey = epoch + "-" + sequence;
      Instant now = clock.instant();

      Map<String, Object> document = new LinkedHashMap<>();
      document.put("_id", documentKey);
      document.putAll(payload);

      ChangeEvent event =
          new ChangeEvent(
              InMemoryResumeTokens.encode(epoch, sequence),
              documentKey,
              OperationType.INSERT,
              document,
              now);
      events.put(sequence, event);
      appended.signalAll();

      log.debug("Appended document {} at sequence {}", documentKey, sequence);
      return new SourceDocument(documentKey, document, now);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String target() {
    return "memory://local (retention " + retention + ")";
  }

  /** Simulates the source becoming unreachable: every later operation fails until reconnected. */
  public void disconnect() {
    log.info("Disconnecting in-memory event source");
    connected = false;
  }

  /** Makes the source reachable again after {@link #disconnect()}. */
  public void reconnect() {
    log.info("Reconnecting in-memory event source");
    connected = true;
  }

  /** Number of events still inside the retention window. */
  public int retainedEventCount() {
    lock.lock();
    try {
      evictExpired();
      return events.size();
    } finally {
      lock.unlock();
    }
  }

  public Duration getRetention() {
    return retention;
  }

  /**
   * Decodes and validates a resume token against the current epoch and retained history. A position
   * stays resumable while every event after it is retained and the position itself is inside the
   * retention window: either its own event is retained or a stream was opened there within the
   * window.
   */
  private long resolveResumePosition(StartPosition position) {
    ResumeToken token = position.resumeToken().orElseThrow();
    InMemoryResumeTokens.Position decoded = InMemoryResumeTokens.decode(token);

    if (!decoded.epoch().equals(epoch)) {
      throw new ChangeStreamException.ResumeFailed(
          "Resume token " + token + " was not issued by the current source epoch " + epoch);
    }
    if (decoded.sequence() > lastSequence) {
      throw new ChangeStreamException.ResumeFailed(
          "Resume token " + token + " points past the end of the stream");
    }
    if (decoded.sequence() < evictedThrough || !isRetainedPosition(decoded.sequence())) {
      log.warn(
          "Resume token {} refers to sequence {} but history up to {} has been evicted",
          token,
          decoded.sequence(),
          evictedThrough);
      throw new ChangeStreamException.ResumeFailed(
          "Resume token " + token + " is no longer retained (retention window " + retention + ")");
    }
    return decoded.sequence();
  }

  /** Caller holds lock and has just evicted expired entries. */
  private boolean isRetainedPosition(long sequence) {
    return sequence > evictedThrough || sequence == 0 || openedPositions.containsKey(sequence);
  }

  /**
   * Drops events and opened positions that have been around for at least the retention window.
   * Caller holds lock.
   */
  private void evictExpired() {
    Instant now = clock.instant();
    openedPositions.values().removeIf(openedAt -> !openedAt.plus(retention).isAfter(now));
    while (!events.isEmpty()) {
      Map.Entry<Long, ChangeEvent> oldest = events.firstEntry();
      if (oldest.getValue().getInsertedAt().plus(retention).isAfter(now)) {
        break;
      }
      events.pollFirstEntry();
      evictedThrough = oldest.getKey();
      log.trace("Evicted sequence {} from retention window", oldest.getKey());
    }
  }

  private void ensureConnected() {
    if (!connected) {
      throw new ChangeStreamException.SourceUnavailable(
          "Event source " + target() + " is not reachable");
    }
  }

  private static String newEpoch() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  /** Handle over the shared log. Waits on the source's condition, so it never blocks appends. */
  private final class InMemoryStreamHandle implements StreamHandle {
    private final String handleId;
    private final String handleEpoch;
    private long position;
    private volatile boolean closed;

    private InMemoryStreamHandle(String handleId, String handleEpoch, long position) {
      this.handleId = handleId;
      this.handleEpoch = handleEpoch;
      this.position = position;
    }

    @Override
    public Optional<ChangeEvent> next(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      long nanos = timeout.toNanos();

      lock.lock();
      try {
        while (true) {
          if (closed) {
            throw new ChangeStreamException.StreamClosed("Stream " + handleId + " is closed");
          }
          if (!handleEpoch.equals(epoch)) {
            throw new ChangeStreamException.ResumeFailed(
                "Stream " + handleId + " was invalidated by a source reset");
          }
          evictExpired();
          if (evictedThrough > position) {
            throw new ChangeStreamException.ResumeFailed(
                "Stream " + handleId + " lost history after sequence " + position);
          }

          Map.Entry<Long, ChangeEvent> next = events.higherEntry(position);
          if (next != null) {
            position = next.getKey();
            return Optional.of(next.getValue());
          }
          if (nanos <= 0) {
            return Optional.empty();
          }
          nanos = appended.awaitNanos(nanos);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        closed = true;
        throw new ChangeStreamException.StreamClosed(
            "Interrupted while waiting on stream " + handleId);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public ResumeToken currentToken() {
      lock.lock();
      try {
        return InMemoryResumeTokens.encode(handleEpoch, position);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      lock.lock();
      try {
        if (!closed) {
          closed = true;
          appended.signalAll();
          log.debug("Closed {} at sequence {}", handleId, position);
        }
      } finally {
        lock.unlock();
      }
    }

    @Override
    public boolean isClosed() {
      return closed;
    }

    @Override
    public String toString() {
      return handleId;
    }
  }
}
