package com.streamfirst.changestream.application;

import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulates a network partition between a consumer and the event source: the consumer's stream is
 * dropped and the consumer stays away for a while. Purely time based, it has no access to the
 * source and keeps no state between calls.
 */
@Slf4j
@RequiredArgsConstructor
public class FaultInjector {

  /** Suspends the calling thread. Replaced in tests to drive a fake clock. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  public static final Sleeper THREAD_SLEEPER = d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());

  private final Sleeper sleeper;

  public FaultInjector() {
    this(THREAD_SLEEPER);
  }

  /**
   * Closes {@code handle}, discarding anything it would still deliver, then waits for {@code
   * duration}.
   *
   * @throws InterruptedException if the wait is interrupted, e.g. by process shutdown
   */
  public void simulateDisconnect(StreamHandle handle, Duration duration)
      throws InterruptedException {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(duration, "duration");
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Disconnect duration must not be negative: " + duration);
    }

    handle.close();
    log.info("Simulating disconnect for {}", duration);
    if (!duration.isZero()) {
      sleeper.sleep(duration);
    }
    log.debug("Disconnect of {} over", duration);
  }
}
