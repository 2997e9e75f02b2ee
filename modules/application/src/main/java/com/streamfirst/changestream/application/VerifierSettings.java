package com.streamfirst.changestream.application;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of a verification run.
 *
 * @param iterations events appended and collected per phase of the resume-token scenario
 * @param disconnectDuration how long the durability scenario stays disconnected
 * @param perEventTimeout how long a collector waits for each individual event
 */
public record VerifierSettings(int iterations, Duration disconnectDuration, Duration perEventTimeout) {

  public static final int DEFAULT_ITERATIONS = 5;
  public static final Duration DEFAULT_DISCONNECT_DURATION = Duration.ofSeconds(5);
  public static final Duration DEFAULT_PER_EVENT_TIMEOUT = Duration.ofSeconds(10);

  public VerifierSettings {
    Objects.requireNonNull(disconnectDuration, "disconnectDuration");
    Objects.requireNonNull(perEventTimeout, "perEventTimeout");
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be at least 1: " + iterations);
    }
    if (disconnectDuration.isNegative()) {
      throw new IllegalArgumentException("Disconnect duration must not be negative");
    }
    if (perEventTimeout.isNegative() || perEventTimeout.isZero()) {
      throw new IllegalArgumentException("Per-event timeout must be positive");
    }
  }

  public static VerifierSettings defaults() {
    return new VerifierSettings(
        DEFAULT_ITERATIONS, DEFAULT_DISCONNECT_DURATION, DEFAULT_PER_EVENT_TIMEOUT);
  }
}
