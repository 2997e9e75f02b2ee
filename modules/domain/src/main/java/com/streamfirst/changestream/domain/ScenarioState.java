package com.streamfirst.changestream.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a verification scenario moves through. {@link #VERIFIED} and {@link #FAILED} are
 * terminal; {@link #FAILED} is reachable from every non-terminal state.
 */
public enum ScenarioState {
  IDLE,
  STREAM_OPENED,
  EVENTS_COLLECTED,
  DISCONNECTED,
  RESUMED,
  VERIFIED,
  FAILED;

  /** Whether a scenario in this state may move to {@code next}. */
  public boolean canTransitionTo(ScenarioState next) {
    return successors().contains(next);
  }

  public boolean isTerminal() {
    return this == VERIFIED || this == FAILED;
  }

  private Set<ScenarioState> successors() {
    return switch (this) {
      case IDLE -> EnumSet.of(STREAM_OPENED, FAILED);
      // Scenario B collects its single event before disconnecting
      case STREAM_OPENED -> EnumSet.of(EVENTS_COLLECTED, FAILED);
      case EVENTS_COLLECTED -> EnumSet.of(DISCONNECTED, RESUMED, FAILED);
      case DISCONNECTED -> EnumSet.of(RESUMED, FAILED);
      case RESUMED -> EnumSet.of(VERIFIED, FAILED);
      case VERIFIED, FAILED -> EnumSet.noneOf(ScenarioState.class);
    };
  }
}
