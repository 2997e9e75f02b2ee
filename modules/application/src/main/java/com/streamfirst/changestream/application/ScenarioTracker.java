package com.streamfirst.changestream.application;

import com.streamfirst.changestream.domain.ScenarioState;
import lombok.extern.slf4j.Slf4j;

/** Tracks the state of one scenario run and rejects transitions the state machine forbids. */
@Slf4j
final class ScenarioTracker {

  private final String scenario;
  private ScenarioState state = ScenarioState.IDLE;

  ScenarioTracker(String scenario) {
    this.scenario = scenario;
  }

  void moveTo(ScenarioState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Scenario " + scenario + " cannot move from " + state + " to " + next);
    }
    log.debug("{}: {} -> {}", scenario, state, next);
    state = next;
  }

  /** Moves to FAILED unless the scenario already reached a terminal state. */
  void fail() {
    if (!state.isTerminal()) {
      moveTo(ScenarioState.FAILED);
    }
  }

  ScenarioState state() {
    return state;
  }
}
