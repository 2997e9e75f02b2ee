package com.streamfirst.changestream.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of one verification scenario. Produced exactly once per run of a scenario and never
 * modified afterwards. A failed resume is reported here rather than thrown.
 */
@Value
public class TestResult {

  /** Scenario name, e.g. {@code resumeTokenTest} */
  @NonNull String scenario;

  /** Events collected before the interruption */
  int preCount;

  /** Events collected after resuming */
  int postCount;

  boolean success;

  /** Error message when the scenario failed because of an error rather than a mismatch */
  String error;

  /** State the scenario ended in ({@link ScenarioState#VERIFIED} or {@link ScenarioState#FAILED}) */
  @NonNull ScenarioState finalState;

  /** Human readable findings collected during verification */
  @NonNull List<String> diagnostics;

  private TestResult(
      String scenario,
      int preCount,
      int postCount,
      boolean success,
      String error,
      ScenarioState finalState,
      List<String> diagnostics) {
    this.scenario = scenario;
    this.preCount = preCount;
    this.postCount = postCount;
    this.success = success;
    this.error = error;
    this.finalState = finalState;
    this.diagnostics = List.copyOf(diagnostics);
  }

  /** Result of a scenario whose streams behaved as expected. */
  public static TestResult passed(String scenario, int preCount, int postCount) {
    return new TestResult(
        scenario, preCount, postCount, true, null, ScenarioState.VERIFIED, List.of());
  }

  /** Result of a scenario that ran to the end but whose delivered events did not match. */
  public static TestResult mismatched(
      String scenario, int preCount, int postCount, List<String> diagnostics) {
    return new TestResult(
        scenario, preCount, postCount, false, null, ScenarioState.FAILED, diagnostics);
  }

  /** Result of a scenario that was aborted by an error. */
  public static TestResult errored(String scenario, int preCount, int postCount, String error) {
    return new TestResult(
        scenario, preCount, postCount, false, error, ScenarioState.FAILED, List.of(error));
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  /** Flattens the result into ordered key-value pairs, keys prefixed with the scenario name. */
  public Map<String, String> toKeyValues() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put(scenario + ".preCount", Integer.toString(preCount));
    values.put(scenario + ".postCount", Integer.toString(postCount));
    values.put(scenario + ".success", Boolean.toString(success));
    values.put(scenario + ".state", finalState.name());
    if (error != null) {
      values.put(scenario + ".error", error);
    }
    for (int i = 0; i < diagnostics.size(); i++) {
      values.put(scenario + ".diagnostics[" + i + "]", diagnostics.get(i));
    }
    return values;
  }
}
