package com.streamfirst.changestream.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Results of a complete verification run, gathered before anything is reported.
 *
 * @param resumeTokenTest outcome of the resume-token persistence scenario
 * @param durabilityTest outcome of the disconnect durability scenario
 */
public record VerificationReport(TestResult resumeTokenTest, TestResult durabilityTest) {
  public VerificationReport {
    Objects.requireNonNull(resumeTokenTest, "resumeTokenTest");
    Objects.requireNonNull(durabilityTest, "durabilityTest");
  }

  public boolean allPassed() {
    return resumeTokenTest.isSuccess() && durabilityTest.isSuccess();
  }

  public Map<String, String> toKeyValues() {
    Map<String, String> values = new LinkedHashMap<>(resumeTokenTest.toKeyValues());
    values.putAll(durabilityTest.toKeyValues());
    return values;
  }
}
