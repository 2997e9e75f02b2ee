package com.streamfirst.changestream.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TestResultTest {

  @Test
  void passedResultIsVerifiedWithoutError() {
    TestResult result = TestResult.passed("resumeTokenTest", 5, 5);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getFinalState()).isEqualTo(ScenarioState.VERIFIED);
    assertThat(result.getError()).isEmpty();
    assertThat(result.toKeyValues())
        .containsEntry("resumeTokenTest.preCount", "5")
        .containsEntry("resumeTokenTest.success", "true")
        .doesNotContainKey("resumeTokenTest.error");
  }

  @Test
  void erroredResultCarriesMessageAndCounts() {
    TestResult result = TestResult.errored("durabilityTest", 1, 0, "token expired");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getFinalState()).isEqualTo(ScenarioState.FAILED);
    assertThat(result.getError()).contains("token expired");
    assertThat(result.getPreCount()).isEqualTo(1);
    assertThat(result.toKeyValues()).containsEntry("durabilityTest.error", "token expired");
  }

  @Test
  void mismatchedResultListsDiagnosticsInOrder() {
    TestResult result =
        TestResult.mismatched("resumeTokenTest", 3, 2, List.of("first", "second"));

    assertThat(result.getError()).isEmpty();
    assertThat(result.getDiagnostics()).containsExactly("first", "second");
    assertThat(result.toKeyValues())
        .containsEntry("resumeTokenTest.diagnostics[0]", "first")
        .containsEntry("resumeTokenTest.diagnostics[1]", "second");
  }

  @Test
  void reportPassesOnlyWhenBothScenariosPass() {
    TestResult passed = TestResult.passed("resumeTokenTest", 5, 5);
    TestResult failed = TestResult.errored("durabilityTest", 1, 0, "gone");

    assertThat(new VerificationReport(passed, failed).allPassed()).isFalse();
    assertThat(new VerificationReport(passed, TestResult.passed("durabilityTest", 1, 1)).allPassed())
        .isTrue();
    assertThat(new VerificationReport(passed, failed).toKeyValues().keySet())
        .first()
        .isEqualTo("resumeTokenTest.preCount");
  }
}
