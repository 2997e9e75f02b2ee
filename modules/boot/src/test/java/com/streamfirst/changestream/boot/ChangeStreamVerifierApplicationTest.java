package com.streamfirst.changestream.boot;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.changestream.domain.VerificationReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "verifier.connection-target=memory://local",
      "verifier.iterations=3",
      "verifier.disconnect-duration=0s",
      "verifier.per-event-timeout=1s"
    })
class ChangeStreamVerifierApplicationTest {

  @Autowired private VerificationRunner runner;

  @Test
  void runnerVerifiesTheInMemorySourceAtStartup() {
    VerificationReport report = runner.getLastReport().orElseThrow();

    assertThat(report.allPassed()).isTrue();
    assertThat(report.resumeTokenTest().getPreCount()).isEqualTo(3);
    assertThat(report.resumeTokenTest().getPostCount()).isEqualTo(3);
    assertThat(report.toKeyValues())
        .containsEntry("resumeTokenTest.success", "true")
        .containsEntry("durabilityTest.success", "true");
  }
}
