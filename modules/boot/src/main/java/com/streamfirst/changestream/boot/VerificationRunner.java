package com.streamfirst.changestream.boot;

import com.streamfirst.changestream.application.ChangeStreamVerifier;
import com.streamfirst.changestream.domain.VerificationReport;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

/**
 * Runs all scenarios at startup and logs the gathered results as {@code key=value} lines. A setup
 * failure propagates and aborts startup; scenario failures are only reported.
 */
@Slf4j
@RequiredArgsConstructor
public class VerificationRunner implements CommandLineRunner {

  private final ChangeStreamVerifier verifier;
  private volatile VerificationReport lastReport;

  @Override
  public void run(String... args) {
    VerificationReport report = verifier.runAllTests();
    lastReport = report;

    log.info("Test Results:");
    for (Map.Entry<String, String> entry : report.toKeyValues().entrySet()) {
      log.info("{}={}", entry.getKey(), entry.getValue());
    }
    log.info("allPassed={}", report.allPassed());
  }

  /** The report of the last run, if one completed. */
  public Optional<VerificationReport> getLastReport() {
    return Optional.ofNullable(lastReport);
  }
}
