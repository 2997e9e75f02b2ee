package com.streamfirst.changestream.application;

import com.streamfirst.changestream.domain.*;
import com.streamfirst.changestream.ports.EventSourcePort;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the verification scenarios against an event source: opens streams, appends documents,
 * collects events, injects disconnects and resumes from captured tokens, then checks that nothing
 * was lost, repeated or reordered. Each scenario always ends in a {@link TestResult}; resume
 * failures and closed streams are reported there instead of being thrown.
 */
@Slf4j
@RequiredArgsConstructor
public class ChangeStreamVerifier {

  public static final String RESUME_TOKEN_TEST = "resumeTokenTest";
  public static final String DURABILITY_TEST = "durabilityTest";

  static final String PRE_DISCONNECT = "pre-disconnect";
  static final String POST_DISCONNECT = "post-disconnect";

  private final EventSourcePort eventSource;
  private final EventCollector collector;
  private final FaultInjector faultInjector;
  private final EventSequenceVerifier sequenceVerifier;
  private final VerifierSettings settings;
  private final Clock clock;

  public ChangeStreamVerifier(
      EventSourcePort eventSource, FaultInjector faultInjector, VerifierSettings settings) {
    this(
        eventSource,
        new EventCollector(),
        faultInjector,
        new EventSequenceVerifier(),
        settings,
        Clock.systemUTC());
  }

  /**
   * Prepares the source and runs both scenarios with the configured settings.
   *
   * @return the results of both scenarios, gathered before anything is reported
   * @throws ChangeStreamException.SetupFailed if the source cannot be prepared
   */
  public VerificationReport runAllTests() {
    log.info("Preparing event source {}", eventSource.target());
    eventSource.prepare();

    TestResult resumeTokenTest = testResumeTokenPersistence(settings.iterations());
    TestResult durabilityTest = testStreamDurability(settings.disconnectDuration());
    return new VerificationReport(resumeTokenTest, durabilityTest);
  }

  /**
   * Collects {@code iterations} events, resumes a new stream from the token after the last of them
   * and checks that the new stream delivers exactly the documents appended afterwards.
   */
  public TestResult testResumeTokenPersistence(int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be at least 1: " + iterations);
    }
    log.info("Starting {} with {} iterations", RESUME_TOKEN_TEST, iterations);

    ScenarioTracker tracker = new ScenarioTracker(RESUME_TOKEN_TEST);
    int preCount = 0;
    int postCount = 0;
    StreamHandle initial = null;
    StreamHandle resumed = null;
    try {
      initial = eventSource.open(StartPosition.now());
      tracker.moveTo(ScenarioState.STREAM_OPENED);
      log.info("Initial resume token: {}", initial.currentToken());

      appendDocuments(iterations, i -> i);
      CollectedEvents before = collector.collect(initial, iterations, settings.perEventTimeout());
      preCount = before.size();
      initial.close();
      tracker.moveTo(ScenarioState.EVENTS_COLLECTED);
      log.info("Collected {} events, last resume token: {}", preCount, before.finalToken());

      resumed = eventSource.open(StartPosition.after(before.finalToken()));
      log.info("Resumed change stream at {}", before.finalToken());

      List<SourceDocument> appendedAfter = appendDocuments(iterations, i -> "resumed_" + i);
      CollectedEvents after = collector.collect(resumed, iterations, settings.perEventTimeout());
      postCount = after.size();
      tracker.moveTo(ScenarioState.RESUMED);
      log.info("Collected {} events after resuming", postCount);

      List<String> violations = new ArrayList<>();
      violations.addAll(sequenceVerifier.findOverlap(before.events(), after.events()));
      violations.addAll(sequenceVerifier.verifyExactDelivery(after.events(), appendedAfter));
      return conclude(tracker, RESUME_TOKEN_TEST, preCount, postCount, violations);
    } catch (RuntimeException e) {
      return abort(tracker, RESUME_TOKEN_TEST, preCount, postCount, e);
    } finally {
      release(initial);
      release(resumed);
    }
  }

  /**
   * Collects one event, drops the stream for {@code disconnectDuration}, resumes from the captured
   * token and checks that the next delivered event is the document appended after the resume.
   */
  public TestResult testStreamDurability(Duration disconnectDuration) {
    log.info("Starting {} with a disconnect of {}", DURABILITY_TEST, disconnectDuration);

    ScenarioTracker tracker = new ScenarioTracker(DURABILITY_TEST);
    int preCount = 0;
    int postCount = 0;
    StreamHandle handle = null;
    StreamHandle resumed = null;
    try {
      handle = eventSource.open(StartPosition.now());
      tracker.moveTo(ScenarioState.STREAM_OPENED);

      eventSource.append(document("phase", PRE_DISCONNECT));
      CollectedEvents before = collector.collect(handle, 1, settings.perEventTimeout());
      preCount = before.size();
      tracker.moveTo(ScenarioState.EVENTS_COLLECTED);
      ResumeToken token = before.finalToken();

      faultInjector.simulateDisconnect(handle, disconnectDuration);
      tracker.moveTo(ScenarioState.DISCONNECTED);

      resumed = eventSource.open(StartPosition.after(token));
      SourceDocument expected = eventSource.append(document("phase", POST_DISCONNECT));
      CollectedEvents after = collector.collect(resumed, 1, settings.perEventTimeout());
      postCount = after.size();
      tracker.moveTo(ScenarioState.RESUMED);

      List<String> violations = new ArrayList<>();
      if (after.events().isEmpty()) {
        violations.add("no event received after resuming from " + token);
      } else if (!after.events().get(0).describes(expected)) {
        violations.add(
            String.format(
                "expected %s document %s but received %s",
                POST_DISCONNECT, expected.documentKey(), after.events().get(0).getDocumentKey()));
      }
      return conclude(tracker, DURABILITY_TEST, preCount, postCount, violations);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      tracker.fail();
      log.warn("{} interrupted during simulated disconnect", DURABILITY_TEST);
      return TestResult.errored(
          DURABILITY_TEST, preCount, postCount, "Interrupted during simulated disconnect");
    } catch (RuntimeException e) {
      return abort(tracker, DURABILITY_TEST, preCount, postCount, e);
    } finally {
      release(handle);
      release(resumed);
    }
  }

  /** Appends {@code count} test documents whose {@code test} field is derived from the index. */
  private List<SourceDocument> appendDocuments(int count, IntFunction<Object> value) {
    List<SourceDocument> appended = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      appended.add(eventSource.append(document("test", value.apply(i))));
      log.info("Inserted document {}", i);
    }
    return appended;
  }

  private Map<String, Object> document(String field, Object value) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(field, value);
    document.put("timestamp", clock.instant());
    return document;
  }

  private TestResult conclude(
      ScenarioTracker tracker,
      String scenario,
      int preCount,
      int postCount,
      List<String> violations) {
    if (violations.isEmpty()) {
      tracker.moveTo(ScenarioState.VERIFIED);
      log.info("{} passed: {} events before, {} after", scenario, preCount, postCount);
      return TestResult.passed(scenario, preCount, postCount);
    }
    tracker.fail();
    log.warn("{} failed with {} violations: {}", scenario, violations.size(), violations);
    return TestResult.mismatched(scenario, preCount, postCount, violations);
  }

  private TestResult abort(
      ScenarioTracker tracker, String scenario, int preCount, int postCount, RuntimeException e) {
    ScenarioState reached = tracker.state();
    tracker.fail();
    if (e instanceof ChangeStreamException.ResumeFailed) {
      log.warn("{} could not resume after {}: {}", scenario, reached, e.getMessage());
    } else if (e instanceof ChangeStreamException.StreamClosed) {
      log.error("{} used a closed stream after {}: {}", scenario, reached, e.getMessage());
    } else if (e instanceof ChangeStreamException.SourceUnavailable) {
      log.error("{} lost the event source after {}: {}", scenario, reached, e.getMessage());
    } else {
      log.error("{} failed unexpectedly after {}", scenario, reached, e);
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return TestResult.errored(scenario, preCount, postCount, message);
  }

  /** Closes a handle the scenario still owns; close failures are logged, not propagated. */
  private void release(StreamHandle handle) {
    if (handle == null || handle.isClosed()) {
      return;
    }
    try {
      handle.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close stream handle {}", handle, e);
    }
  }
}
