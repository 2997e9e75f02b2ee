package com.streamfirst.changestream.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.changestream.adapters.InMemoryEventSourceAdapter;
import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;
import com.streamfirst.changestream.domain.ScenarioState;
import com.streamfirst.changestream.domain.SourceDocument;
import com.streamfirst.changestream.domain.StartPosition;
import com.streamfirst.changestream.domain.TestResult;
import com.streamfirst.changestream.domain.VerificationReport;
import com.streamfirst.changestream.ports.EventSourcePort;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeStreamVerifierTest {

  private static final Duration RETENTION = Duration.ofMinutes(10);
  private static final Duration PER_EVENT_TIMEOUT = Duration.ofMillis(200);

  private MutableClock clock;
  private InMemoryEventSourceAdapter memory;
  private FaultInjector faultInjector;
  private VerifierSettings settings;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    memory = new InMemoryEventSourceAdapter(RETENTION, clock);
    faultInjector = new FaultInjector(clock::advance);
    settings = new VerifierSettings(5, Duration.ofSeconds(5), PER_EVENT_TIMEOUT);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void bothScenariosPassAgainstAHealthySource() {
    RecordingSource source = new RecordingSource(memory);

    VerificationReport report = verifier(source).runAllTests();

    assertThat(report.allPassed()).isTrue();
    assertThat(report.resumeTokenTest().getPreCount()).isEqualTo(5);
    assertThat(report.resumeTokenTest().getPostCount()).isEqualTo(5);
    assertThat(report.resumeTokenTest().getFinalState()).isEqualTo(ScenarioState.VERIFIED);
    assertThat(report.durabilityTest().getPreCount()).isEqualTo(1);
    assertThat(report.durabilityTest().getPostCount()).isEqualTo(1);
    assertThat(source.handles).hasSize(4).allMatch(StreamHandle::isClosed);
  }

  @Test
  void appendedDocumentsCarryTheScenarioFields() {
    RecordingSource source = new RecordingSource(memory);

    verifier(source).testResumeTokenPersistence(2);

    assertThat(source.payloads)
        .extracting(payload -> payload.get("test"))
        .containsExactly(0, 1, "resumed_0", "resumed_1");
    assertThat(source.payloads).allSatisfy(p -> assertThat(p).containsKey("timestamp"));
  }

  @Test
  void singleIterationIsEnough() {
    TestResult result = verifier(memory).testResumeTokenPersistence(1);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getPreCount()).isEqualTo(1);
    assertThat(result.getPostCount()).isEqualTo(1);
  }

  @Test
  void disconnectLongerThanRetentionFailsTheDurabilityScenario() {
    TestResult result = verifier(memory).testStreamDurability(RETENTION.plusMinutes(1));

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getFinalState()).isEqualTo(ScenarioState.FAILED);
    assertThat(result.getPreCount()).isEqualTo(1);
    assertThat(result.getPostCount()).isZero();
    assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e).contains("no longer retained"));
  }

  @Test
  void disconnectWithinRetentionPasses() {
    TestResult result = verifier(memory).testStreamDurability(RETENTION.minusMinutes(1));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getError()).isEmpty();
  }

  @Test
  void unreachableSourceAbortsTheRun() {
    memory.disconnect();

    assertThatThrownBy(() -> verifier(memory).runAllTests())
        .isInstanceOf(ChangeStreamException.SetupFailed.class);
  }

  @Test
  void duplicatedDeliveryAfterResumeIsAMismatch() {
    RecordingSource source = new RecordingSource(memory);
    source.replayOnResume = true;

    TestResult result = verifier(source).testResumeTokenPersistence(3);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getError()).isEmpty();
    assertThat(result.getDiagnostics()).anySatisfy(d -> assertThat(d).contains("duplicate delivery"));
    assertThat(source.handles).allMatch(StreamHandle::isClosed);
  }

  @Test
  void skippedEventAfterResumeIsAMismatch() {
    RecordingSource source = new RecordingSource(memory);
    source.skipOnResume = true;

    TestResult result = verifier(source).testResumeTokenPersistence(3);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getPostCount()).isEqualTo(2);
    assertThat(result.getDiagnostics())
        .anySatisfy(d -> assertThat(d).contains("expected 3 events but received 2"));
  }

  @Test
  void wrongDocumentAfterDisconnectIsAMismatch() {
    RecordingSource source = new RecordingSource(memory);
    source.replayOnResume = true;

    TestResult result = verifier(source).testStreamDurability(Duration.ZERO);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getDiagnostics())
        .singleElement()
        .asString()
        .contains("expected post-disconnect document");
  }

  @Test
  void interruptedDisconnectFailsTheScenario() {
    FaultInjector interrupted =
        new FaultInjector(
            d -> {
              throw new InterruptedException("shutdown");
            });
    RecordingSource source = new RecordingSource(memory);

    TestResult result =
        new ChangeStreamVerifier(source, interrupted, settings)
            .testStreamDurability(Duration.ofSeconds(1));

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getError()).isPresent();
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    assertThat(source.handles).allMatch(StreamHandle::isClosed);
  }

  @Test
  void unexpectedAdapterErrorIsCapturedInTheResult() {
    RecordingSource source = new RecordingSource(memory);
    source.failAppends = true;

    TestResult result = verifier(source).testResumeTokenPersistence(2);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getError()).contains("insert rejected");
    assertThat(source.handles).allMatch(StreamHandle::isClosed);
  }

  @Test
  void sourceLostMidRunIsCapturedInTheResult() {
    memory.prepare();
    memory.disconnect();

    TestResult result = verifier(memory).testResumeTokenPersistence(2);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getFinalState()).isEqualTo(ScenarioState.FAILED);
    assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e).contains("not reachable"));
  }

  @Test
  void iterationsMustBePositive() {
    assertThatThrownBy(() -> verifier(memory).testResumeTokenPersistence(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private ChangeStreamVerifier verifier(EventSourcePort source) {
    return new ChangeStreamVerifier(
        source,
        new EventCollector(),
        faultInjector,
        new EventSequenceVerifier(),
        settings,
        clock);
  }

  /**
   * Delegates to a real source, remembers every handle and payload, and can misbehave on resumed
   * streams.
   */
  private static final class RecordingSource implements EventSourcePort {
    private final EventSourcePort delegate;
    private final List<StreamHandle> handles = new ArrayList<>();
    private final List<Map<String, Object>> payloads = new ArrayList<>();
    private ChangeEvent lastDelivered;
    private boolean replayOnResume;
    private boolean skipOnResume;
    private boolean failAppends;

    private RecordingSource(EventSourcePort delegate) {
      this.delegate = delegate;
    }

    @Override
    public void prepare() {
      delegate.prepare();
    }

    @Override
    public StreamHandle open(StartPosition position) {
      StreamHandle handle = new RecordingHandle(delegate.open(position), !position.isNow());
      handles.add(handle);
      return handle;
    }

    @Override
    public SourceDocument append(Map<String, Object> payload) {
      if (failAppends) {
        throw new IllegalStateException("insert rejected");
      }
      payloads.add(payload);
      return delegate.append(payload);
    }

    @Override
    public String target() {
      return "recording:" + delegate.target();
    }

    private final class RecordingHandle implements StreamHandle {
      private final StreamHandle delegate;
      private boolean replayPending;
      private boolean skipPending;

      private RecordingHandle(StreamHandle delegate, boolean resumed) {
        this.delegate = delegate;
        this.replayPending = resumed && replayOnResume;
        this.skipPending = resumed && skipOnResume;
      }

      @Override
      public Optional<ChangeEvent> next(Duration timeout) {
        if (replayPending && lastDelivered != null) {
          replayPending = false;
          return Optional.of(lastDelivered);
        }
        if (skipPending) {
          Optional<ChangeEvent> skipped = delegate.next(timeout);
          if (skipped.isEmpty()) {
            return skipped;
          }
          skipPending = false;
        }
        Optional<ChangeEvent> event = delegate.next(timeout);
        event.ifPresent(e -> lastDelivered = e);
        return event;
      }

      @Override
      public ResumeToken currentToken() {
        return delegate.currentToken();
      }

      @Override
      public void close() {
        delegate.close();
      }

      @Override
      public boolean isClosed() {
        return delegate.isClosed();
      }
    }
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
