package com.streamfirst.changestream.adapters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;
import org.junit.jupiter.api.Test;

class InMemoryResumeTokensTest {

  @Test
  void tokensOfOneEpochSortInSequenceOrder() {
    ResumeToken nine = InMemoryResumeTokens.encode("abc", 9);
    ResumeToken ten = InMemoryResumeTokens.encode("abc", 10);
    ResumeToken large = InMemoryResumeTokens.encode("abc", 1_000_000L);

    assertThat(nine.value()).isLessThan(ten.value());
    assertThat(ten.value()).isLessThan(large.value());
  }

  @Test
  void decodeRecoversEpochAndSequence() {
    InMemoryResumeTokens.Position position =
        InMemoryResumeTokens.decode(InMemoryResumeTokens.encode("e1f2", 42));

    assertThat(position.epoch()).isEqualTo("e1f2");
    assertThat(position.sequence()).isEqualTo(42);
  }

  @Test
  void malformedTokensFailToResume() {
    assertThatThrownBy(() -> InMemoryResumeTokens.decode(ResumeToken.of("no-separator")))
        .isInstanceOf(ChangeStreamException.ResumeFailed.class);
    assertThatThrownBy(() -> InMemoryResumeTokens.decode(ResumeToken.of("abc.123")))
        .isInstanceOf(ChangeStreamException.ResumeFailed.class);
    assertThatThrownBy(() -> InMemoryResumeTokens.decode(ResumeToken.of("abc.!!!!!!!!!!!!!")))
        .isInstanceOf(ChangeStreamException.ResumeFailed.class);
  }
}
