package com.streamfirst.changestream.adapters;

import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;

/**
 * Token encoding used by {@link InMemoryEventSourceAdapter}: {@code <epoch>.<sequence>} with the
 * sequence as fixed-width base-36 so tokens of one epoch sort in append order.
 */
final class InMemoryResumeTokens {
  private static final int WIDTH = 13;
  private static final char SEPARATOR = '.';

  private InMemoryResumeTokens() {}

  /** Decoded form of a token: the source epoch and the last sequence before the position. */
  record Position(String epoch, long sequence) {}

  static ResumeToken encode(String epoch, long sequence) {
    if (sequence < 0) throw new IllegalArgumentException("sequence must be >= 0");
    String s = Long.toUnsignedString(sequence, 36);
    return ResumeToken.of(epoch + SEPARATOR + "0".repeat(WIDTH - s.length()) + s);
  }

  static Position decode(ResumeToken token) {
    String value = token.value();
    int dot = value.lastIndexOf(SEPARATOR);
    if (dot <= 0 || value.length() - dot - 1 != WIDTH) {
      throw new ChangeStreamException.ResumeFailed("Malformed resume token: " + value);
    }
    try {
      long sequence = Long.parseUnsignedLong(value.substring(dot + 1), 36);
      return new Position(value.substring(0, dot), sequence);
    } catch (NumberFormatException e) {
      throw new ChangeStreamException.ResumeFailed("Malformed resume token: " + value, e);
    }
  }
}
