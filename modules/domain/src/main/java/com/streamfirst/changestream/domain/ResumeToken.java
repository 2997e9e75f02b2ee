package com.streamfirst.changestream.domain;

import java.util.Objects;

/**
 * Opaque position marker in a change stream. A token captured after consuming an event marks the
 * position immediately after that event: a stream reopened from it delivers the next event first.
 * Tokens are compared for equality only; their encoding belongs to the source that minted them.
 *
 * @param value the encoded position, never blank
 */
public record ResumeToken(String value) {
  public ResumeToken {
    Objects.requireNonNull(value, "Resume token cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Resume token cannot be empty");
    }
  }

  public static ResumeToken of(String value) {
    return new ResumeToken(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
