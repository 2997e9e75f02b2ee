package com.streamfirst.changestream.domain;

import java.util.Optional;

/**
 * Where a newly opened change stream starts: either at the current end of the source ("now") or
 * immediately after the position marked by a resume token.
 */
public final class StartPosition {

  private static final StartPosition NOW = new StartPosition(null);

  private final ResumeToken resumeAfter;

  private StartPosition(ResumeToken resumeAfter) {
    this.resumeAfter = resumeAfter;
  }

  /** Only events appended after the stream is opened are delivered. */
  public static StartPosition now() {
    return NOW;
  }

  /** Delivery starts with the event following the position marked by {@code token}. */
  public static StartPosition after(ResumeToken token) {
    if (token == null) {
      throw new IllegalArgumentException("Resume token is required to resume a stream");
    }
    return new StartPosition(token);
  }

  public boolean isNow() {
    return resumeAfter == null;
  }

  public Optional<ResumeToken> resumeToken() {
    return Optional.ofNullable(resumeAfter);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) return true;
    if (!(other instanceof StartPosition that)) return false;
    return isNow() ? that.isNow() : resumeAfter.equals(that.resumeAfter);
  }

  @Override
  public int hashCode() {
    return isNow() ? 0 : resumeAfter.hashCode();
  }

  @Override
  public String toString() {
    return isNow() ? "now" : "after(" + resumeAfter + ")";
  }
}
