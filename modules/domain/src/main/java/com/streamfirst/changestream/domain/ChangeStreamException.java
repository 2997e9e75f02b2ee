package com.streamfirst.changestream.domain;

/**
 * Base class for failures raised while consuming a change stream.
 *
 * <p>Subclasses name the condition. Resume and closed-stream failures are expected outcomes of the
 * protocol under test and are reported in a {@link TestResult}; only {@link SetupFailed} aborts a
 * run.
 */
public abstract class ChangeStreamException extends RuntimeException {

  protected ChangeStreamException(String message) {
    super(message);
  }

  protected ChangeStreamException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Raised when a stream cannot continue from a position: the token is malformed, belongs to
   * another source, or points at history the source no longer retains.
   */
  public static class ResumeFailed extends ChangeStreamException {
    public ResumeFailed(String message) {
      super(message);
    }

    public ResumeFailed(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Raised when an operation is attempted on a stream handle that has been closed. */
  public static class StreamClosed extends ChangeStreamException {
    public StreamClosed(String message) {
      super(message);
    }
  }

  /** Raised when the event source cannot be reached. */
  public static class SourceUnavailable extends ChangeStreamException {
    public SourceUnavailable(String message) {
      super(message);
    }

    public SourceUnavailable(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Raised when the event source cannot be reached or prepared before a run. */
  public static class SetupFailed extends ChangeStreamException {
    public SetupFailed(String message) {
      super(message);
    }

    public SetupFailed(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
