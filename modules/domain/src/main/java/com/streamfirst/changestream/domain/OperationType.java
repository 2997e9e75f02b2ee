package com.streamfirst.changestream.domain;

import java.util.Locale;

/** Kind of mutation a change event describes. */
public enum OperationType {
  INSERT,
  UPDATE,
  REPLACE,
  DELETE,
  /** Anything else the source reports (drop, rename, invalidate, ...). */
  OTHER;

  /** Maps a source-reported operation name, e.g. {@code "insert"}, falling back to {@link #OTHER}. */
  public static OperationType fromValue(String value) {
    if (value == null) {
      return OTHER;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return OTHER;
    }
  }
}
