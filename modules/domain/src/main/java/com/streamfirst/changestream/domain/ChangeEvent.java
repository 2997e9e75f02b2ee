package com.streamfirst.changestream.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A single mutation observed on the source, as delivered by a change stream. Events are immutable
 * and identified by their sequence marker: the resume token that marks the position right after
 * this event.
 */
@Value
@EqualsAndHashCode(of = "sequenceMarker")
public class ChangeEvent {

  /** Position immediately after this event; resuming from it delivers the next event */
  @NonNull ResumeToken sequenceMarker;

  /** Key of the document the mutation touched */
  @NonNull String documentKey;

  @NonNull OperationType operationType;

  /** Document content as seen by the stream; empty for deletes */
  @NonNull Map<String, Object> payload;

  /** When the source recorded the mutation */
  @NonNull Instant insertedAt;

  public ChangeEvent(
      ResumeToken sequenceMarker,
      String documentKey,
      OperationType operationType,
      Map<String, Object> payload,
      Instant insertedAt) {
    this.sequenceMarker = Objects.requireNonNull(sequenceMarker, "sequenceMarker");
    this.documentKey = Objects.requireNonNull(documentKey, "documentKey");
    this.operationType = Objects.requireNonNull(operationType, "operationType");
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    this.insertedAt = Objects.requireNonNull(insertedAt, "insertedAt");
  }

  /** Returns true if this event was produced by the append that returned {@code document}. */
  public boolean describes(SourceDocument document) {
    return documentKey.equals(document.documentKey());
  }

  @Override
  public String toString() {
    return "ChangeEvent{"
        + "documentKey='"
        + documentKey
        + '\''
        + ", operationType="
        + operationType
        + ", sequenceMarker="
        + sequenceMarker
        + '}';
  }
}
