package com.streamfirst.changestream.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A document appended to the event source. The document key is what ties the append to the change
 * event it produces, since the event's resume position is only known to the stream that delivers
 * it.
 *
 * @param documentKey the key the source assigned to the document
 * @param payload the document content as written
 * @param insertedAt when the append was performed
 */
public record SourceDocument(String documentKey, Map<String, Object> payload, Instant insertedAt) {
  public SourceDocument {
    Objects.requireNonNull(documentKey, "Document key cannot be null");
    Objects.requireNonNull(payload, "Document payload cannot be null");
    Objects.requireNonNull(insertedAt, "Insertion time cannot be null");
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
