package com.streamfirst.changestream.application;

import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.ResumeToken;
import com.streamfirst.changestream.domain.SourceDocument;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completeness, ordering and duplication checks over delivered change events. Every check returns
 * a list of human readable violations; an empty list means the check passed. Events are matched to
 * appends by document key, and resume tokens are only ever compared for equality.
 */
public class EventSequenceVerifier {

  /**
   * Checks that {@code delivered} are exactly the events of {@code appended}, in append order: no
   * missing event, no extra event, no reordering and no repeated delivery.
   */
  public List<String> verifyExactDelivery(List<ChangeEvent> delivered, List<SourceDocument> appended) {
    List<String> violations = new ArrayList<>(findRepeatedMarkers(delivered));

    if (delivered.size() != appended.size()) {
      violations.add(
          String.format(
              "expected %d events but received %d", appended.size(), delivered.size()));
    }

    Map<String, Integer> appendIndex = indexByKey(appended);
    for (int i = 0; i < Math.min(delivered.size(), appended.size()); i++) {
      ChangeEvent event = delivered.get(i);
      if (event.describes(appended.get(i))) {
        continue;
      }
      Integer actualIndex = appendIndex.get(event.getDocumentKey());
      if (actualIndex == null) {
        violations.add(
            String.format(
                "position %d: received unexpected document %s instead of %s",
                i, event.getDocumentKey(), appended.get(i).documentKey()));
      } else if (actualIndex > i) {
        violations.add(
            String.format(
                "position %d: gap - document %s was skipped, received append #%d (%s)",
                i, appended.get(i).documentKey(), actualIndex, event.getDocumentKey()));
      } else {
        violations.add(
            String.format(
                "position %d: document %s delivered again or out of order (append #%d)",
                i, event.getDocumentKey(), actualIndex));
      }
    }
    return violations;
  }

  /**
   * Checks that every event delivered by a single stream comes strictly later in append order than
   * the one before it. Events for documents that were never appended are ignored here.
   */
  public List<String> verifyAppendOrder(List<ChangeEvent> delivered, List<SourceDocument> appended) {
    List<String> violations = new ArrayList<>();
    Map<String, Integer> appendIndex = indexByKey(appended);
    int previous = -1;
    for (ChangeEvent event : delivered) {
      Integer index = appendIndex.get(event.getDocumentKey());
      if (index == null) {
        continue;
      }
      if (index <= previous) {
        violations.add(
            String.format(
                "document %s (append #%d) delivered after append #%d",
                event.getDocumentKey(), index, previous));
      }
      previous = Math.max(previous, index);
    }
    return violations;
  }

  /**
   * Checks that no event of {@code resumed} repeats one of {@code before}, by sequence marker or by
   * document key. Used across a collect-then-resume pair.
   */
  public List<String> findOverlap(List<ChangeEvent> before, List<ChangeEvent> resumed) {
    Set<ResumeToken> markers = new HashSet<>();
    Set<String> keys = new HashSet<>();
    for (ChangeEvent event : before) {
      markers.add(event.getSequenceMarker());
      keys.add(event.getDocumentKey());
    }

    List<String> violations = new ArrayList<>();
    for (ChangeEvent event : resumed) {
      if (markers.contains(event.getSequenceMarker())) {
        violations.add("duplicate delivery of sequence marker " + event.getSequenceMarker());
      } else if (keys.contains(event.getDocumentKey())) {
        violations.add("duplicate delivery of document " + event.getDocumentKey());
      }
    }
    return violations;
  }

  private static List<String> findRepeatedMarkers(List<ChangeEvent> delivered) {
    Set<ResumeToken> seen = new HashSet<>();
    List<String> violations = new ArrayList<>();
    for (ChangeEvent event : delivered) {
      if (!seen.add(event.getSequenceMarker())) {
        violations.add("sequence marker " + event.getSequenceMarker() + " delivered twice");
      }
    }
    return violations;
  }

  private static Map<String, Integer> indexByKey(List<SourceDocument> appended) {
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < appended.size(); i++) {
      index.putIfAbsent(appended.get(i).documentKey(), i);
    }
    return index;
  }
}
