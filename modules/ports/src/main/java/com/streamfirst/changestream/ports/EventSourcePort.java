package com.streamfirst.changestream.ports;

import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.SourceDocument;
import com.streamfirst.changestream.domain.StartPosition;
import java.util.Map;

/**
 * Port for the replicated data store whose change stream is being verified. The store is treated
 * as an ordered, appendable log of documents that can be watched from its current end or resumed
 * after a previously captured position.
 */
public interface EventSourcePort {

  /**
   * Prepares the source for a verification run: clears previous test data and makes sure change
   * streams can be opened. Tokens captured before a prepare are not expected to stay valid.
   *
   * @throws ChangeStreamException.SetupFailed if the source is unreachable or cannot be prepared
   */
  void prepare();

  /**
   * Opens a new change stream. Every event appended after the returned handle's position is
   * delivered to it in append order.
   *
   * @param position where delivery starts
   * @return a new, active stream handle owned by the caller
   * @throws ChangeStreamException.ResumeFailed if the resume token is malformed, belongs to another
   *     source or points at history that is no longer retained
   * @throws ChangeStreamException.SourceUnavailable if the source cannot be reached
   */
  StreamHandle open(StartPosition position);

  /**
   * Appends a document. The change event it produces is immediately visible to every open stream
   * positioned before it.
   *
   * @param payload the document content
   * @return the appended document, carrying the key its change event will report
   * @throws ChangeStreamException.SourceUnavailable if the source cannot be reached
   */
  SourceDocument append(Map<String, Object> payload);

  /**
   * Describes where the source lives, for logging. Must not expose credentials.
   *
   * @return a printable target description
   */
  String target();
}
