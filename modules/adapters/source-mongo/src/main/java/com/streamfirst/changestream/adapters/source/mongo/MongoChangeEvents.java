package com.streamfirst.changestream.adapters.source.mongo;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.OperationType;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;

/** Maps driver change stream documents onto domain change events. */
final class MongoChangeEvents {

  private MongoChangeEvents() {}

  static ChangeEvent toChangeEvent(ChangeStreamDocument<Document> change, Clock clock) {
    BsonDocument resumeToken = change.getResumeToken();
    if (resumeToken == null) {
      throw new IllegalStateException("Change stream document without resume token: " + change);
    }
    OperationType operationType =
        change.getOperationType() == null
            ? OperationType.OTHER
            : OperationType.fromValue(change.getOperationType().getValue());
    Document fullDocument = change.getFullDocument();
    Map<String, Object> payload = fullDocument == null ? Map.of() : fullDocument;

    return new ChangeEvent(
        MongoResumeTokens.encode(resumeToken),
        documentKey(change.getDocumentKey()),
        operationType,
        payload,
        eventTime(change, clock));
  }

  /** Renders the {@code _id} of a document key the same way appends report it. */
  static String documentKey(BsonDocument key) {
    if (key == null || !key.containsKey("_id")) {
      return "";
    }
    BsonValue id = key.get("_id");
    if (id.isObjectId()) return id.asObjectId().getValue().toHexString();
    if (id.isString()) return id.asString().getValue();
    return id.toString();
  }

  private static Instant eventTime(ChangeStreamDocument<Document> change, Clock clock) {
    if (change.getWallTime() != null) {
      return Instant.ofEpochMilli(change.getWallTime().getValue());
    }
    if (change.getClusterTime() != null) {
      return Instant.ofEpochSecond(change.getClusterTime().getTime());
    }
    return clock.instant();
  }
}
