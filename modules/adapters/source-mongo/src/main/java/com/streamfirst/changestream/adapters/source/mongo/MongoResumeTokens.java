package com.streamfirst.changestream.adapters.source.mongo;

import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;

/** Converts between server resume tokens ({@code {_data: ...}} documents) and opaque tokens. */
final class MongoResumeTokens {
  private static final JsonWriterSettings JSON =
      JsonWriterSettings.builder().outputMode(JsonMode.EXTENDED).build();

  private MongoResumeTokens() {}

  static ResumeToken encode(BsonDocument serverToken) {
    return ResumeToken.of(serverToken.toJson(JSON));
  }

  static BsonDocument decode(ResumeToken token) {
    BsonDocument document;
    try {
      document = BsonDocument.parse(token.value());
    } catch (JsonParseException | BsonInvalidOperationException e) {
      throw new ChangeStreamException.ResumeFailed("Malformed resume token: " + token.value(), e);
    }
    if (!document.containsKey("_data")) {
      throw new ChangeStreamException.ResumeFailed(
          "Resume token is missing the _data field: " + token.value());
    }
    return document;
  }
}
