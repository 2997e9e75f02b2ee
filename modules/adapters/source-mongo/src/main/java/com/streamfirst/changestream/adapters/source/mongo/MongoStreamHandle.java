package com.streamfirst.changestream.adapters.source.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.streamfirst.changestream.domain.ChangeEvent;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.ResumeToken;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;
import org.bson.Document;

/** StreamHandle over a driver change stream cursor, polled with {@code tryNext()}. */
@Slf4j
final class MongoStreamHandle implements StreamHandle {

  // ChangeStreamFatalError, ChangeStreamHistoryLost, CappedPositionLost
  private static final Set<Integer> HISTORY_LOST_CODES = Set.of(280, 286, 136);

  private final MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
  private final Clock clock;
  private BsonDocument lastToken;
  private volatile boolean closed;

  MongoStreamHandle(
      MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor,
      BsonDocument openedAt,
      Clock clock) {
    this.cursor = cursor;
    this.lastToken = openedAt;
    this.clock = clock;
  }

  @Override
  public Optional<ChangeEvent> next(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    do {
      if (closed) {
        throw new ChangeStreamException.StreamClosed("Change stream cursor is closed");
      }
      ChangeStreamDocument<Document> change;
      try {
        change = cursor.tryNext();
      } catch (MongoException e) {
        throw translate("Change stream failed after " + describe(lastToken), e);
      } catch (IllegalStateException e) {
        if (closed) {
          throw new ChangeStreamException.StreamClosed("Change stream cursor is closed");
        }
        throw e;
      }
      advanceToken(change);
      if (change != null) {
        return Optional.of(MongoChangeEvents.toChangeEvent(change, clock));
      }
    } while (System.nanoTime() < deadline);
    return Optional.empty();
  }

  @Override
  public synchronized ResumeToken currentToken() {
    return MongoResumeTokens.encode(lastToken);
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    cursor.close();
    log.debug("Closed change stream cursor at {}", describe(lastToken));
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  private synchronized void advanceToken(ChangeStreamDocument<Document> change) {
    BsonDocument token = change != null ? change.getResumeToken() : cursor.getResumeToken();
    if (token != null) {
      lastToken = token;
    }
  }

  /** Maps history-loss server errors to resume failures; other driver errors pass through. */
  private static RuntimeException translate(String message, MongoException e) {
    if (e instanceof MongoServerException server && HISTORY_LOST_CODES.contains(server.getCode())) {
      return new ChangeStreamException.ResumeFailed(message + ": " + e.getMessage(), e);
    }
    return e;
  }

  private static String describe(BsonDocument token) {
    if (token == null || !token.containsKey("_data")) {
      return String.valueOf(token);
    }
    return token.get("_data").toString();
  }
}
