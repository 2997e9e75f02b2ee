package com.streamfirst.changestream.adapters.source.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.domain.SourceDocument;
import com.streamfirst.changestream.domain.StartPosition;
import com.streamfirst.changestream.ports.EventSourcePort;
import com.streamfirst.changestream.ports.StreamHandle;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * EventSourcePort backed by a MongoDB collection and its change stream. Streams are opened with
 * {@code watch()}, resumed with {@code resumeAfter}, and a token that fell off the oplog surfaces as
 * a resume failure.
 */
@Slf4j
public class MongoEventSourceAdapter implements EventSourcePort, AutoCloseable {

  private final MongoSourceSettings settings;
  private final MongoClient client;
  private final Clock clock;

  public MongoEventSourceAdapter(MongoSourceSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public MongoEventSourceAdapter(MongoSourceSettings settings, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.client = MongoClients.create(clientSettings(settings));
  }

  @Override
  public void prepare() {
    try {
      client.getDatabase(settings.database()).runCommand(new Document("ping", 1));
      MongoCollection<Document> collection = collection();
      collection.drop();
      collection.createIndex(Indexes.ascending("_id"));
      log.info("Prepared collection {}.{}", settings.database(), settings.collection());
    } catch (MongoException e) {
      throw new ChangeStreamException.SetupFailed(
          "Cannot prepare MongoDB event source " + target() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public StreamHandle open(StartPosition position) {
    Objects.requireNonNull(position, "position");
    ChangeStreamIterable<Document> watch =
        collection()
            .watch()
            .maxAwaitTime(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);

    BsonDocument openedAt = null;
    if (!position.isNow()) {
      openedAt = MongoResumeTokens.decode(position.resumeToken().orElseThrow());
      watch = watch.resumeAfter(openedAt);
    }

    MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
    try {
      cursor = watch.cursor();
    } catch (MongoServerException e) {
      if (!position.isNow()) {
        // the server refused to resume from this token
        throw new ChangeStreamException.ResumeFailed(
            "Cannot resume change stream at " + position + ": " + e.getMessage(), e);
      }
      throw e;
    }

    if (openedAt == null) {
      openedAt = cursor.getResumeToken();
      if (openedAt == null) {
        cursor.close();
        throw new IllegalStateException(
            "Server did not report an initial resume token; MongoDB 4.0.7 or later is required");
      }
    }
    log.debug("Opened change stream on {} at {}", target(), position);
    return new MongoStreamHandle(cursor, openedAt, clock);
  }

  @Override
  public SourceDocument append(Map<String, Object> payload) {
    Objects.requireNonNull(payload, "payload");
    ObjectId id = new ObjectId();
    Document document = new Document("_id", id);
    document.putAll(payload);
    Instant now = clock.instant();

    collection().insertOne(document);
    log.debug("Inserted document {} into {}", id, settings.collection());
    return new SourceDocument(id.toHexString(), document, now);
  }

  @Override
  public String target() {
    ConnectionString connection = new ConnectionString(settings.connectionString());
    return "mongodb://"
        + String.join(",", connection.getHosts())
        + "/"
        + settings.database()
        + "."
        + settings.collection();
  }

  @Override
  public void close() {
    log.info("Closing MongoDB client for {}", target());
    client.close();
  }

  private MongoCollection<Document> collection() {
    return client.getDatabase(settings.database()).getCollection(settings.collection());
  }

  private static MongoClientSettings clientSettings(MongoSourceSettings settings) {
    return MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(settings.connectionString()))
        .applyToClusterSettings(
            cluster ->
                cluster.serverSelectionTimeout(
                    settings.serverSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS))
        .build();
  }
}
