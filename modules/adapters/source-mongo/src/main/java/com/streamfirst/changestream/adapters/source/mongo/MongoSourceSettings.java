package com.streamfirst.changestream.adapters.source.mongo;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for {@link MongoEventSourceAdapter}.
 *
 * @param connectionString MongoDB connection string; the deployment must be a replica set or
 *     sharded cluster, change streams are not available on standalone servers
 * @param database database holding the watched collection
 * @param collection collection whose change stream is verified
 * @param pollInterval upper bound for a single server-side wait on the change stream cursor
 * @param serverSelectionTimeout how long to wait for a reachable server before giving up
 */
public record MongoSourceSettings(
    String connectionString,
    String database,
    String collection,
    Duration pollInterval,
    Duration serverSelectionTimeout) {

  public static final String DEFAULT_CONNECTION_STRING = "mongodb://localhost:27017/";
  public static final String DEFAULT_DATABASE = "test_db";
  public static final String DEFAULT_COLLECTION = "test_collection";

  public MongoSourceSettings {
    Objects.requireNonNull(connectionString, "connectionString");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(serverSelectionTimeout, "serverSelectionTimeout");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
    }
  }

  public static MongoSourceSettings of(String connectionString, String database, String collection) {
    return new MongoSourceSettings(
        connectionString, database, collection, Duration.ofMillis(200), Duration.ofSeconds(5));
  }

  public static MongoSourceSettings defaults() {
    return of(DEFAULT_CONNECTION_STRING, DEFAULT_DATABASE, DEFAULT_COLLECTION);
  }
}
