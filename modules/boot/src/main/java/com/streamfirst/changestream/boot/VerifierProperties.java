package com.streamfirst.changestream.boot;

import com.streamfirst.changestream.adapters.source.mongo.MongoSourceSettings;
import com.streamfirst.changestream.application.VerifierSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration, bound from the {@code verifier.*} properties.
 *
 * @param connectionTarget where the event source lives; {@code mongodb://} and {@code
 *     mongodb+srv://} select MongoDB, {@code memory://} the in-memory source
 * @param iterations events per phase of the resume-token scenario
 * @param disconnectDuration simulated partition length of the durability scenario; bare numbers
 *     are seconds, as for the other durations
 * @param perEventTimeout how long to wait for each event while collecting
 * @param database MongoDB database
 * @param collection MongoDB collection
 * @param memoryRetention retention window of the in-memory source
 */
@Validated
@ConfigurationProperties(prefix = "verifier")
public record VerifierProperties(
    @DefaultValue(MongoSourceSettings.DEFAULT_CONNECTION_STRING) @NotBlank String connectionTarget,
    @DefaultValue("5") @Min(1) int iterations,
    @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) @NotNull Duration disconnectDuration,
    @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) @NotNull Duration perEventTimeout,
    @DefaultValue(MongoSourceSettings.DEFAULT_DATABASE) @NotBlank String database,
    @DefaultValue(MongoSourceSettings.DEFAULT_COLLECTION) @NotBlank String collection,
    @DefaultValue("1h") @DurationUnit(ChronoUnit.SECONDS) @NotNull Duration memoryRetention) {

  public VerifierSettings toSettings() {
    return new VerifierSettings(iterations, disconnectDuration, perEventTimeout);
  }

  public boolean isInMemoryTarget() {
    return scheme().equals("memory");
  }

  public boolean isMongoTarget() {
    return scheme().equals("mongodb") || scheme().equals("mongodb+srv");
  }

  private String scheme() {
    int colon = connectionTarget.indexOf("://");
    return colon < 0 ? "" : connectionTarget.substring(0, colon).toLowerCase(Locale.ROOT);
  }
}
