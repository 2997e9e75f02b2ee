package com.streamfirst.changestream.boot;

import com.streamfirst.changestream.adapters.InMemoryEventSourceAdapter;
import com.streamfirst.changestream.adapters.source.mongo.MongoEventSourceAdapter;
import com.streamfirst.changestream.adapters.source.mongo.MongoSourceSettings;
import com.streamfirst.changestream.application.ChangeStreamVerifier;
import com.streamfirst.changestream.application.FaultInjector;
import com.streamfirst.changestream.domain.ChangeStreamException;
import com.streamfirst.changestream.ports.EventSourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the event source adapter and the verification services. */
@Slf4j
@Configuration
@EnableConfigurationProperties(VerifierProperties.class)
public class VerifierConfiguration {

  // --- Adapter Beans ---

  @Bean
  public EventSourcePort eventSource(VerifierProperties properties) {
    if (properties.isInMemoryTarget()) {
      log.info("Using in-memory event source (retention {})", properties.memoryRetention());
      return new InMemoryEventSourceAdapter(properties.memoryRetention());
    }
    if (properties.isMongoTarget()) {
      log.info("Using MongoDB event source");
      return new MongoEventSourceAdapter(
          MongoSourceSettings.of(
              properties.connectionTarget(), properties.database(), properties.collection()));
    }
    throw new ChangeStreamException.SetupFailed(
        "Unsupported connection target: " + properties.connectionTarget());
  }

  // --- Application Service Beans ---

  @Bean
  public FaultInjector faultInjector() {
    return new FaultInjector();
  }

  @Bean
  public ChangeStreamVerifier changeStreamVerifier(
      EventSourcePort eventSource, FaultInjector faultInjector, VerifierProperties properties) {
    return new ChangeStreamVerifier(eventSource, faultInjector, properties.toSettings());
  }

  // --- Execution ---

  @Bean
  public VerificationRunner verificationRunner(ChangeStreamVerifier verifier) {
    return new VerificationRunner(verifier);
  }
}
