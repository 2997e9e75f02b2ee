package com.streamfirst.changestream.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Runs the change stream verification once and exits. Scenario failures are reported, not turned
 * into a failing exit code; only an unreachable event source stops startup.
 *
 * <p>The MongoDB client is owned by the event source adapter, so Spring Boot's own client is not
 * created.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class ChangeStreamVerifierApplication {

  public static void main(String[] args) {
    System.exit(
        SpringApplication.exit(SpringApplication.run(ChangeStreamVerifierApplication.class, args)));
  }
}
