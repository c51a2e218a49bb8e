package com.mytrainpro.handoff.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for an {@link ObjectMapper} that reads and writes the handoff wire models.
 * <p>
 * Framework adapters (Dropwizard, Spring Boot) bring their own pre-configured mapper; this one is
 * for standalone callers such as the app-side client.
 */
public final class HandoffJson {

  private HandoffJson() {
  }

  /**
   * Creates a mapper with {@code java.time} support, ISO-8601 timestamps and lenient handling of
   * fields added by newer servers.
   *
   * @return a new object mapper
   */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
