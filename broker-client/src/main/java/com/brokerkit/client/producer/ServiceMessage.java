package com.brokerkit.client.producer;

import com.brokerkit.client.PublishException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body published by the event and task producers: {@code {"service", "type", "payload"}}.
 */
public record ServiceMessage(String service, String type, Map<String, Object> payload) {
  public static final String TIMESTAMP_FIELD = "timestamp";

  /** Copies the payload and adds an ISO-8601 UTC {@code timestamp} unless the caller set one. */
  public static ServiceMessage stamped(String service, String type, Map<String, Object> payload, Clock clock) {
    Map<String, Object> body = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    body.computeIfAbsent(TIMESTAMP_FIELD,
        k -> DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));
    return new ServiceMessage(service, type, body);
  }

  public byte[] toJson(ObjectMapper mapper) {
    try {
      return mapper.writeValueAsBytes(this);
    } catch (JsonProcessingException e) {
      throw new PublishException("failed to marshal " + type + " message", e);
    }
  }
}
