package com.brokerkit.client.events;

import com.brokerkit.client.connection.ConnectionSettings;
import com.brokerkit.client.producer.ResilientProducer;
import com.brokerkit.client.producer.ServiceMessage;
import com.brokerkit.client.topology.Topology;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.BuiltinExchangeType;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes service events onto the shared {@code events} direct exchange under one fixed routing key.
 * Queues are declared by whoever consumes the events.
 */
public class EventProducer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventProducer.class);

  public static final Topology DEFAULT_TOPOLOGY = Topology.builder("events")
      .exchangeType(BuiltinExchangeType.DIRECT)
      .routingKey("event")
      .deadLetterExchange("events.dlx")
      .deadLetterRoutingKey("event.failed")
      .build();

  private final ResilientProducer producer;
  private final String serviceName;
  private final ObjectMapper mapper;
  private final Clock clock;

  public EventProducer(ConnectionSettings settings, String serviceName, MeterRegistry registry) {
    this(settings, serviceName, DEFAULT_TOPOLOGY, registry);
  }

  public EventProducer(ConnectionSettings settings, String serviceName, Topology topology, MeterRegistry registry) {
    this(new ResilientProducer(settings, requireService(serviceName, topology), registry),
        serviceName, new ObjectMapper(), Clock.systemUTC());
  }

  public EventProducer(ResilientProducer producer, String serviceName, ObjectMapper mapper, Clock clock) {
    requireService(serviceName, producer.topology());
    this.producer = producer;
    this.serviceName = serviceName;
    this.mapper = mapper;
    this.clock = clock;
  }

  public void publish(String eventType, Map<String, Object> payload) {
    ServiceMessage event = ServiceMessage.stamped(serviceName, eventType, payload, clock);
    producer.publish(event.toJson(mapper), null);
  }

  /** Fire and forget; a failure is logged and also available through the returned future. */
  public CompletableFuture<Void> publishAsync(String eventType, Map<String, Object> payload) {
    return CompletableFuture.runAsync(() -> publish(eventType, payload))
        .whenComplete((ok, e) -> {
          if (e != null) log.warn("Async publish of event {} failed: {}", eventType, e.getMessage());
        });
  }

  public boolean isConnected() {
    return producer.isConnected();
  }

  public String serviceName() {
    return serviceName;
  }

  @Override
  public void close() throws IOException {
    producer.close();
  }

  private static Topology requireService(String serviceName, Topology topology) {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("service name is required");
    }
    return topology;
  }
}
