package com.brokerkit.client.tasks;

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
 * Publishes work items onto the {@code tasks} topic exchange. The routing key is derived from the task
 * type, so {@code email.verify} is routed as {@code tasks.email.verify} and workers bind with patterns
 * such as {@code tasks.email.*}.
 */
public class TaskProducer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TaskProducer.class);

  public static final String ROUTING_KEY_PREFIX = "tasks.";

  public static final Topology DEFAULT_TOPOLOGY = Topology.builder("tasks")
      .exchangeType(BuiltinExchangeType.TOPIC)
      .deadLetterExchange("tasks.dlx")
      .build();

  private final ResilientProducer producer;
  private final String serviceName;
  private final ObjectMapper mapper;
  private final Clock clock;

  public TaskProducer(ConnectionSettings settings, String serviceName, MeterRegistry registry) {
    this(settings, serviceName, DEFAULT_TOPOLOGY, registry);
  }

  public TaskProducer(ConnectionSettings settings, String serviceName, Topology topology, MeterRegistry registry) {
    this(new ResilientProducer(settings, requireService(serviceName, topology), registry),
        serviceName, new ObjectMapper(), Clock.systemUTC());
  }

  public TaskProducer(ResilientProducer producer, String serviceName, ObjectMapper mapper, Clock clock) {
    requireService(serviceName, producer.topology());
    this.producer = producer;
    this.serviceName = serviceName;
    this.mapper = mapper;
    this.clock = clock;
  }

  public static String routingKeyFor(String taskType) {
    return ROUTING_KEY_PREFIX + taskType;
  }

  public void publish(String taskType, Map<String, Object> payload) {
    publishWithCustomRoutingKey(taskType, payload, routingKeyFor(taskType));
  }

  /** Overrides the {@code tasks.<type>} pattern. */
  public void publishWithCustomRoutingKey(String taskType, Map<String, Object> payload, String routingKey) {
    ServiceMessage task = ServiceMessage.stamped(serviceName, taskType, payload, clock);
    producer.publishWithRoutingKey(task.toJson(mapper), null, routingKey);
  }

  public CompletableFuture<Void> publishAsync(String taskType, Map<String, Object> payload) {
    return CompletableFuture.runAsync(() -> publish(taskType, payload))
        .whenComplete((ok, e) -> {
          if (e != null) log.warn("Async publish of task {} failed: {}", taskType, e.getMessage());
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
