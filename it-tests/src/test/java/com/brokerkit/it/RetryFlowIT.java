package com.brokerkit.it;

import com.brokerkit.client.connection.ConnectionSettings;
import com.brokerkit.client.consumer.ConsumerOptions;
import com.brokerkit.client.consumer.ResilientConsumer;
import com.brokerkit.client.producer.ResilientProducer;
import com.brokerkit.client.retry.RetryConfig;
import com.brokerkit.client.topology.Topology;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.GetResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Library-level retry and dead-letter flow against a live broker ({@code RABBITMQ_HOST}, ...). Every run
 * declares its own exchanges and queues and deletes them afterwards.
 */
public class RetryFlowIT {

  private ConnectionSettings settings;
  private Topology topology;
  private SimpleMeterRegistry registry;
  private ResilientProducer producer;
  private ResilientConsumer consumer;

  @BeforeEach
  void setUp() {
    String host = System.getenv().getOrDefault("RABBITMQ_HOST", "localhost");
    int port = Integer.parseInt(System.getenv().getOrDefault("RABBITMQ_PORT", "5672"));
    String user = System.getenv().getOrDefault("RABBITMQ_USER", "guest");
    String password = System.getenv().getOrDefault("RABBITMQ_PASSWORD", "guest");
    settings = new ConnectionSettings(host, port, user, password, "/", "it", Duration.ofSeconds(1), null);

    String run = UUID.randomUUID().toString().substring(0, 8);
    topology = Topology.builder("it.orders." + run)
        .queue("it.orders.created." + run)
        .routingKey("order.created")
        .deadLetterExchange("it.orders.dlx." + run)
        .deadLetterQueue("it.orders.dlq." + run)
        .deadLetterRoutingKey("order.failed")
        .build();
    registry = new SimpleMeterRegistry();
  }

  @AfterEach
  void tearDown() throws Exception {
    if (consumer != null) consumer.close();
    if (producer != null) producer.close();
    try (Connection conn = settings.toConnectionFactory().newConnection("it-cleanup");
         Channel ch = conn.createChannel()) {
      ch.queueDelete(topology.queueName());
      ch.queueDelete(topology.deadLetterQueueName());
      ch.exchangeDelete(topology.exchangeName());
      ch.exchangeDelete(topology.deadLetterExchangeName());
    }
  }

  private void start(RetryConfig retry, AtomicInteger attempts, int failures) {
    consumer = new ResilientConsumer(settings.withConnectionName("it-consumer"), topology, retry, d -> {
      if (attempts.incrementAndGet() <= failures) throw new IllegalStateException("attempt " + attempts.get() + " failed");
    }, new ConsumerOptions(1, Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofMillis(500)), registry);
    consumer.startConsuming();
    producer = new ResilientProducer(settings.withConnectionName("it-producer"), topology.producerOnly(), registry);
  }

  private double count(String meter) {
    return registry.get(meter).tag("queue", topology.queueName()).counter().count();
  }

  @Test
  void failingTwice_thenSucceeding_isAckedAfterTwoRetries() {
    AtomicInteger attempts = new AtomicInteger();
    start(new RetryConfig(3, 1, 5), attempts, 2);

    producer.publish("{\"order_id\":\"A1\"}".getBytes(StandardCharsets.UTF_8), null);

    await().atMost(Duration.ofSeconds(20)).until(() -> count("broker_acked_total") == 1.0d);
    assertThat(attempts).hasValue(3);
    assertThat(count("broker_retried_total")).isEqualTo(2.0d);
    assertThat(count("broker_dead_lettered_total")).isZero();
  }

  @Test
  void alwaysFailing_endsInTheDeadLetterQueueWithExhaustedCount() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    start(new RetryConfig(2, 0, 0), attempts, Integer.MAX_VALUE);

    producer.publish("{\"order_id\":\"A2\"}".getBytes(StandardCharsets.UTF_8), null);

    await().atMost(Duration.ofSeconds(20)).until(() -> count("broker_dead_lettered_total") == 1.0d);
    assertThat(attempts).hasValue(2);

    // rejected copies all land in the DLQ; the terminal one carries the exhausted count
    AtomicInteger terminal = new AtomicInteger();
    try (Connection conn = settings.toConnectionFactory().newConnection("it-dlq-reader");
         Channel ch = conn.createChannel()) {
      await().atMost(Duration.ofSeconds(10)).until(() -> {
        GetResponse msg;
        while ((msg = ch.basicGet(topology.deadLetterQueueName(), true)) != null) {
          Object count = msg.getProps().getHeaders() == null ? null : msg.getProps().getHeaders().get("x-retry-count");
          if (Integer.valueOf(2).equals(count)) terminal.incrementAndGet();
        }
        return terminal.get() > 0;
      });
    }
    assertThat(terminal).hasValue(1);
  }
}
