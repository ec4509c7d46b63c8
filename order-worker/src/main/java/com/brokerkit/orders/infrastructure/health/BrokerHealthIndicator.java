package com.brokerkit.orders.infrastructure.health;

import com.brokerkit.client.consumer.ResilientConsumer;
import com.brokerkit.client.producer.ResilientProducer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** UP only while both the order producer and the order consumer hold a live channel. */
@Component("broker")
public class BrokerHealthIndicator implements HealthIndicator {
  private final ResilientProducer producer;
  private final ResilientConsumer consumer;

  public BrokerHealthIndicator(ResilientProducer producer, ResilientConsumer consumer) {
    this.producer = producer;
    this.consumer = consumer;
  }

  @Override
  public Health health() {
    boolean producerUp = producer.isConnected();
    boolean consumerUp = consumer.isConnected();
    Health.Builder builder = producerUp && consumerUp ? Health.up() : Health.down();
    // a resource alarm leaves the session up, but publishes fail until it clears
    producer.blockedReason().ifPresent(reason -> builder.withDetail("producerBlocked", reason));
    return builder
        .withDetail("producer", producerUp ? "connected" : "reconnecting")
        .withDetail("consumer", consumerUp ? "connected" : "reconnecting")
        .withDetail("consuming", consumer.isConsuming())
        .withDetail("exchange", producer.topology().exchangeName())
        .withDetail("queue", consumer.topology().queueName())
        .build();
  }
}
