package com.brokerkit.orders.infrastructure.messaging;

import com.brokerkit.client.consumer.ConsumerOptions;
import com.brokerkit.client.consumer.ResilientConsumer;
import com.brokerkit.client.events.EventProducer;
import com.brokerkit.client.producer.ResilientProducer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Broker clients for the order flow. The consumer owns the {@code orders.created} queue and its
 * dead-letter queue; the producer only declares the exchanges it publishes into.
 */
@Configuration
@EnableConfigurationProperties(BrokerProperties.class)
public class BrokerConfig {

  public static final String SERVICE_NAME = "order-worker";

  @Bean(destroyMethod = "close")
  ResilientConsumer orderConsumer(BrokerProperties props, OrderCreatedHandler handler, MeterRegistry registry) {
    ConsumerOptions options = new ConsumerOptions(props.prefetch(), props.reconnectDelay(),
        Duration.ofSeconds(2), Duration.ofSeconds(1));
    return new ResilientConsumer(props.connection(SERVICE_NAME + "-consumer"), props.ordersTopology(),
        props.retryConfig(), handler, options, registry);
  }

  @Bean(destroyMethod = "close")
  ResilientProducer orderProducer(BrokerProperties props, MeterRegistry registry) {
    return new ResilientProducer(props.connection(SERVICE_NAME + "-producer"), props.ordersTopology().producerOnly(), registry);
  }

  @Bean(destroyMethod = "close")
  EventProducer eventProducer(BrokerProperties props, MeterRegistry registry) {
    return new EventProducer(props.connection(SERVICE_NAME + "-events"), SERVICE_NAME, registry);
  }

  /** Consumption starts once the web layer is up, so the health endpoint already answers. */
  @Bean
  ApplicationListener<ApplicationReadyEvent> startOrderConsumption(ResilientConsumer orderConsumer) {
    return event -> orderConsumer.startConsuming();
  }
}
