package com.brokerkit.orders.infrastructure.messaging;

import com.brokerkit.client.connection.ConnectionSettings;
import com.brokerkit.client.retry.RetryConfig;
import com.brokerkit.client.topology.Topology;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * {@code broker.*} settings. Each client gets its own connection, named after the service and its role.
 */
@ConfigurationProperties(prefix = "broker")
public record BrokerProperties(
    @DefaultValue("localhost") String host,
    @DefaultValue("5672") int port,
    @DefaultValue("guest") String username,
    @DefaultValue("guest") String password,
    @DefaultValue("/") String virtualHost,
    @DefaultValue("5s") Duration reconnectDelay,
    @DefaultValue("5s") Duration publishTimeout,
    @DefaultValue("1") int prefetch,
    @DefaultValue Orders orders,
    @DefaultValue Retry retry) {

  public record Orders(
      @DefaultValue("orders") String exchange,
      @DefaultValue("orders.created") String queue,
      @DefaultValue("order.created") String routingKey,
      @DefaultValue("orders.dlx") String deadLetterExchange,
      @DefaultValue("orders.dlq") String deadLetterQueue,
      @DefaultValue("order.failed") String deadLetterRoutingKey) {
  }

  public record Retry(
      @DefaultValue("3") int maxRetries,
      @DefaultValue("5") int baseDelaySeconds,
      @DefaultValue("300") int maxDelaySeconds) {
  }

  public ConnectionSettings connection(String connectionName) {
    return new ConnectionSettings(host, port, username, password, virtualHost, connectionName, reconnectDelay, null);
  }

  public Topology ordersTopology() {
    return Topology.builder(orders.exchange())
        .queue(orders.queue())
        .routingKey(orders.routingKey())
        .deadLetterExchange(orders.deadLetterExchange())
        .deadLetterQueue(orders.deadLetterQueue())
        .deadLetterRoutingKey(orders.deadLetterRoutingKey())
        .build();
  }

  public RetryConfig retryConfig() {
    return new RetryConfig(retry.maxRetries(), retry.baseDelaySeconds(), retry.maxDelaySeconds());
  }
}
