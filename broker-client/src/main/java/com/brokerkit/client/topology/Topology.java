package com.brokerkit.client.topology;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Exchanges, queues and bindings a client owns on the broker.
 *
 * <p>A blank {@code queueName} means producer-only: the main queue is declared elsewhere
 * (usually by the consumer) and this client only publishes into the exchange.
 */
public record Topology(
    String exchangeName,
    BuiltinExchangeType exchangeType,
    String queueName,
    String routingKey,
    String deadLetterExchangeName,
    String deadLetterQueueName,
    String deadLetterRoutingKey) {

  public Topology {
    if (exchangeName == null || exchangeName.isBlank()) {
      throw new IllegalArgumentException("exchangeName must not be blank");
    }
    exchangeType = exchangeType == null ? BuiltinExchangeType.DIRECT : exchangeType;
    queueName = nullToEmpty(queueName);
    routingKey = nullToEmpty(routingKey);
    deadLetterExchangeName = nullToEmpty(deadLetterExchangeName);
    deadLetterQueueName = nullToEmpty(deadLetterQueueName);
    deadLetterRoutingKey = nullToEmpty(deadLetterRoutingKey);
  }

  public boolean hasQueue() { return !queueName.isBlank(); }
  public boolean hasDeadLetterExchange() { return !deadLetterExchangeName.isBlank(); }
  public boolean hasDeadLetterQueue() { return !deadLetterQueueName.isBlank(); }

  /** Same topology without a main queue, for a producer publishing into a consumer-owned queue. */
  public Topology producerOnly() {
    return new Topology(exchangeName, exchangeType, "", routingKey,
        deadLetterExchangeName, deadLetterQueueName, deadLetterRoutingKey);
  }

  public static Builder builder(String exchangeName) {
    return new Builder(exchangeName);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  public static final class Builder {
    private final String exchangeName;
    private BuiltinExchangeType exchangeType = BuiltinExchangeType.DIRECT;
    private String queueName;
    private String routingKey;
    private String deadLetterExchangeName;
    private String deadLetterQueueName;
    private String deadLetterRoutingKey;

    private Builder(String exchangeName) {
      this.exchangeName = exchangeName;
    }

    public Builder exchangeType(BuiltinExchangeType type) { this.exchangeType = type; return this; }
    public Builder queue(String name) { this.queueName = name; return this; }
    public Builder routingKey(String key) { this.routingKey = key; return this; }
    public Builder deadLetterExchange(String name) { this.deadLetterExchangeName = name; return this; }
    public Builder deadLetterQueue(String name) { this.deadLetterQueueName = name; return this; }
    public Builder deadLetterRoutingKey(String key) { this.deadLetterRoutingKey = key; return this; }

    public Topology build() {
      return new Topology(exchangeName, exchangeType, queueName, routingKey,
          deadLetterExchangeName, deadLetterQueueName, deadLetterRoutingKey);
    }
  }
}
