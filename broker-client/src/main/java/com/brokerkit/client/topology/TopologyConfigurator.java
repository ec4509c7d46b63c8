package com.brokerkit.client.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Declares a {@link Topology} on a channel. Every declaration is idempotent on the broker, so the
 * same configurator runs at construction and again after each reconnect.
 *
 * <p>Order matters: the dead-letter exchange exists before the main queue whose arguments name it.
 * A failed declaration aborts the rest and is rethrown; nothing already declared is rolled back.
 */
public class TopologyConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TopologyConfigurator.class);

  private final Topology topology;

  public TopologyConfigurator(Topology topology) {
    this.topology = topology;
  }

  public Topology topology() { return topology; }

  public void declare(Channel channel) throws IOException {
    if (topology.hasDeadLetterExchange()) {
      channel.exchangeDeclare(topology.deadLetterExchangeName(), BuiltinExchangeType.DIRECT, true, false, null);
    }
    if (topology.hasDeadLetterQueue()) {
      channel.queueDeclare(topology.deadLetterQueueName(), true, false, false, null);
      channel.queueBind(topology.deadLetterQueueName(), topology.deadLetterExchangeName(), topology.deadLetterRoutingKey());
    }

    channel.exchangeDeclare(topology.exchangeName(), topology.exchangeType(), true, false, null);

    // producer-only: the consumer owns the main queue
    if (topology.hasQueue()) {
      channel.queueDeclare(topology.queueName(), true, false, false, QueueArguments.mainQueue(topology));
      channel.queueBind(topology.queueName(), topology.exchangeName(), topology.routingKey());
    }
    log.debug("Declared topology exchange={} type={} queue={} dlx={} dlq={}",
        topology.exchangeName(), topology.exchangeType().getType(), topology.queueName(),
        topology.deadLetterExchangeName(), topology.deadLetterQueueName());
  }
}
