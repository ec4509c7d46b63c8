package com.brokerkit.client.producer;

import com.brokerkit.client.BrokerUnavailableException;
import com.brokerkit.client.Envelopes;
import com.brokerkit.client.PublishException;
import com.brokerkit.client.connection.ConnectionSettings;
import com.brokerkit.client.connection.ConnectionSupervisor;
import com.brokerkit.client.topology.Topology;
import com.brokerkit.client.topology.TopologyConfigurator;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes JSON messages through a supervised channel in publisher-confirm mode.
 *
 * <p>A publish never waits for a reconnect: when the session is down it fails at once with
 * {@link BrokerUnavailableException} and the caller decides whether to retry. When the session is
 * up the call returns once the broker confirms, or fails with {@link PublishException} on a nack,
 * a broker error, or when the timeout elapses first. The timeout covers the write and the confirm
 * together. A connection the broker has blocked for a resource alarm is treated like a down one,
 * since a write into it would stall until the alarm clears.
 */
public class ResilientProducer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResilientProducer.class);

  public static final Duration DEFAULT_PUBLISH_TIMEOUT = Duration.ofSeconds(5);

  private final ConnectionSupervisor supervisor;
  private final Topology topology;
  private final Counter published;
  private final Counter failed;

  public ResilientProducer(ConnectionSettings settings, Topology topology) {
    this(settings, topology, new SimpleMeterRegistry());
  }

  public ResilientProducer(ConnectionSettings settings, Topology topology, MeterRegistry registry) {
    this(settings.toConnectionFactory(), settings, topology, registry);
  }

  ResilientProducer(ConnectionFactory factory, ConnectionSettings settings, Topology topology, MeterRegistry registry) {
    this.topology = topology;
    this.supervisor = ConnectionSupervisor.open(settings.connectionName(), "producer", factory, settings.reconnectDelay(),
        new TopologyConfigurator(topology), Channel::confirmSelect, registry);
    this.published = Counter.builder("broker_published_total").tag("exchange", topology.exchangeName()).register(registry);
    this.failed = Counter.builder("broker_publish_failed_total").tag("exchange", topology.exchangeName()).register(registry);
  }

  public Topology topology() { return topology; }

  public void publish(byte[] body, Map<String, Object> headers) {
    publishWithRoutingKey(body, headers, topology.routingKey(), null);
  }

  public void publish(byte[] body, Map<String, Object> headers, Duration timeout) {
    publishWithRoutingKey(body, headers, topology.routingKey(), timeout);
  }

  /** For topic exchanges where the key varies per message, e.g. {@code tasks.<type>}. */
  public void publishWithRoutingKey(byte[] body, Map<String, Object> headers, String routingKey) {
    publishWithRoutingKey(body, headers, routingKey, null);
  }

  public void publishWithRoutingKey(byte[] body, Map<String, Object> headers, String routingKey, Duration timeout) {
    Objects.requireNonNull(body, "body");
    Channel channel = supervisor.healthyChannel()
        .orElseThrow(() -> {
          failed.increment();
          return new BrokerUnavailableException("RabbitMQ connection is not available");
        });
    Optional<String> blocked = supervisor.blockedReason();
    if (blocked.isPresent()) {
      failed.increment();
      throw new BrokerUnavailableException("RabbitMQ connection is blocked by the broker: " + blocked.get());
    }
    Duration wait = timeout == null || timeout.isNegative() || timeout.isZero() ? DEFAULT_PUBLISH_TIMEOUT : timeout;
    long deadline = System.nanoTime() + wait.toNanos();
    boolean acked;
    try {
      channel.basicPublish(topology.exchangeName(), routingKey, false, Envelopes.json(headers), body);
      // waitForConfirms(0) would wait forever
      long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remaining <= 0) throw new TimeoutException("publish write used up the deadline");
      acked = channel.waitForConfirms(remaining);
    } catch (TimeoutException e) {
      failed.increment();
      throw new PublishException("no publish confirm within " + wait.toMillis() + " ms", e);
    } catch (IOException | RuntimeException e) {
      failed.increment();
      throw new PublishException("failed to publish message: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failed.increment();
      throw new PublishException("interrupted while waiting for publish confirm", e);
    }
    if (!acked) {
      failed.increment();
      throw new PublishException("broker nacked message for exchange " + topology.exchangeName());
    }
    published.increment();
    log.debug("Published to exchange={} routingKey={} bytes={}", topology.exchangeName(), routingKey, body.length);
  }

  public boolean isConnected() {
    return supervisor.isConnected();
  }

  public Optional<String> blockedReason() {
    return supervisor.blockedReason();
  }

  @Override
  public void close() throws IOException {
    supervisor.close();
  }
}
