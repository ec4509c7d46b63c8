package com.brokerkit.client.consumer;

import com.brokerkit.client.Envelopes;
import com.brokerkit.client.connection.ConnectionSupervisor;
import com.brokerkit.client.topology.Topology;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Republishes a failed message onto the main exchange after its backoff delay. The channel is looked
 * up when the delay expires, not when the retry is scheduled, so a retry that straddles a reconnect
 * goes out on the new channel.
 */
class RetryScheduler {
  private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

  private final ConnectionSupervisor supervisor;
  private final Topology topology;
  private final ScheduledExecutorService scheduler;
  private final Counter failed;

  RetryScheduler(ConnectionSupervisor supervisor, Topology topology, ScheduledExecutorService scheduler, Counter failed) {
    this.supervisor = supervisor;
    this.topology = topology;
    this.scheduler = scheduler;
    this.failed = failed;
  }

  void schedule(byte[] body, Map<String, Object> headers, Duration delay) {
    try {
      scheduler.schedule(() -> republish(body, headers, delay), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      failed.increment();
      log.error("Failed to schedule retry, consumer is shutting down (x-retry-count={})", headers.get("x-retry-count"));
    }
  }

  private void republish(byte[] body, Map<String, Object> headers, Duration delay) {
    Optional<Channel> channel = supervisor.healthyChannel();
    if (channel.isEmpty()) {
      failed.increment();
      log.error("Failed to republish retry: RabbitMQ connection is not available (x-retry-count={})",
          headers.get("x-retry-count"));
      return;
    }
    try {
      channel.get().basicPublish(topology.exchangeName(), topology.routingKey(), false, Envelopes.json(headers), body);
      log.info("Republished retry after {} ms (x-retry-count={})", delay.toMillis(), headers.get("x-retry-count"));
    } catch (IOException | RuntimeException e) {
      failed.increment();
      log.error("Failed to republish retry", e);
    }
  }

  void shutdown() {
    int dropped = scheduler.shutdownNow().size();
    if (dropped > 0) {
      log.warn("Dropped {} pending retries on shutdown; the rejected originals went to the dead-letter exchange if one is set", dropped);
    }
  }
}
