package com.brokerkit.client.consumer;

import com.brokerkit.client.BrokerSetupException;
import com.brokerkit.client.connection.ChannelInitializer;
import com.brokerkit.client.connection.ClientThreads;
import com.brokerkit.client.connection.ConnectionSettings;
import com.brokerkit.client.connection.ConnectionSupervisor;
import com.brokerkit.client.retry.RetryConfig;
import com.brokerkit.client.retry.RetryPolicy;
import com.brokerkit.client.topology.Topology;
import com.brokerkit.client.topology.TopologyConfigurator;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Consumes one queue with manual acknowledgement, retry with exponential backoff, and dead-lettering
 * once the retry budget is spent.
 *
 * <p>The receive loop runs on its own thread. It waits for a healthy session, sets the prefetch,
 * subscribes, and hands each delivery to a worker. A semaphore sized to the prefetch count bounds
 * how many deliveries are being processed at once, independently of the broker honouring QoS.
 * Reconnects are invisible to callers: the loop resubscribes on the new channel by itself.
 *
 * <p>Per delivery: a message whose {@code x-retry-count} has reached {@code maxRetries} is rejected
 * without requeue and never reaches the handler. Otherwise the handler runs; success is acked, a
 * failure rejects the delivery and schedules a copy with bumped retry headers back onto the main
 * exchange after the backoff delay. Ack, reject and republish failures are logged and counted only;
 * when the reject fails no copy is scheduled, since the broker still holds the original.
 */
public class ResilientConsumer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResilientConsumer.class);
  private static final Duration STOP_CHECK = Duration.ofMillis(100);

  private final ConnectionSupervisor supervisor;
  private final Topology topology;
  private final RetryConfig retryConfig;
  private final MessageHandler handler;
  private final ConsumerOptions options;
  private final Clock clock = Clock.systemUTC();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final CountDownLatch loopExited = new CountDownLatch(1);
  private final Semaphore inFlight;
  private final ExecutorService loopThread;
  private final ExecutorService workers;
  private final RetryScheduler retries;
  private final Counter acked;
  private final Counter retried;
  private final Counter deadLettered;
  private final Counter settleFailed;

  // guarded by supervisor lock
  private boolean consuming;
  private volatile DeliveryStream current;

  public ResilientConsumer(ConnectionSettings settings, Topology topology, RetryConfig retryConfig, MessageHandler handler) {
    this(settings, topology, retryConfig, handler, ConsumerOptions.DEFAULT, new SimpleMeterRegistry());
  }

  public ResilientConsumer(ConnectionSettings settings, Topology topology, RetryConfig retryConfig,
                           MessageHandler handler, ConsumerOptions options, MeterRegistry registry) {
    this(settings.toConnectionFactory(), settings, topology, retryConfig, handler, options, registry,
        Executors.newSingleThreadScheduledExecutor(ClientThreads.named(settings.connectionName() + "-retry")));
  }

  ResilientConsumer(ConnectionFactory factory, ConnectionSettings settings, Topology topology, RetryConfig retryConfig,
                    MessageHandler handler, ConsumerOptions options, MeterRegistry registry,
                    ScheduledExecutorService retryExecutor) {
    if (!topology.hasQueue()) {
      retryExecutor.shutdownNow();
      throw new IllegalArgumentException("consumer topology needs a queue name");
    }
    this.topology = topology;
    this.retryConfig = retryConfig;
    this.handler = handler;
    this.options = options;
    try {
      this.supervisor = ConnectionSupervisor.open(settings.connectionName(), "consumer", factory, settings.reconnectDelay(),
          new TopologyConfigurator(topology), ChannelInitializer.NONE, registry);
    } catch (BrokerSetupException e) {
      retryExecutor.shutdownNow();
      throw e;
    }
    String queue = topology.queueName();
    this.acked = Counter.builder("broker_acked_total").tag("queue", queue).register(registry);
    this.retried = Counter.builder("broker_retried_total").tag("queue", queue).register(registry);
    this.deadLettered = Counter.builder("broker_dead_lettered_total").tag("queue", queue).register(registry);
    this.settleFailed = Counter.builder("broker_settle_failed_total").tag("queue", queue).register(registry);
    Counter republishFailed = Counter.builder("broker_republish_failed_total").tag("queue", queue).register(registry);
    this.inFlight = new Semaphore(options.prefetchCount());
    this.loopThread = Executors.newSingleThreadExecutor(ClientThreads.named(settings.connectionName() + "-receive"));
    this.workers = Executors.newCachedThreadPool(ClientThreads.named(settings.connectionName() + "-worker"));
    this.retries = new RetryScheduler(supervisor, topology, retryExecutor, republishFailed);
    supervisor.addReconnectListener(this::onReconnected);
  }

  /** Starts the receive loop; a no-op when already consuming. */
  public void startConsuming() {
    supervisor.writeLock().lock();
    try {
      if (consuming) return;
      if (stopSignal.getCount() == 0) throw new IllegalStateException("consumer is closed");
      consuming = true;
    } finally {
      supervisor.writeLock().unlock();
    }
    loopThread.execute(this::consumeLoop);
  }

  public boolean isConsuming() {
    supervisor.readLock().lock();
    try {
      return consuming;
    } finally {
      supervisor.readLock().unlock();
    }
  }

  public boolean isConnected() {
    return supervisor.isConnected();
  }

  public Topology topology() { return topology; }

  @Override
  public void close() throws IOException {
    supervisor.writeLock().lock();
    try {
      consuming = false;
    } finally {
      supervisor.writeLock().unlock();
    }
    stopSignal.countDown();
    try {
      if (!loopExited.await(options.closeGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("Receive loop for {} still running after close grace", topology.queueName());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    retries.shutdown();
    loopThread.shutdownNow();
    workers.shutdown();
    supervisor.close();
  }

  private void onReconnected() {
    if (!isConsuming()) return;
    DeliveryStream stream = current;
    Optional<Channel> channel = supervisor.healthyChannel();
    if (stream != null && channel.map(ch -> ch != stream.channel()).orElse(true)) {
      log.info("Restarting message consumption from {} after reconnection...", topology.queueName());
      stream.markClosed("connection replaced");
    }
  }

  private void consumeLoop() {
    String queue = topology.queueName();
    try {
      while (!stopped()) {
        Optional<Channel> healthy = supervisor.healthyChannel();
        if (healthy.isEmpty()) {
          log.warn("RabbitMQ connection is not available for {}, waiting...", queue);
          if (awaitStop(options.pollDelay())) break;
          continue;
        }
        Channel channel = healthy.get();
        DeliveryStream stream;
        try {
          channel.basicQos(options.prefetchCount());
          stream = DeliveryStream.subscribe(channel, queue);
        } catch (IOException | RuntimeException e) {
          log.warn("Failed to register a consumer on {}: {}, retrying...", queue, e.toString());
          if (awaitStop(options.pollDelay())) break;
          continue;
        }
        current = stream;
        log.info("Starting to consume messages from queue: {}", queue);
        boolean resubscribe;
        try {
          resubscribe = drain(stream);
        } finally {
          stream.release();
        }
        if (!resubscribe) break;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      current = null;
      log.info("Stopped consuming messages from queue: {}", queue);
      loopExited.countDown();
    }
  }

  /** Returns true when the stream died and the loop should resubscribe, false when stopping. */
  private boolean drain(DeliveryStream stream) throws InterruptedException {
    while (!stopped()) {
      DeliveryStream.Item item = stream.poll(STOP_CHECK);
      if (item == null) continue;
      if (item.isClosed()) {
        log.warn("Message stream closed ({}), will retry consumption...", item.closeReason());
        return !awaitStop(options.resubscribeDelay());
      }
      if (!dispatch(stream.channel(), item.delivery())) return false;
    }
    return false;
  }

  private boolean dispatch(Channel channel, Delivery delivery) throws InterruptedException {
    while (!inFlight.tryAcquire(STOP_CHECK.toMillis(), TimeUnit.MILLISECONDS)) {
      if (stopped()) {
        requeue(channel, delivery);
        return false;
      }
    }
    try {
      workers.execute(() -> {
        try {
          process(channel, delivery);
        } finally {
          inFlight.release();
        }
      });
    } catch (RejectedExecutionException e) {
      inFlight.release();
      requeue(channel, delivery);
      return false;
    }
    return true;
  }

  void process(Channel channel, Delivery delivery) {
    long tag = delivery.getEnvelope().getDeliveryTag();
    MDC.put("queue", topology.queueName());
    MDC.put("deliveryTag", Long.toString(tag));
    try {
      int retryCount = RetryPolicy.retryCount(delivery);
      if (retryCount >= retryConfig.maxRetries()) {
        log.warn("Max retries exceeded for message (x-retry-count={}), sending to DLQ", retryCount);
        if (reject(channel, tag)) deadLettered.increment();
        return;
      }

      try {
        handler.handle(delivery);
      } catch (Exception e) {
        log.warn("Failed to process message (attempt {}/{}): {}", retryCount + 1, retryConfig.maxRetries(), e.toString());
        Map<String, Object> original = delivery.getProperties() == null ? null : delivery.getProperties().getHeaders();
        Map<String, Object> headers = RetryPolicy.retryHeaders(original, retryCount, e, clock.instant());
        // a failed reject leaves the delivery unacked; the broker redelivers it, so no copy is republished
        if (!reject(channel, tag)) return;
        retries.schedule(delivery.getBody(), headers, RetryPolicy.retryDelay(retryCount, retryConfig));
        retried.increment();
        return;
      }

      try {
        channel.basicAck(tag, false);
        acked.increment();
      } catch (IOException | RuntimeException e) {
        settleFailed.increment();
        log.error("Failed to acknowledge message: {}", e.toString());
      }
    } finally {
      MDC.remove("deliveryTag");
      MDC.remove("queue");
    }
  }

  private boolean reject(Channel channel, long tag) {
    try {
      channel.basicReject(tag, false);
      return true;
    } catch (IOException | RuntimeException e) {
      settleFailed.increment();
      log.error("Failed to reject message: {}", e.toString());
      return false;
    }
  }

  private void requeue(Channel channel, Delivery delivery) {
    long tag = delivery.getEnvelope().getDeliveryTag();
    if (!channel.isOpen()) return;
    try {
      channel.basicReject(tag, true);
    } catch (IOException | RuntimeException e) {
      log.debug("Could not requeue delivery {} on shutdown: {}", tag, e.toString());
    }
  }

  private boolean stopped() {
    return stopSignal.getCount() == 0;
  }

  private boolean awaitStop(Duration delay) throws InterruptedException {
    return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
  }
}
