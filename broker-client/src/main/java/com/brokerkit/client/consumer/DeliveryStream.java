package com.brokerkit.client.consumer;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A manual-ack subscription read as a blocking stream. The client library pushes deliveries on its
 * own threads; they are queued here and the receive loop pulls them. Cancellation by the broker, a
 * channel shutdown, or {@link #markClosed} append a terminal item after which the stream is dead.
 */
final class DeliveryStream {
  private static final Logger log = LoggerFactory.getLogger(DeliveryStream.class);

  record Item(Delivery delivery, String closeReason) {
    boolean isClosed() { return delivery == null; }
  }

  private final BlockingQueue<Item> items = new LinkedBlockingQueue<>();
  private final Channel channel;
  private volatile String consumerTag;

  private DeliveryStream(Channel channel) {
    this.channel = channel;
  }

  static DeliveryStream subscribe(Channel channel, String queue) throws IOException {
    DeliveryStream stream = new DeliveryStream(channel);
    stream.consumerTag = channel.basicConsume(queue, false,
        (tag, delivery) -> stream.items.add(new Item(delivery, null)),
        tag -> stream.markClosed("subscription cancelled by broker"),
        (tag, sig) -> stream.markClosed(sig.getMessage()));
    return stream;
  }

  Channel channel() { return channel; }

  /** Next item, or null if none arrived within the timeout. */
  Item poll(Duration timeout) throws InterruptedException {
    return items.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  void markClosed(String reason) {
    items.add(new Item(null, reason == null ? "closed" : reason));
  }

  /**
   * Cancels the subscription and hands back deliveries that were queued but never dispatched, so they
   * do not sit unacknowledged on a channel that stays open. Best effort: a dead channel has already
   * dropped the subscription and the broker requeues its deliveries itself.
   */
  void release() {
    String tag = consumerTag;
    if (tag == null || !channel.isOpen()) return;
    try {
      channel.basicCancel(tag);
    } catch (IOException | RuntimeException e) {
      log.debug("Ignoring error while cancelling consumer {}: {}", tag, e.toString());
    }
    Item item;
    while ((item = items.poll()) != null) {
      if (item.isClosed()) continue;
      long deliveryTag = item.delivery().getEnvelope().getDeliveryTag();
      try {
        channel.basicReject(deliveryTag, true);
      } catch (IOException | RuntimeException e) {
        log.debug("Could not requeue undispatched delivery {}: {}", deliveryTag, e.toString());
      }
    }
  }
}
