package com.brokerkit.client.consumer;

import java.time.Duration;

/**
 * @param prefetchCount    unacknowledged deliveries the broker may push, and the in-flight bound
 * @param pollDelay        pause before re-checking a down session or retrying a failed subscribe
 * @param resubscribeDelay pause after the broker drops the subscription
 * @param closeGrace       how long {@code close()} waits for the receive loop to notice the stop
 */
public record ConsumerOptions(int prefetchCount, Duration pollDelay, Duration resubscribeDelay, Duration closeGrace) {

  public static final ConsumerOptions DEFAULT =
      new ConsumerOptions(1, Duration.ofSeconds(5), Duration.ofSeconds(2), Duration.ofMillis(100));

  public ConsumerOptions {
    if (prefetchCount < 1) throw new IllegalArgumentException("prefetchCount must be >= 1");
    if (pollDelay == null || resubscribeDelay == null || closeGrace == null) {
      throw new IllegalArgumentException("delays must not be null");
    }
  }
}
