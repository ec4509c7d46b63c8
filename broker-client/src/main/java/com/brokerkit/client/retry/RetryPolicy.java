package com.brokerkit.client.retry;

import com.rabbitmq.client.Delivery;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Retry bookkeeping carried in message headers, and the backoff schedule derived from it.
 */
public final class RetryPolicy {
  public static final String RETRY_COUNT_HEADER = "x-retry-count";
  public static final String LAST_ERROR_HEADER = "x-last-error";
  public static final String LAST_RETRY_HEADER = "x-last-retry";

  private RetryPolicy() {}

  public static int retryCount(Delivery delivery) {
    return retryCount(delivery.getProperties() == null ? null : delivery.getProperties().getHeaders());
  }

  /**
   * Reads {@value #RETRY_COUNT_HEADER}. Only a signed 32-bit value counts, which is what the AMQP
   * table decodes it to; anything else is treated as a first attempt.
   */
  public static int retryCount(Map<String, Object> headers) {
    if (headers == null) return 0;
    Object value = headers.get(RETRY_COUNT_HEADER);
    return value instanceof Integer count ? count : 0;
  }

  /**
   * {@code base * 2^retryCount} seconds, capped at {@code maxRetryDelaySeconds}. Saturates at the cap
   * instead of overflowing for large counts.
   */
  public static Duration retryDelay(int retryCount, RetryConfig config) {
    long base = config.retryDelayBaseSeconds();
    long cap = config.maxRetryDelaySeconds();
    int n = Math.max(0, retryCount);
    long seconds;
    if (base == 0) {
      seconds = 0;
    } else if (n >= Long.SIZE - 2 || base > (cap >> n)) {
      seconds = cap;
    } else {
      seconds = base << n;
    }
    return Duration.ofSeconds(Math.min(seconds, cap));
  }

  /**
   * Headers for the republished copy: the original headers with the retry headers overwritten.
   */
  public static Map<String, Object> retryHeaders(Map<String, Object> original, int retryCount, Throwable error, Instant now) {
    Map<String, Object> headers = original == null ? new HashMap<>() : new HashMap<>(original);
    headers.put(RETRY_COUNT_HEADER, retryCount + 1);
    headers.put(LAST_ERROR_HEADER, describe(error));
    headers.put(LAST_RETRY_HEADER, now.getEpochSecond());
    return headers;
  }

  private static String describe(Throwable error) {
    String msg = error.getMessage();
    return msg == null || msg.isBlank() ? error.getClass().getName() : msg;
  }
}
