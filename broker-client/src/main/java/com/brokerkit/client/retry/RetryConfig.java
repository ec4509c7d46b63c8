package com.brokerkit.client.retry;

/**
 * Retry budget and backoff bounds, all in whole seconds.
 */
public record RetryConfig(int maxRetries, int retryDelayBaseSeconds, int maxRetryDelaySeconds) {

  public static final RetryConfig DEFAULT = new RetryConfig(3, 5, 300);

  public RetryConfig {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    if (retryDelayBaseSeconds < 0) throw new IllegalArgumentException("retryDelayBaseSeconds must be >= 0");
    if (maxRetryDelaySeconds < 0) throw new IllegalArgumentException("maxRetryDelaySeconds must be >= 0");
  }
}
