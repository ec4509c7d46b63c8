package com.brokerkit.client;

/**
 * Base type for failures surfaced by the broker client to its callers.
 */
public class BrokerClientException extends RuntimeException {
  public BrokerClientException(String message) {
    super(message);
  }

  public BrokerClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
