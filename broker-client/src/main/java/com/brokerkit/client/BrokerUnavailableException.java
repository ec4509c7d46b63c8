package com.brokerkit.client;

/**
 * Thrown instead of blocking when a publish is attempted while the connection is down.
 */
public class BrokerUnavailableException extends BrokerClientException {
  public BrokerUnavailableException(String message) {
    super(message);
  }
}
