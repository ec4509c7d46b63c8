package com.brokerkit.client;

public class PublishException extends BrokerClientException {
  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
