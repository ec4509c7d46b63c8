package com.brokerkit.client;

/**
 * Dial, channel-open or topology declaration failed while a client was being built.
 * The client instance is unusable; nothing opened during setup is left behind.
 */
public class BrokerSetupException extends BrokerClientException {
  public BrokerSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
