package com.brokerkit.orders.application;

/** A processing attempt failed in a way that is worth retrying. */
public class TransientProcessingException extends RuntimeException {
  public TransientProcessingException(String message) {
    super(message);
  }
}
