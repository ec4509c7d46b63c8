package com.brokerkit.client;

import com.rabbitmq.client.AMQP;

import java.util.Map;

/**
 * Message properties every client publishes with: JSON content, persistent delivery.
 */
public final class Envelopes {
  public static final String CONTENT_TYPE_JSON = "application/json";
  public static final int DELIVERY_MODE_PERSISTENT = 2;

  private Envelopes() {}

  public static AMQP.BasicProperties json(Map<String, Object> headers) {
    return new AMQP.BasicProperties.Builder()
        .contentType(CONTENT_TYPE_JSON)
        .deliveryMode(DELIVERY_MODE_PERSISTENT)
        .headers(headers)
        .build();
  }
}
