package com.brokerkit.client.consumer;

import com.rabbitmq.client.Delivery;

/**
 * Processes one delivery. Returning normally acknowledges it; throwing sends it down the retry path,
 * and once the retry budget is spent, to the dead-letter exchange.
 */
@FunctionalInterface
public interface MessageHandler {
  void handle(Delivery delivery) throws Exception;
}
