package com.brokerkit.orders.infrastructure.messaging;

import com.brokerkit.client.PublishException;
import com.brokerkit.client.producer.ResilientProducer;
import com.brokerkit.orders.domain.OrderCreated;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
public class OrderPublisher {
  private static final Logger log = LoggerFactory.getLogger(OrderPublisher.class);

  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  public static final String REQUEST_ID_MDC_KEY = "requestId";

  private final ResilientProducer producer;
  private final ObjectMapper mapper;
  private final String routingKey;
  private final Duration timeout;

  public OrderPublisher(ResilientProducer producer, ObjectMapper mapper, BrokerProperties props) {
    this.producer = producer;
    this.mapper = mapper;
    this.routingKey = props.orders().routingKey();
    this.timeout = props.publishTimeout();
  }

  /**
   * Publishes and waits for the broker confirm. Fails fast with
   * {@link com.brokerkit.client.BrokerUnavailableException} while the broker is unreachable.
   */
  public void publish(OrderCreated order) {
    byte[] body;
    try {
      body = mapper.writeValueAsBytes(order);
    } catch (JsonProcessingException e) {
      throw new PublishException("failed to serialize order " + order.orderId(), e);
    }
    Map<String, Object> headers = new HashMap<>();
    String requestId = MDC.get(REQUEST_ID_MDC_KEY);
    if (requestId != null) headers.put(REQUEST_ID_HEADER, requestId);

    producer.publishWithRoutingKey(body, headers, routingKey, timeout);
    log.info("Published {} for order {}", routingKey, order.orderId());
  }
}
