package com.brokerkit.orders.infrastructure.messaging;

import com.brokerkit.client.consumer.MessageHandler;
import com.brokerkit.client.events.EventProducer;
import com.brokerkit.orders.application.OrderProcessingService;
import com.brokerkit.orders.domain.OrderCreated;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Delivery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Processes {@code order.created}. Any exception leaves the retry decision to the consumer: the
 * message is republished with backoff and dead-lettered once the retry budget is spent.
 */
@Component
public class OrderCreatedHandler implements MessageHandler {
  private static final Logger log = LoggerFactory.getLogger(OrderCreatedHandler.class);

  public static final String ORDER_PROCESSED_EVENT = "order.processed";

  private final OrderProcessingService service;
  private final EventProducer events;
  private final ObjectMapper mapper;
  private final Counter processed;
  private final Counter duplicates;

  public OrderCreatedHandler(OrderProcessingService service, EventProducer events, ObjectMapper mapper,
                             MeterRegistry registry) {
    this.service = service;
    this.events = events;
    this.mapper = mapper;
    this.processed = registry.counter("orders_processed_total");
    this.duplicates = registry.counter("orders_duplicate_total");
  }

  @Override
  public void handle(Delivery delivery) throws Exception {
    String requestId = requestId(delivery);
    if (requestId != null) MDC.put(OrderPublisher.REQUEST_ID_MDC_KEY, requestId);
    try {
      OrderCreated order = mapper.readValue(delivery.getBody(), OrderCreated.class);
      if (order.orderId() == null || order.orderId().isBlank()) {
        throw new IllegalArgumentException("order.created message without orderId");
      }
      if (service.process(order)) {
        processed.increment();
        log.info("Processed order {}", order.orderId());
        events.publishAsync(ORDER_PROCESSED_EVENT, Map.of("orderId", order.orderId(), "amountCents", order.amountCents()));
      } else {
        log.debug("Duplicate order ignored: {}", order.orderId());
        duplicates.increment();
      }
    } catch (Exception e) {
      log.error("Failed to process order.created; will retry and may be dead-lettered", e);
      throw e;
    } finally {
      MDC.remove(OrderPublisher.REQUEST_ID_MDC_KEY);
    }
  }

  private static String requestId(Delivery delivery) {
    if (delivery.getProperties() == null || delivery.getProperties().getHeaders() == null) return null;
    Object value = delivery.getProperties().getHeaders().get(OrderPublisher.REQUEST_ID_HEADER);
    return value == null ? null : value.toString();
  }
}
