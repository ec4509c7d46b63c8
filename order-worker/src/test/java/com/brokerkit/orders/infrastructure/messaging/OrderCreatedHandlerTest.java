package com.brokerkit.orders.infrastructure.messaging;

import com.brokerkit.client.Envelopes;
import com.brokerkit.client.events.EventProducer;
import com.brokerkit.orders.application.OrderProcessingService;
import com.brokerkit.orders.application.TransientProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

public class OrderCreatedHandlerTest {

  private OrderProcessingService service;
  private EventProducer events;
  private SimpleMeterRegistry registry;
  private OrderCreatedHandler handler;

  @BeforeEach
  void setUp() {
    service = new OrderProcessingService();
    events = mock(EventProducer.class);
    registry = new SimpleMeterRegistry();
    handler = new OrderCreatedHandler(service, events, new ObjectMapper(), registry);
  }

  private static Delivery delivery(String json, Map<String, Object> headers) {
    return new Delivery(new Envelope(1L, false, "orders", "order.created"), Envelopes.json(headers),
        json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void sameOrderTwice_processesOnce_andCountsDuplicate() throws Exception {
    Delivery d = delivery("{\"order_id\":\"A1\",\"amountCents\":1250}", null);

    handler.handle(d);
    handler.handle(d);

    assertThat(registry.counter("orders_processed_total").count()).isEqualTo(1.0d);
    assertThat(registry.counter("orders_duplicate_total").count()).isEqualTo(1.0d);
    Map<String, Object> expected = Map.of("orderId", "A1", "amountCents", 1250L);
    verify(events, times(1)).publishAsync("order.processed", expected);
  }

  @Test
  void malformedPayload_isThrownBackToTheConsumer() {
    assertThatThrownBy(() -> handler.handle(delivery("not json", null)))
        .isInstanceOf(JsonProcessingException.class);
    assertThatThrownBy(() -> handler.handle(delivery("{\"customerId\":\"c-1\"}", null)))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(events);
  }

  @Test
  void transientFailure_propagates_andRequestIdIsClearedAfterwards() {
    Delivery d = delivery("{\"orderId\":\"A2\",\"simulateFailures\":1}", Map.of("X-Request-Id", "req-7"));

    assertThatThrownBy(() -> handler.handle(d)).isInstanceOf(TransientProcessingException.class);

    assertThat(MDC.get("requestId")).isNull();
    assertThat(registry.counter("orders_processed_total").count()).isZero();
  }
}
