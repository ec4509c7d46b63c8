package com.brokerkit.client.events;

import com.brokerkit.client.BrokerUnavailableException;
import com.brokerkit.client.producer.ResilientProducer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

public class EventProducerTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30.456Z"), ZoneOffset.UTC);
  private ResilientProducer producer;

  @BeforeEach
  void setUp() {
    producer = mock(ResilientProducer.class);
    when(producer.topology()).thenReturn(EventProducer.DEFAULT_TOPOLOGY);
  }

  @Test
  void publish_wrapsPayloadWithServiceAndType() throws Exception {
    EventProducer events = new EventProducer(producer, "order-worker", mapper, clock);

    events.publish("order.completed", Map.of("orderId", "o-1"));

    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(producer).publish(body.capture(), isNull());
    JsonNode json = mapper.readTree(body.getValue());
    assertThat(json.get("service").asText()).isEqualTo("order-worker");
    assertThat(json.get("type").asText()).isEqualTo("order.completed");
    assertThat(json.at("/payload/orderId").asText()).isEqualTo("o-1");
    assertThat(json.at("/payload/timestamp").asText()).isEqualTo("2024-03-01T10:15:30Z");
  }

  @Test
  void publish_keepsCallerTimestamp() throws Exception {
    EventProducer events = new EventProducer(producer, "order-worker", mapper, clock);

    events.publish("order.completed", Map.of("timestamp", "2020-01-01T00:00:00Z"));

    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(producer).publish(body.capture(), isNull());
    assertThat(mapper.readTree(body.getValue()).at("/payload/timestamp").asText()).isEqualTo("2020-01-01T00:00:00Z");
  }

  @Test
  void publishAsync_surfacesFailureThroughFuture() {
    doThrow(new BrokerUnavailableException("RabbitMQ connection is not available"))
        .when(producer).publish(any(byte[].class), any());
    EventProducer events = new EventProducer(producer, "order-worker", mapper, clock);

    CompletableFuture<Void> result = events.publishAsync("order.completed", Map.of());

    assertThatThrownBy(result::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(BrokerUnavailableException.class);
  }

  @Test
  void blankServiceName_isRejected() {
    assertThatThrownBy(() -> new EventProducer(producer, " ", mapper, clock))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("service name is required");
  }

  @Test
  void defaultTopology_isProducerOnlyDirectExchange() {
    assertThat(EventProducer.DEFAULT_TOPOLOGY.exchangeName()).isEqualTo("events");
    assertThat(EventProducer.DEFAULT_TOPOLOGY.routingKey()).isEqualTo("event");
    assertThat(EventProducer.DEFAULT_TOPOLOGY.hasQueue()).isFalse();
    assertThat(EventProducer.DEFAULT_TOPOLOGY.deadLetterExchangeName()).isEqualTo("events.dlx");
  }
}
