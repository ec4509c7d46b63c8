package com.brokerkit.client.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

public class TopologyConfiguratorTest {

  private static final Topology ORDERS = Topology.builder("orders")
      .queue("orders.created")
      .routingKey("order.created")
      .deadLetterExchange("orders.dlx")
      .deadLetterQueue("orders.dlq")
      .deadLetterRoutingKey("order.failed")
      .build();

  @Test
  void declare_deadLetterSideFirst_thenMainQueueWithPolicy() throws Exception {
    Channel channel = mock(Channel.class);

    new TopologyConfigurator(ORDERS).declare(channel);

    InOrder order = inOrder(channel);
    order.verify(channel).exchangeDeclare("orders.dlx", BuiltinExchangeType.DIRECT, true, false, null);
    order.verify(channel).queueDeclare("orders.dlq", true, false, false, null);
    order.verify(channel).queueBind("orders.dlq", "orders.dlx", "order.failed");
    order.verify(channel).exchangeDeclare("orders", BuiltinExchangeType.DIRECT, true, false, null);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> args = ArgumentCaptor.forClass(Map.class);
    order.verify(channel).queueDeclare(eq("orders.created"), eq(true), eq(false), eq(false), args.capture());
    order.verify(channel).queueBind("orders.created", "orders", "order.created");

    assertThat(args.getValue())
        .containsEntry("x-message-ttl", 86_400_000)
        .containsEntry("x-max-priority", 10)
        .containsEntry("x-overflow", "drop-head")
        .containsEntry("x-dead-letter-exchange", "orders.dlx")
        .containsEntry("x-dead-letter-routing-key", "order.failed");
  }

  @Test
  void producerOnly_declaresExchangeButNoMainQueue() throws Exception {
    Channel channel = mock(Channel.class);

    new TopologyConfigurator(ORDERS.producerOnly()).declare(channel);

    verify(channel).exchangeDeclare("orders", BuiltinExchangeType.DIRECT, true, false, null);
    verify(channel).exchangeDeclare("orders.dlx", BuiltinExchangeType.DIRECT, true, false, null);
    verify(channel, never()).queueDeclare(eq("orders.created"), anyBoolean(), anyBoolean(), anyBoolean(), any());
    verify(channel, never()).queueBind(eq("orders.created"), anyString(), anyString());
  }

  @Test
  void noDeadLetterExchange_mainQueueCarriesNoDlxArguments() throws Exception {
    Channel channel = mock(Channel.class);
    Topology tasks = Topology.builder("tasks").exchangeType(BuiltinExchangeType.TOPIC)
        .queue("tasks.email").routingKey("tasks.email.*").build();

    new TopologyConfigurator(tasks).declare(channel);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> args = ArgumentCaptor.forClass(Map.class);
    verify(channel).queueDeclare(eq("tasks.email"), eq(true), eq(false), eq(false), args.capture());
    assertThat(args.getValue()).doesNotContainKeys("x-dead-letter-exchange", "x-dead-letter-routing-key");
    verify(channel).exchangeDeclare("tasks", BuiltinExchangeType.TOPIC, true, false, null);
    verify(channel, times(1)).exchangeDeclare(anyString(), any(BuiltinExchangeType.class), anyBoolean(), anyBoolean(), any());
  }

  @Test
  void failedDeclaration_abortsTheRest() throws Exception {
    Channel channel = mock(Channel.class);
    when(channel.exchangeDeclare("orders", BuiltinExchangeType.DIRECT, true, false, null))
        .thenThrow(new IOException("PRECONDITION_FAILED"));

    assertThatThrownBy(() -> new TopologyConfigurator(ORDERS).declare(channel))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("PRECONDITION_FAILED");
    verify(channel, never()).queueDeclare(eq("orders.created"), anyBoolean(), anyBoolean(), anyBoolean(), any());
  }

  @Test
  void topology_requiresExchange_andNormalisesNulls() {
    assertThatThrownBy(() -> Topology.builder(" ").build()).isInstanceOf(IllegalArgumentException.class);
    Topology t = new Topology("events", null, null, null, null, null, null);
    assertThat(t.exchangeType()).isEqualTo(BuiltinExchangeType.DIRECT);
    assertThat(t.hasQueue()).isFalse();
    assertThat(t.hasDeadLetterExchange()).isFalse();
  }
}
