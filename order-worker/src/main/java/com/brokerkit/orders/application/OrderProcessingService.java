package com.brokerkit.orders.application;

import com.brokerkit.orders.domain.OrderCreated;
import com.brokerkit.orders.domain.OrderState;
import com.brokerkit.orders.domain.OrderStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks orders from acceptance to processing. Processing is idempotent per order id: a redelivered
 * {@code order.created} for an order that already went through is reported as a duplicate.
 */
@Service
public class OrderProcessingService {
  private final Map<String, OrderState> orders = new ConcurrentHashMap<>();

  /** Records a freshly published order; never downgrades one the consumer already touched. */
  public void accepted(String orderId) {
    orders.putIfAbsent(orderId, new OrderState(orderId, OrderStatus.ACCEPTED, 0, Instant.now()));
  }

  /**
   * @return true if the order was processed now, false if it had been processed before
   * @throws TransientProcessingException while the order's simulated failures are not used up
   */
  public synchronized boolean process(OrderCreated order) {
    String id = order.orderId();
    OrderState current = orders.get(id);
    if (current != null && current.status() == OrderStatus.PROCESSED) {
      return false;
    }
    int attempt = current == null ? 1 : current.attempts() + 1;
    if (attempt <= order.simulateFailures()) {
      orders.put(id, new OrderState(id, OrderStatus.RETRYING, attempt, Instant.now()));
      throw new TransientProcessingException(
          "simulated failure " + attempt + "/" + order.simulateFailures() + " for order " + id);
    }
    orders.put(id, new OrderState(id, OrderStatus.PROCESSED, attempt, Instant.now()));
    return true;
  }

  public Optional<OrderState> find(String orderId) {
    return Optional.ofNullable(orders.get(orderId));
  }
}
