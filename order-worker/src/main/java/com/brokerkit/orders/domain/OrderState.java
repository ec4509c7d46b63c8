package com.brokerkit.orders.domain;

import java.time.Instant;

public record OrderState(String orderId, OrderStatus status, int attempts, Instant updatedAt) {
}
