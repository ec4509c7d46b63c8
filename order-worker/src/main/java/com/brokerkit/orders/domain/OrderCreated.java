package com.brokerkit.orders.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of an {@code order.created} message.
 *
 * @param simulateFailures how many processing attempts fail before the order goes through; drives the
 *                         retry path in demos and end-to-end checks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderCreated(
    @JsonAlias("order_id") String orderId,
    String customerId,
    long amountCents,
    int simulateFailures) {
}
