package com.brokerkit.orders.api.dto;

public record OrderAcceptedResponse(String orderId, String status) {
}
