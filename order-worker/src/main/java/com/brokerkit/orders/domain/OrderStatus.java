package com.brokerkit.orders.domain;

public enum OrderStatus { ACCEPTED, RETRYING, PROCESSED }
