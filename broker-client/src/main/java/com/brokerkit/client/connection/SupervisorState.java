package com.brokerkit.client.connection;

public enum SupervisorState {
  CONNECTED,
  RECONNECTING,
  CLOSED
}
