package com.brokerkit.client.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed policy attached to the main queue at declare time. The dead-letter queue gets none of it.
 */
public final class QueueArguments {
  public static final int MESSAGE_TTL_MILLIS = 24 * 60 * 60 * 1000;
  public static final int MAX_PRIORITY = 10;
  public static final String OVERFLOW_DROP_HEAD = "drop-head";

  private QueueArguments() {}

  public static Map<String, Object> mainQueue(Topology topology) {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put("x-message-ttl", MESSAGE_TTL_MILLIS);
    args.put("x-max-priority", MAX_PRIORITY);
    args.put("x-overflow", OVERFLOW_DROP_HEAD);
    if (topology.hasDeadLetterExchange()) {
      args.put("x-dead-letter-exchange", topology.deadLetterExchangeName());
      args.put("x-dead-letter-routing-key", topology.deadLetterRoutingKey());
    }
    return Collections.unmodifiableMap(args);
  }
}
