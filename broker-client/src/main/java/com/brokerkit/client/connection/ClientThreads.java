package com.brokerkit.client.connection;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named after the client that owns them, so thread dumps show which client is stuck.
 */
public final class ClientThreads {
  private ClientThreads() {}

  public static ThreadFactory named(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "brokerkit-" + prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
