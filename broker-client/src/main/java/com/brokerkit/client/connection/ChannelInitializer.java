package com.brokerkit.client.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * Per-channel setup run on every freshly opened channel, before topology is declared.
 */
@FunctionalInterface
public interface ChannelInitializer {
  ChannelInitializer NONE = channel -> {};

  void initialize(Channel channel) throws IOException;
}
