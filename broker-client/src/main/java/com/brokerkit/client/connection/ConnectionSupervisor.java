package com.brokerkit.client.connection;

import com.brokerkit.client.BrokerSetupException;
import com.brokerkit.client.topology.TopologyConfigurator;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownNotifier;
import com.rabbitmq.client.ShutdownSignalException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns one connection + channel pair for a single client and keeps it alive.
 *
 * <p>Each pair is a generation. Both resources of a generation get a one-shot "closed" signal with
 * its own watcher task; the first signal of the current generation moves the supervisor from
 * CONNECTED to RECONNECTING, and later signals (the sibling resource, or an old generation) are
 * ignored. The reconnect loop dials, opens a channel, re-runs the channel initializer and the
 * topology declaration, and retries forever at a fixed delay until it succeeds or the supervisor is
 * closed. There is no backoff and no attempt limit: outages are assumed transient.
 *
 * <p>While the broker holds the current connection blocked (a memory or disk alarm) the reason is
 * exposed through {@link #blockedReason()} so publishers can fail instead of stalling the caller.
 *
 * <p>Meters are tagged with the connection name and the client's role; two clients sharing a
 * registry need distinct names per role or they report through the same meters.
 *
 * <p>The connection and channel references are guarded by one read/write lock. Publishers and
 * health checks take the read lock; state transitions and the pointer swap take the write lock.
 * The same lock is lent to the consumer for its consuming flag.
 */
public class ConnectionSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

  private final String name;
  private final String role;
  private final ConnectionFactory connectionFactory;
  private final TopologyConfigurator topology;
  private final ChannelInitializer channelInitializer;
  private final Duration reconnectDelay;
  private final ExecutorService watchers;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final CountDownLatch closed = new CountDownLatch(1);
  private final List<Runnable> reconnectListeners = new CopyOnWriteArrayList<>();
  private final Counter reconnects;

  // guarded by lock
  private Connection connection;
  private Channel channel;
  private long generation;
  private String blockedReason;
  private volatile SupervisorState state = SupervisorState.RECONNECTING;

  private ConnectionSupervisor(String name, String role, ConnectionFactory connectionFactory, Duration reconnectDelay,
                               TopologyConfigurator topology, ChannelInitializer channelInitializer,
                               MeterRegistry registry) {
    this.name = name;
    this.role = role;
    this.connectionFactory = connectionFactory;
    this.reconnectDelay = reconnectDelay;
    this.topology = topology;
    this.channelInitializer = channelInitializer == null ? ChannelInitializer.NONE : channelInitializer;
    this.watchers = Executors.newCachedThreadPool(ClientThreads.named(name + "-supervisor"));
    this.reconnects = Counter.builder("broker_reconnects_total").tag("client", name).tag("role", role).register(registry);
    Gauge.builder("broker_connected", this, s -> s.isConnected() ? 1 : 0)
        .tag("client", name).tag("role", role).register(registry);
  }

  /**
   * Connects, prepares the channel and declares topology before returning.
   *
   * @throws BrokerSetupException if any of it fails; the supervisor is not usable then
   */
  public static ConnectionSupervisor open(String name, String role, ConnectionFactory connectionFactory,
                                          Duration reconnectDelay, TopologyConfigurator topology,
                                          ChannelInitializer channelInitializer, MeterRegistry registry) {
    ConnectionSupervisor supervisor = new ConnectionSupervisor(
        name, role, connectionFactory, reconnectDelay, topology, channelInitializer, registry);
    Session session;
    try {
      session = supervisor.establish();
    } catch (IOException | TimeoutException | RuntimeException e) {
      supervisor.state = SupervisorState.CLOSED;
      supervisor.closed.countDown();
      supervisor.watchers.shutdownNow();
      throw new BrokerSetupException("failed to set up RabbitMQ session for " + name, e);
    }
    supervisor.install(session);
    log.info("Connected {} to RabbitMQ (exchange={})", name, topology.topology().exchangeName());
    return supervisor;
  }

  public String name() { return name; }

  public SupervisorState state() { return state; }

  /** Why the broker is blocking the current connection, or empty when it is not. */
  public Optional<String> blockedReason() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(blockedReason);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isConnected() {
    lock.readLock().lock();
    try {
      return healthy();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** The current channel if both it and its connection are open. */
  public Optional<Channel> healthyChannel() {
    lock.readLock().lock();
    try {
      return healthy() ? Optional.of(channel) : Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  public Lock readLock() { return lock.readLock(); }

  public Lock writeLock() { return lock.writeLock(); }

  /** Runs on the reconnect thread after a new generation is installed. */
  public void addReconnectListener(Runnable listener) {
    reconnectListeners.add(listener);
  }

  /**
   * Closes channel then connection; the first failure is rethrown after both were attempted.
   * Idempotent. A reconnect loop in progress stops without installing anything.
   */
  @Override
  public void close() throws IOException {
    Connection conn;
    Channel ch;
    lock.writeLock().lock();
    try {
      if (state == SupervisorState.CLOSED) return;
      state = SupervisorState.CLOSED;
      conn = connection;
      ch = channel;
      connection = null;
      channel = null;
    } finally {
      lock.writeLock().unlock();
    }
    closed.countDown();
    try {
      IOException failure = null;
      if (ch != null && ch.isOpen()) {
        try {
          ch.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
          failure = asIOException("failed to close channel", e);
        }
      }
      if (conn != null && conn.isOpen()) {
        try {
          conn.close();
        } catch (IOException | ShutdownSignalException e) {
          if (failure == null) failure = asIOException("failed to close connection", e);
          else failure.addSuppressed(e);
        }
      }
      if (failure != null) throw failure;
      log.info("Closed RabbitMQ session for {}", name);
    } finally {
      watchers.shutdownNow();
    }
  }

  private boolean healthy() {
    return connection != null && connection.isOpen() && channel != null && channel.isOpen();
  }

  private Session establish() throws IOException, TimeoutException {
    Connection conn = connectionFactory.newConnection(name);
    try {
      Channel ch = conn.createChannel();
      if (ch == null) throw new IOException("no channel available on connection");
      try {
        channelInitializer.initialize(ch);
        topology.declare(ch);
      } catch (IOException | RuntimeException e) {
        closeQuietly(ch);
        throw e;
      }
      return new Session(conn, ch);
    } catch (IOException | RuntimeException e) {
      closeQuietly(conn);
      throw e;
    }
  }

  /** Swaps in a new generation; returns false (and closes the session) if the supervisor was closed meanwhile. */
  private boolean install(Session session) {
    long gen;
    lock.writeLock().lock();
    try {
      if (state == SupervisorState.CLOSED) {
        gen = -1;
      } else {
        connection = session.connection();
        channel = session.channel();
        blockedReason = null;
        gen = ++generation;
        state = SupervisorState.CONNECTED;
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (gen < 0) {
      closeQuietly(session.channel());
      closeQuietly(session.connection());
      return false;
    }
    watchBlocked(gen, session.connection());
    watch(gen, session.connection(), "connection");
    watch(gen, session.channel(), "channel");
    return true;
  }

  private void watchBlocked(long gen, Connection conn) {
    conn.addBlockedListener(new BlockedListener() {
      @Override
      public void handleBlocked(String reason) {
        onBlocked(gen, reason == null || reason.isBlank() ? "unspecified" : reason);
      }

      @Override
      public void handleUnblocked() {
        onBlocked(gen, null);
      }
    });
  }

  private void onBlocked(long gen, String reason) {
    lock.writeLock().lock();
    try {
      if (gen != generation || state != SupervisorState.CONNECTED) return;
      blockedReason = reason;
    } finally {
      lock.writeLock().unlock();
    }
    if (reason != null) log.warn("RabbitMQ blocked connection {}: {}", name, reason);
    else log.info("RabbitMQ unblocked connection {}", name);
  }

  private void watch(long gen, ShutdownNotifier resource, String kind) {
    closedSignal(resource).thenAcceptAsync(cause -> onClosed(gen, kind, cause), watchers);
  }

  static CompletableFuture<ShutdownSignalException> closedSignal(ShutdownNotifier resource) {
    CompletableFuture<ShutdownSignalException> signal = new CompletableFuture<>();
    resource.addShutdownListener(signal::complete);
    return signal;
  }

  private void onClosed(long gen, String kind, ShutdownSignalException cause) {
    Connection oldConn;
    Channel oldCh;
    lock.writeLock().lock();
    try {
      if (state != SupervisorState.CONNECTED || gen != generation) {
        log.debug("Ignoring {} close for {} (generation {}, state {})", kind, name, gen, state);
        return;
      }
      state = SupervisorState.RECONNECTING;
      oldConn = connection;
      oldCh = channel;
      connection = null;
      channel = null;
      blockedReason = null;
    } finally {
      lock.writeLock().unlock();
    }
    log.warn("RabbitMQ {} lost for {}: {}, attempting to reconnect...", kind, name, cause == null ? "unknown" : cause.getMessage());
    closeQuietly(oldCh);
    closeQuietly(oldConn);
    reconnectLoop();
  }

  private void reconnectLoop() {
    while (state == SupervisorState.RECONNECTING) {
      if (awaitClosed(reconnectDelay)) return;
      log.info("Attempting to reconnect {} to RabbitMQ...", name);
      Session session;
      try {
        session = establish();
      } catch (IOException | TimeoutException | RuntimeException e) {
        log.warn("Failed to reconnect {}: {}, retrying in {} ms", name, e.toString(), reconnectDelay.toMillis());
        continue;
      }
      if (!install(session)) return;
      reconnects.increment();
      log.info("Successfully reconnected {} to RabbitMQ", name);
      for (Runnable listener : reconnectListeners) {
        try {
          listener.run();
        } catch (RuntimeException e) {
          log.error("Reconnect listener failed for {}", name, e);
        }
      }
      return;
    }
  }

  private boolean awaitClosed(Duration delay) {
    try {
      return closed.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  static void closeQuietly(Channel ch) {
    if (ch == null || !ch.isOpen()) return;
    try {
      ch.close();
    } catch (IOException | TimeoutException | RuntimeException e) {
      log.debug("Ignoring error while closing channel: {}", e.toString());
    }
  }

  static void closeQuietly(Connection conn) {
    if (conn == null || !conn.isOpen()) return;
    try {
      conn.close();
    } catch (IOException | RuntimeException e) {
      log.debug("Ignoring error while closing connection: {}", e.toString());
    }
  }

  private static IOException asIOException(String message, Exception e) {
    return e instanceof IOException io ? io : new IOException(message, e);
  }

  private record Session(Connection connection, Channel channel) {}
}
