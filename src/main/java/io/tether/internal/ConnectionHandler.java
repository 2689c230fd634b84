package io.tether.internal;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tether.ConnectionOptions;
import io.tether.ConnectionState;
import io.tether.RecoverableChannel;
import io.tether.RecoverableConnection;
import io.tether.RecoveryState;
import io.tether.config.Config;
import io.tether.event.ChannelListener;
import io.tether.event.ConnectionListener;
import io.tether.internal.util.Assert;
import io.tether.internal.util.concurrent.NamedThreadFactory;
import io.tether.internal.util.concurrent.ReentrantCircuit;
import io.tether.transport.Transport;
import io.tether.transport.TransportChannel;
import io.tether.transport.TransportConnection;

/**
 * Handles connection operations and ties together the supervision and recovery of a connection
 * and its channels.
 * 
 * @author Tether Authors
 */
public class ConnectionHandler implements RecoverableConnection {
  private static final AtomicInteger CONNECTION_COUNTER = new AtomicInteger();
  static final ExecutorService RECOVERY_EXECUTORS = Executors.newCachedThreadPool(
      new NamedThreadFactory("tether-recovery-%s"));

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final ConnectionOptions options;
  private final Config config;
  private final String connectionName;
  private final ConnectionSupervisor supervisor;
  private final RecoveryCoordinator coordinator;
  /** Channels in creation order. */
  private final List<ChannelHandler> channels = new CopyOnWriteArrayList<ChannelHandler>();
  /** Open while the connection is recovering. */
  private final ReentrantCircuit circuit = new ReentrantCircuit();
  private volatile boolean closed;

  public ConnectionHandler(ConnectionOptions options, Config config, Transport transport) {
    this.options = Assert.notNull(options, "options");
    this.config = Assert.notNull(config, "config");
    Assert.notNull(transport, "transport");
    connectionName = options.getName() == null ? String.format("cxn-%s",
        CONNECTION_COUNTER.incrementAndGet()) : options.getName();
    supervisor = new ConnectionSupervisor(transport, options, config, connectionName,
        RECOVERY_EXECUTORS);
    coordinator = new RecoveryCoordinator(this, supervisor, new ChannelRecoveryExecutor(
        new RenamePropagator()), RECOVERY_EXECUTORS, config);
    supervisor.addListener(coordinator);
  }

  /**
   * Opens the initial connection. The initial connection is never retried.
   *
   * @throws IOException if the connection cannot be opened
   */
  public void createConnection() throws IOException {
    try {
      supervisor.connect();
    } catch (IOException e) {
      log.error("Failed to create connection {}", connectionName, e);
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onCreateFailure(e);
        } catch (Exception le) {
          log.warn("Connection listener {} failed", listener, le);
        }
      throw e;
    }

    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onCreate(this);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }

  /**
   * Returns the supervisor that owns the physical connection.
   */
  public ConnectionSupervisor getSupervisor() {
    return supervisor;
  }

  @Override
  public RecoverableChannel createChannel() throws IOException {
    try {
      circuit.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for " + this + " to recover");
    }
    Assert.state(isOpen(), "Connection %s is %s", connectionName, getState());

    try {
      TransportChannel channel = supervisor.getConnection().createChannel();
      ChannelHandler channelHandler = new ChannelHandler(this, channel, config);
      channels.add(channelHandler);
      log.info("Created {}", channelHandler);
      channelHandler.notifyCreate();
      return channelHandler;
    } catch (IOException e) {
      log.error("Failed to create channel on {}", connectionName, e);
      for (ChannelListener listener : config.getChannelListeners())
        try {
          listener.onCreateFailure(e);
        } catch (Exception le) {
          log.warn("Channel listener {} failed", listener, le);
        }
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    if (closed)
      return;
    closed = true;
    coordinator.closed();
    for (ChannelHandler channel : channels)
      channel.connectionClosed();
    circuit.close();
    supervisor.close();
    log.info("Closed connection {}", connectionName);
  }

  @Override
  public String getAddress() {
    TransportConnection connection = supervisor.getConnection();
    return connection == null ? options.getAddress() : connection.getAddress();
  }

  @Override
  public List<RecoverableChannel> getChannels() {
    return new ArrayList<RecoverableChannel>(channels);
  }

  @Override
  public String getName() {
    return connectionName;
  }

  @Override
  public RecoveryState getRecoveryState() {
    return coordinator.getState();
  }

  @Override
  public ConnectionState getState() {
    return closed ? ConnectionState.CLOSED : supervisor.getState();
  }

  @Override
  public boolean isOpen() {
    ConnectionState state = getState();
    return state == ConnectionState.CONNECTED || state == ConnectionState.RECOVERING;
  }

  @Override
  public String toString() {
    return connectionName;
  }

  /**
   * Returns whether operations that fail due to a connection closure can wait for recovery.
   */
  boolean canRecover() {
    return !closed && config.isAutomaticRecoveryEnabled()
        && !coordinator.getState().isTerminal();
  }

  /**
   * Warns when the {@code channel} references a server-named queue that another channel
   * declared. Such references are not renamed when the queue is recovered.
   */
  void checkQueueLocality(ChannelHandler channel, String queueName) {
    for (ChannelHandler other : channels)
      if (other != channel) {
        QueueRecord queue = other.registry.getQueue(queueName);
        if (queue != null && queue.isServerNamed())
          log.warn(
              "Server-named queue {} was declared on {} but is used from {}. The reference will not follow the queue's new name after recovery",
              queueName, other, channel);
      }
  }

  List<ChannelHandler> getChannelHandlers() {
    return new ArrayList<ChannelHandler>(channels);
  }

  void removeChannel(ChannelHandler channel) {
    channels.remove(channel);
  }

  void connectionLost() {
    circuit.open();
    for (ChannelHandler channel : channels)
      channel.connectionLost();
  }

  /**
   * Closes every channel once the connection can no longer be recovered.
   */
  void connectionAbandoned() {
    for (ChannelHandler channel : channels)
      channel.connectionClosed();
    circuit.close();
  }

  void recoveryCompleted() {
    circuit.close();
  }

  void notifyConnectionLost(Throwable cause) {
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onConnectionLost(this, cause);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }

  void notifyRecoveryStarted() {
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryStarted(this);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }

  void notifyRecovery() {
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecovery(this);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }

  void notifyRecoveryCompleted() {
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryCompleted(this);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }

  void notifyRecoveryFailure(Throwable failure) {
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryFailure(this, failure);
      } catch (Exception e) {
        log.warn("Connection listener {} failed", listener, e);
      }
  }
}
