package io.tether.internal;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tether.BrokerException;
import io.tether.ConnectionFailureException;
import io.tether.ConnectionFailureException.Phase;
import io.tether.ConnectionOptions;
import io.tether.ConnectionState;
import io.tether.config.Config;
import io.tether.config.RecoveryPolicy;
import io.tether.internal.SupervisorEvent.Type;
import io.tether.internal.util.Exceptions;
import io.tether.internal.util.concurrent.ReentrantCircuit;
import io.tether.transport.Transport;
import io.tether.transport.TransportConnection;
import io.tether.transport.TransportShutdownListener;

/**
 * Owns the physical connection. Detects its unexpected loss and re-establishes it under the
 * configured {@link RecoveryPolicy}, publishing each step as a {@link SupervisorEvent}.
 *
 * <p>
 * The initial connect is never retried. Reconnect attempts are made at a fixed interval, waiting
 * before every attempt including the first, until one succeeds, the policy is exceeded or the
 * supervisor is closed. Closing the supervisor ends any wait immediately.
 * 
 * @author Tether Authors
 */
public class ConnectionSupervisor {
  private final Logger log = LoggerFactory.getLogger(getClass());
  private final Transport transport;
  private final ConnectionOptions options;
  private final Config config;
  private final String name;
  private final Executor executor;
  private final List<SupervisorListener> listeners = new CopyOnWriteArrayList<SupervisorListener>();
  /** Open until the supervisor is closed. */
  private final ReentrantCircuit closeSignal = new ReentrantCircuit();
  private final AtomicBoolean reconnecting = new AtomicBoolean();
  private volatile TransportConnection connection;
  private volatile ConnectionState state;
  private volatile boolean closed;

  /**
   * Handles connection shutdowns.
   */
  private class ConnectionShutdownListener implements TransportShutdownListener {
    private final TransportConnection source;

    ConnectionShutdownListener(TransportConnection source) {
      this.source = source;
    }

    @Override
    public void shutdownCompleted(BrokerException cause) {
      if (closed || source != connection || cause.isInitiatedByApplication())
        return;
      connectionLost(cause.onConnection(name));
    }
  }

  public ConnectionSupervisor(Transport transport, ConnectionOptions options, Config config,
      String name, Executor executor) {
    this.transport = transport;
    this.options = options;
    this.config = config;
    this.name = name;
    this.executor = executor;
    closeSignal.open();
  }

  public void addListener(SupervisorListener listener) {
    listeners.add(listener);
  }

  /**
   * Closes the current connection and stops any reconnect in progress. No further events are
   * published.
   */
  public void close() throws IOException {
    TransportConnection current;
    synchronized (this) {
      if (closed)
        return;
      closed = true;
      state = ConnectionState.CLOSED;
      current = connection;
    }
    closeSignal.close();
    if (current != null && current.isOpen())
      current.close();
  }

  /**
   * Opens the initial connection.
   *
   * @throws ConnectionFailureException if the connection cannot be opened
   */
  public TransportConnection connect() throws ConnectionFailureException {
    TransportConnection newConnection;
    try {
      newConnection = transport.newConnection(options, name);
    } catch (IOException e) {
      state = ConnectionState.FAILED;
      throw new ConnectionFailureException(Phase.INITIAL_CONNECT,
          Exceptions.connectFailureReason(e), options.getAddress(), e);
    }

    install(newConnection);
    log.info("Created connection {} to {}", name, newConnection.getAddress());
    publish(SupervisorEvent.connected(newConnection, 0, false));
    return newConnection;
  }

  /**
   * Returns the current physical connection, which may be closed while reconnecting.
   */
  public TransportConnection getConnection() {
    return connection;
  }

  public ConnectionState getState() {
    return state;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Called once the channels of a reconnected connection have been recovered.
   */
  public void recovered() {
    if (!closed)
      publish(SupervisorEvent.of(Type.RECOVERED, 0, null));
  }

  @Override
  public String toString() {
    return name;
  }

  void connectionLost(BrokerException cause) {
    if (closed || !reconnecting.compareAndSet(false, true))
      return;

    log.error("Connection {} was closed unexpectedly: {}", name, cause.getMessage());
    boolean recover = config.isAutomaticRecoveryEnabled();
    state = recover ? ConnectionState.RECOVERING : ConnectionState.FAILED;
    publish(SupervisorEvent.of(Type.LOST, 0, cause));
    if (!recover || closed)
      return;

    executor.execute(new Runnable() {
      @Override
      public void run() {
        reconnect();
      }
    });
  }

  /**
   * Attempts to re-establish the connection until an attempt succeeds, the recovery policy is
   * exceeded, or the supervisor is closed.
   */
  private void reconnect() {
    RecoveryStats stats = new RecoveryStats(config.getRecoveryPolicy());
    publish(SupervisorEvent.of(Type.RECONNECTING, 0, null));

    try {
      while (true) {
        if (closeSignal.await(stats.getWaitTime()) || closed)
          return;

        int attempt = stats.incrementAttempts();
        log.info("Recovering connection {} to {}, attempt {}", name, options.getAddress(),
            attempt);
        try {
          TransportConnection newConnection = transport.newConnection(options, name);
          if (!installRecovered(newConnection)) {
            discard(newConnection);
            return;
          }

          log.info("Recovered connection {} to {} after {} attempts", name,
              newConnection.getAddress(), attempt);
          publish(SupervisorEvent.connected(newConnection, attempt, true));
          return;
        } catch (IOException e) {
          log.warn("Failed to recover connection {} on attempt {}: {}", name, attempt,
              e.getMessage());
          publish(SupervisorEvent.of(Type.RECONNECT_FAILED, attempt, e));
          if (stats.isPolicyExceeded()) {
            abandon(new ConnectionFailureException(Phase.TRANSPORT_LOSS,
                Exceptions.connectFailureReason(e), options.getAddress(), e), attempt);
            return;
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (!closed)
        abandon(new ConnectionFailureException(Phase.TRANSPORT_LOSS,
            ConnectionFailureException.Reason.IO, options.getAddress(), e),
            stats.getAttemptCount());
    }
  }

  private void abandon(ConnectionFailureException failure, int attempts) {
    state = ConnectionState.FAILED;
    log.error("Abandoned recovery of connection {} after {} attempts", name, attempts, failure);
    publish(SupervisorEvent.of(Type.ABANDONED, attempts, failure));
  }

  /**
   * Installs the reconnected {@code newConnection} unless the supervisor was closed.
   */
  private synchronized boolean installRecovered(TransportConnection newConnection) {
    if (closed)
      return false;
    reconnecting.set(false);
    install(newConnection);
    return true;
  }

  private void discard(TransportConnection newConnection) {
    try {
      newConnection.close();
    } catch (IOException e) {
      log.debug("Failed to close connection {} after the supervisor was closed", name, e);
    }
  }

  private void install(TransportConnection newConnection) {
    connection = newConnection;
    state = ConnectionState.CONNECTED;
    newConnection.addShutdownListener(new ConnectionShutdownListener(newConnection));
  }

  private void publish(SupervisorEvent event) {
    if (closed)
      return;
    for (SupervisorListener listener : listeners)
      try {
        listener.onEvent(event);
      } catch (Exception e) {
        log.warn("Supervisor listener {} failed on {}", listener, event, e);
      }
  }
}
