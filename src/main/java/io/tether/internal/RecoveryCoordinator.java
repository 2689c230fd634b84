package io.tether.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tether.BrokerException;
import io.tether.ChannelRecoveryException;
import io.tether.RecoveryState;
import io.tether.config.Config;
import io.tether.transport.TransportConnection;

/**
 * Sequences a recovery: on each reconnect it replays every channel of the connection
 * concurrently, and settles the connection as {@link RecoveryState#STABLE} once every channel has
 * recovered, or {@link RecoveryState#DEGRADED} if any channel failed. Channel failures are
 * isolated; a channel that fails is marked failed while the others continue.
 *
 * <p>
 * A connection loss during a replay starts a new recovery generation. The outcome of a replay
 * that was overtaken by a newer generation is discarded, and its channels are recovered again on
 * the next connection.
 * 
 * @author Tether Authors
 */
class RecoveryCoordinator implements SupervisorListener {
  private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

  private final ConnectionHandler connectionHandler;
  private final ConnectionSupervisor supervisor;
  private final ChannelRecoveryExecutor channelRecoveryExecutor;
  private final ExecutorService executor;
  private final Config config;
  private final AtomicInteger generation = new AtomicInteger();
  private volatile RecoveryState state = RecoveryState.IDLE;

  RecoveryCoordinator(ConnectionHandler connectionHandler, ConnectionSupervisor supervisor,
      ChannelRecoveryExecutor channelRecoveryExecutor, ExecutorService executor, Config config) {
    this.connectionHandler = connectionHandler;
    this.supervisor = supervisor;
    this.channelRecoveryExecutor = channelRecoveryExecutor;
    this.executor = executor;
    this.config = config;
  }

  RecoveryState getState() {
    return state;
  }

  @Override
  public void onEvent(SupervisorEvent event) {
    switch (event.getType()) {
      case CONNECTED:
        if (event.isRecovery())
          recoverChannels(event.getConnection());
        break;
      case LOST:
        connectionLost(event.getFailure());
        break;
      case RECONNECTING:
        transition(RecoveryState.RECONNECTING);
        connectionHandler.notifyRecoveryStarted();
        break;
      case ABANDONED:
        recoveryAbandoned(event.getFailure());
        break;
      default:
        break;
    }
  }

  /**
   * Moves to {@link RecoveryState#CLOSED}, discarding any replay in progress.
   */
  synchronized void closed() {
    generation.incrementAndGet();
    state = RecoveryState.CLOSED;
  }

  private void connectionLost(Throwable cause) {
    generation.incrementAndGet();
    transition(RecoveryState.CONNECTION_LOST);
    connectionHandler.connectionLost();
    connectionHandler.notifyConnectionLost(cause);

    if (!config.isAutomaticRecoveryEnabled()) {
      transition(RecoveryState.LOST);
      connectionHandler.connectionAbandoned();
    }
  }

  private void recoveryAbandoned(Throwable failure) {
    transition(RecoveryState.LOST);
    connectionHandler.connectionAbandoned();
    connectionHandler.notifyRecoveryFailure(failure);
  }

  /**
   * Replays every channel on the reconnected {@code connection}, waiting for all of them.
   */
  private void recoverChannels(final TransportConnection connection) {
    int recoveryGeneration = generation.get();
    if (state == RecoveryState.CLOSED)
      return;
    final boolean replayTopology = config.isTopologyRecoveryEnabled();
    connectionHandler.notifyRecovery();
    if (replayTopology)
      transition(RecoveryState.CHANNELS_RECOVERING);

    List<ChannelHandler> channels = connectionHandler.getChannelHandlers();
    List<Future<RecoveredChannel>> futures = new ArrayList<Future<RecoveredChannel>>();
    for (final ChannelHandler channel : channels)
      futures.add(executor.submit(new Callable<RecoveredChannel>() {
        @Override
        public RecoveredChannel call() throws Exception {
          return channelRecoveryExecutor.recover(channel, connection, replayTopology);
        }
      }));

    boolean degraded = false;
    boolean overtaken = false;
    for (int i = 0; i < channels.size(); i++) {
      ChannelHandler channel = channels.get(i);
      try {
        RecoveredChannel recovered = futures.get(i).get();
        log.debug("Replayed {}", recovered);
        if (recoveryGeneration == generation.get())
          channel.recovered();
        else
          overtaken = true;
      } catch (ExecutionException e) {
        Throwable failure = e.getCause();
        if (isConnectionClosure(failure) || recoveryGeneration != generation.get()) {
          log.debug("Recovery of {} was interrupted by a connection closure", channel);
          overtaken = true;
        } else if (channel.isOpen()) {
          degraded = true;
          channel.recoveryFailed(failure);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        for (Future<RecoveredChannel> future : futures)
          future.cancel(true);
        return;
      }
    }

    if (overtaken || recoveryGeneration != generation.get())
      return;

    transition(degraded ? RecoveryState.DEGRADED : RecoveryState.STABLE);
    connectionHandler.recoveryCompleted();
    supervisor.recovered();
    if (degraded)
      log.warn("Recovered connection {} with failed channels", connectionHandler);
    else
      log.info("Recovered connection {}", connectionHandler);
    connectionHandler.notifyRecoveryCompleted();
  }

  private static boolean isConnectionClosure(Throwable failure) {
    if (!(failure instanceof ChannelRecoveryException))
      return false;
    BrokerException cause = ((ChannelRecoveryException) failure).getBrokerException();
    return cause != null && cause.isHard();
  }

  private synchronized void transition(RecoveryState newState) {
    if (state == RecoveryState.CLOSED || state == RecoveryState.LOST
        && newState != RecoveryState.CLOSED)
      return;
    log.debug("Connection {} moved from {} to {}", connectionHandler, state, newState);
    state = newState;
  }
}
