package io.tether.event;

import io.tether.BrokerException;
import io.tether.RecoverableChannel;

/**
 * Listens for {@link RecoverableChannel} related events.
 * 
 * @author Tether Authors
 */
public interface ChannelListener {
  /**
   * Called when the {@code channel} is successfully created.
   */
  void onCreate(RecoverableChannel channel);

  /**
   * Called when channel creation fails.
   */
  void onCreateFailure(Throwable failure);

  /**
   * Called when the broker closes the {@code channel} with a channel-level error outside of
   * recovery. The channel is discarded; the connection and its other channels are unaffected.
   */
  void onChannelException(RecoverableChannel channel, BrokerException failure);

  /**
   * Called when recovery of the {@code channel} is started.
   */
  void onRecoveryStarted(RecoverableChannel channel);

  /**
   * Called when the {@code channel} is re-opened but before its exchanges, queues, bindings and
   * consumers are replayed.
   */
  void onRecovery(RecoverableChannel channel);

  /**
   * Called when recovery of the {@code channel} and its topology is completed. The success or
   * failure of an individual consumer's recovery can be tracked with a {@link ConsumerListener}.
   */
  void onRecoveryCompleted(RecoverableChannel channel);

  /**
   * Called when the {@code channel} fails to recover. The channel is discarded.
   */
  void onRecoveryFailure(RecoverableChannel channel, Throwable failure);
}
