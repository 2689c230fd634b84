package io.tether.event;

import io.tether.RecoverableConnection;

/**
 * Listens for {@link RecoverableConnection} related events.
 * 
 * @author Tether Authors
 */
public interface ConnectionListener {
  /**
   * Called when the {@code connection} is successfully created.
   */
  void onCreate(RecoverableConnection connection);

  /**
   * Called when connection creation fails.
   */
  void onCreateFailure(Throwable failure);

  /**
   * Called when the {@code connection} is closed unexpectedly. If automatic recovery is disabled
   * the loss is terminal and no further events follow.
   */
  void onConnectionLost(RecoverableConnection connection, Throwable cause);

  /**
   * Called when recovery of the {@code connection} is started.
   */
  void onRecoveryStarted(RecoverableConnection connection);

  /**
   * Called when the {@code connection} is successfully re-established, but before its channels
   * and their exchanges, queues, bindings and consumers are recovered.
   */
  void onRecovery(RecoverableConnection connection);

  /**
   * Called when recovery of the {@code connection} and its channels is completed. The
   * connection's {@link RecoverableConnection#getRecoveryState() recovery state} tells whether
   * every channel recovered. The outcome of an individual channel's recovery can be tracked with
   * a {@link ChannelListener}.
   */
  void onRecoveryCompleted(RecoverableConnection connection);

  /**
   * Called when the {@code connection} could not be re-established and recovery was abandoned.
   */
  void onRecoveryFailure(RecoverableConnection connection, Throwable failure);
}
