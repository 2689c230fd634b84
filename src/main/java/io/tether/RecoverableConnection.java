package io.tether;

import java.io.IOException;
import java.util.List;

/**
 * A connection that is transparently re-established after transport failures, along with its
 * channels and their recorded topology.
 * 
 * @author Tether Authors
 */
public interface RecoverableConnection {
  /**
   * Creates a new channel. Every exchange, queue, binding and consumer declared through the
   * channel belongs to it and is replayed on it during recovery.
   * 
   * @throws IllegalStateException if the connection is closed or lost
   * @throws IOException if the channel could not be opened
   */
  RecoverableChannel createChannel() throws IOException;

  /**
   * Closes the connection and its channels, abandoning any recovery in progress.
   */
  void close() throws IOException;

  /**
   * Returns the endpoint address.
   */
  String getAddress();

  /**
   * Returns the channels that are currently open or recovering.
   */
  List<RecoverableChannel> getChannels();

  String getName();

  RecoveryState getRecoveryState();

  ConnectionState getState();

  /**
   * Returns whether the connection is connected or recovering.
   */
  boolean isOpen();
}
