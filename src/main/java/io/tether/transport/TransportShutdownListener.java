package io.tether.transport;

import io.tether.BrokerException;

/**
 * Listens for the closure of a {@link TransportConnection} or {@link TransportChannel}.
 * 
 * @author Tether Authors
 */
public interface TransportShutdownListener {
  /**
   * Called when the connection or channel has closed because of the {@code cause}.
   */
  void shutdownCompleted(BrokerException cause);
}
