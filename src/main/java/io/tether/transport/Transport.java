package io.tether.transport;

import java.io.IOException;

import io.tether.ConnectionOptions;

/**
 * Opens physical connections to a broker. Framing, TLS and authentication live behind this
 * interface; the recovery engine only calls through it.
 * 
 * @author Tether Authors
 */
public interface Transport {
  /**
   * Opens a new connection to the endpoint described by the {@code options}.
   * 
   * @throws io.tether.ConnectionFailureException if the endpoint is unreachable, unresolvable or
   *           rejects the credentials
   * @throws IOException on any other failure
   */
  TransportConnection newConnection(ConnectionOptions options, String connectionName)
      throws IOException;
}
