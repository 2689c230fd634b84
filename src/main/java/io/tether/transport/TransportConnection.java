package io.tether.transport;

import java.io.IOException;

/**
 * A physical connection to a broker.
 * 
 * @author Tether Authors
 */
public interface TransportConnection {
  /**
   * Opens a channel with a number assigned by the connection.
   * 
   * @throws io.tether.BrokerException if the broker refuses the channel
   */
  TransportChannel createChannel() throws IOException;

  /**
   * Returns the endpoint address, e.g. {@code amqp://host:5672/vhost}.
   */
  String getAddress();

  boolean isOpen();

  /**
   * Adds a listener that is called once when the connection closes for any reason.
   */
  void addShutdownListener(TransportShutdownListener listener);

  /**
   * Closes the connection, completing shutdown listeners with an application initiated failure.
   */
  void close() throws IOException;
}
