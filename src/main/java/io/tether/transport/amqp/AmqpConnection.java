package io.tether.transport.amqp;

import java.io.IOException;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

import io.tether.internal.util.Exceptions;
import io.tether.transport.TransportChannel;
import io.tether.transport.TransportConnection;
import io.tether.transport.TransportShutdownListener;

/**
 * A {@link TransportConnection} backed by a RabbitMQ client connection.
 * 
 * @author Tether Authors
 */
class AmqpConnection implements TransportConnection {
  private final Connection connection;
  private final String address;

  AmqpConnection(Connection connection, ConnectionFactory factory) {
    this.connection = connection;
    address = String.format("%s://%s:%s/%s", factory.isSSL() ? "amqps" : "amqp",
        connection.getAddress().getHostAddress(), connection.getPort(),
        "/".equals(factory.getVirtualHost()) ? "" : factory.getVirtualHost());
  }

  @Override
  public TransportChannel createChannel() throws IOException {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (ShutdownSignalException e) {
      throw Exceptions.toBrokerException(e, -1);
    }
    if (channel == null)
      throw new IOException("No channel number is available on " + address);
    return new AmqpChannel(channel);
  }

  @Override
  public String getAddress() {
    return address;
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void addShutdownListener(final TransportShutdownListener listener) {
    connection.addShutdownListener(new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException cause) {
        listener.shutdownCompleted(Exceptions.toBrokerException(cause, -1));
      }
    });
  }

  @Override
  public void close() throws IOException {
    if (connection.isOpen())
      connection.close();
  }

  @Override
  public String toString() {
    return address;
  }
}
