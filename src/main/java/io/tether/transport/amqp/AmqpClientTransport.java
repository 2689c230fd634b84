package io.tether.transport.amqp;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import io.tether.ConnectionOptions;
import io.tether.transport.Transport;
import io.tether.transport.TransportConnection;

/**
 * Opens connections with the RabbitMQ Java client. The client's own automatic recovery is always
 * disabled on the connections it opens.
 * 
 * @author Tether Authors
 */
public class AmqpClientTransport implements Transport {
  @Override
  public TransportConnection newConnection(ConnectionOptions options, String connectionName)
      throws IOException {
    ConnectionFactory factory = options.getConnectionFactory();
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    try {
      Connection connection = options.getConsumerExecutor() == null ? factory
          .newConnection(connectionName) : factory.newConnection(options.getConsumerExecutor(),
          connectionName);
      return new AmqpConnection(connection, factory);
    } catch (TimeoutException e) {
      throw new IOException("Timed out connecting to " + options.getAddress(), e);
    }
  }
}
