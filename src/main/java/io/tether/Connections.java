package io.tether;

import java.io.IOException;

import io.tether.config.Config;
import io.tether.internal.ConnectionHandler;
import io.tether.internal.util.Assert;
import io.tether.transport.Transport;
import io.tether.transport.amqp.AmqpClientTransport;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Creates recoverable connections through which recoverable channels and consumers can be
 * created.
 * 
 * @author Tether Authors
 */
public final class Connections {
  private static final Transport DEFAULT_TRANSPORT = new AmqpClientTransport();

  private Connections() {
  }

  /**
   * Creates and returns a new RecoverableConnection to the default endpoint for the
   * {@code config}.
   * 
   * @throws NullPointerException if {@code config} is null
   * @throws ConnectionFailureException if the connection could not be created. The initial
   *           connection is never retried.
   */
  public static RecoverableConnection create(Config config) throws IOException {
    return create(new ConnectionOptions(), config);
  }

  /**
   * Creates and returns a new RecoverableConnection for the {@code connectionFactory} and
   * {@code config}.
   * 
   * @throws NullPointerException if {@code connectionFactory} or {@code config} are null
   * @throws ConnectionFailureException if the connection could not be created
   */
  public static RecoverableConnection create(ConnectionFactory connectionFactory, Config config)
      throws IOException {
    Assert.notNull(connectionFactory, "connectionFactory");
    return create(new ConnectionOptions(connectionFactory), config);
  }

  /**
   * Creates and returns a new RecoverableConnection for the {@code options} and {@code config}.
   * 
   * @throws NullPointerException if {@code options} or {@code config} are null
   * @throws ConnectionFailureException if the connection could not be created
   */
  public static RecoverableConnection create(ConnectionOptions options, Config config)
      throws IOException {
    return create(options, config, DEFAULT_TRANSPORT);
  }

  /**
   * Creates and returns a new RecoverableConnection for the {@code options} and {@code config},
   * opening physical connections through the {@code transport}.
   * 
   * @throws NullPointerException if {@code options}, {@code config} or {@code transport} are
   *           null
   * @throws ConnectionFailureException if the connection could not be created
   */
  public static RecoverableConnection create(ConnectionOptions options, Config config,
      Transport transport) throws IOException {
    Assert.notNull(options, "options");
    Assert.notNull(config, "config");
    Assert.notNull(transport, "transport");
    ConnectionHandler handler = new ConnectionHandler(options.copy(), config, transport);
    handler.createConnection();
    return handler;
  }
}
