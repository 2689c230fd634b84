package io.tether;

import java.util.concurrent.ExecutorService;

import io.tether.internal.util.Assert;
import io.tether.util.Duration;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Connection options describing the single broker endpoint to connect, and reconnect, to. Changes
 * will not affect connections that have already been created.
 * 
 * @author Tether Authors
 */
public class ConnectionOptions {
  private final ConnectionFactory factory;
  private String name;
  private ExecutorService executor;

  public ConnectionOptions() {
    factory = new ConnectionFactory();
  }

  /**
   * Creates a new Options object for the {@code connectionFactory}.
   * 
   * @throws NullPointerException if {@code connectionFactory} is null
   */
  public ConnectionOptions(ConnectionFactory connectionFactory) {
    this.factory = Assert.notNull(connectionFactory, "connectionFactory");
  }

  private ConnectionOptions(ConnectionOptions options) {
    factory = new ConnectionFactory();
    factory.setClientProperties(options.factory.getClientProperties());
    factory.setConnectionTimeout(options.factory.getConnectionTimeout());
    factory.setHost(options.factory.getHost());
    factory.setPort(options.factory.getPort());
    factory.setUsername(options.factory.getUsername());
    factory.setPassword(options.factory.getPassword());
    factory.setVirtualHost(options.factory.getVirtualHost());
    factory.setRequestedChannelMax(options.factory.getRequestedChannelMax());
    factory.setRequestedFrameMax(options.factory.getRequestedFrameMax());
    factory.setRequestedHeartbeat(options.factory.getRequestedHeartbeat());
    factory.setSaslConfig(options.factory.getSaslConfig());
    factory.setSocketFactory(options.factory.getSocketFactory());
    factory.setThreadFactory(options.factory.getThreadFactory());
    // Recovery is performed by Tether, never by the underlying client
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    name = options.name;
    executor = options.executor;
  }

  /**
   * Returns a new copy of the options.
   */
  public ConnectionOptions copy() {
    return new ConnectionOptions(this);
  }

  /**
   * Returns the endpoint address formatted as {@code amqp://host:port/vhost}.
   */
  public String getAddress() {
    String vhost = factory.getVirtualHost();
    return String.format("%s://%s:%s/%s", factory.isSSL() ? "amqps" : "amqp", factory.getHost(),
        factory.getPort(), "/".equals(vhost) ? "" : vhost);
  }

  /**
   * Returns the ConnectionFactory for the options.
   */
  public ConnectionFactory getConnectionFactory() {
    return factory;
  }

  /**
   * Returns the consumer executor.
   * 
   * @see #withConsumerExecutor(ExecutorService)
   */
  public ExecutorService getConsumerExecutor() {
    return executor;
  }

  public String getHost() {
    return factory.getHost();
  }

  public String getName() {
    return name;
  }

  public int getPort() {
    return factory.getPort();
  }

  public String getUsername() {
    return factory.getUsername();
  }

  public String getVirtualHost() {
    return factory.getVirtualHost();
  }

  /**
   * Sets the {@code connectionTimeout}.
   * 
   * @throws NullPointerException if {@code connectionTimeout} is null
   */
  public ConnectionOptions withConnectionTimeout(Duration connectionTimeout) {
    factory.setConnectionTimeout((int) Assert.notNull(connectionTimeout, "connectionTimeout")
        .toMillis());
    return this;
  }

  /**
   * Sets the executor used to handle consumer callbacks. The {@code executor} will not be shutdown
   * when a connection is closed.
   * 
   * @throws NullPointerException if {@code executor} is null
   */
  public ConnectionOptions withConsumerExecutor(ExecutorService executor) {
    this.executor = Assert.notNull(executor, "executor");
    return this;
  }

  /**
   * Sets the {@code host}.
   * 
   * @throws NullPointerException if {@code host} is null
   */
  public ConnectionOptions withHost(String host) {
    factory.setHost(Assert.notNull(host, "host"));
    return this;
  }

  /**
   * Sets the connection name. Used for logging and thread names.
   * 
   * @throws NullPointerException if {@code name} is null
   */
  public ConnectionOptions withName(String name) {
    this.name = Assert.notNull(name, "name");
    return this;
  }

  /**
   * Sets the password.
   * 
   * @throws NullPointerException if {@code password} is null
   */
  public ConnectionOptions withPassword(String password) {
    factory.setPassword(Assert.notNull(password, "password"));
    return this;
  }

  /**
   * Sets the port.
   */
  public ConnectionOptions withPort(int port) {
    factory.setPort(port);
    return this;
  }

  /**
   * Sets the requested heartbeat.
   * 
   * @throws NullPointerException if {@code requestedHeartbeat} is null
   */
  public ConnectionOptions withRequestedHeartbeat(Duration requestedHeartbeat) {
    factory.setRequestedHeartbeat((int) Assert.notNull(requestedHeartbeat, "requestedHeartbeat")
        .toSeconds());
    return this;
  }

  /**
   * Sets the username.
   * 
   * @throws NullPointerException if {@code username} is null
   */
  public ConnectionOptions withUsername(String username) {
    factory.setUsername(Assert.notNull(username, "username"));
    return this;
  }

  /**
   * Sets the virtual host.
   * 
   * @throws NullPointerException if {@code virtualHost} is null
   */
  public ConnectionOptions withVirtualHost(String virtualHost) {
    factory.setVirtualHost(Assert.notNull(virtualHost, "virtualHost"));
    return this;
  }
}
