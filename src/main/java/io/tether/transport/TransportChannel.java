package io.tether.transport;

import java.io.IOException;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;

/**
 * A channel on a {@link TransportConnection}. Every operation blocks until the broker
 * acknowledges it. Broker rejections are thrown as {@link io.tether.BrokerException}s: a soft one
 * closes this channel, a hard one closes the connection.
 * 
 * @author Tether Authors
 */
public interface TransportChannel {
  int getChannelNumber();

  boolean isOpen();

  /**
   * Adds a listener that is called once when the channel closes for any reason.
   */
  void addShutdownListener(TransportShutdownListener listener);

  void basicQos(int prefetchCount) throws IOException;

  void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  void exchangeDelete(String exchange) throws IOException;

  /**
   * Declares the {@code queue}, or a server-named queue if {@code queue} is empty.
   * 
   * @return the name of the declared queue, as assigned by the broker for server-named queues
   */
  String queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  void queueDelete(String queue) throws IOException;

  void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments)
      throws IOException;

  void queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException;

  /**
   * Registers the {@code consumer}, letting the broker generate a tag if {@code consumerTag} is
   * empty.
   * 
   * @return the consumer tag
   */
  String basicConsume(String queue, boolean autoAck, String consumerTag, boolean exclusive,
      Map<String, Object> arguments, Consumer consumer) throws IOException;

  void basicCancel(String consumerTag) throws IOException;

  void basicPublish(String exchange, String routingKey, AMQP.BasicProperties properties,
      byte[] body) throws IOException;

  void basicAck(long deliveryTag, boolean multiple) throws IOException;

  void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

  void basicReject(long deliveryTag, boolean requeue) throws IOException;

  /**
   * Closes the channel, completing shutdown listeners with an application initiated failure.
   */
  void close() throws IOException;
}
