package io.tether;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;

/**
 * A channel whose exchanges, queues, bindings and consumers are recorded and replayed after the
 * connection is recovered.
 * 
 * <p>
 * Every operation on a given queue or exchange (declare, bind, consume, delete) must be performed
 * on the channel that declared it. Recovery does not follow references across channels: a
 * server-named queue declared on one channel and consumed from another leaves the consuming
 * channel with the stale name after recovery.
 * 
 * <p>
 * Operations performed while the channel is recovering block until recovery completes.
 * Broker rejections are thrown as {@link BrokerException}s.
 * 
 * @author Tether Authors
 */
public interface RecoverableChannel {
  void basicAck(long deliveryTag, boolean multiple) throws IOException;

  void basicCancel(String consumerTag) throws IOException;

  /**
   * Registers the {@code consumer} with a broker generated consumer tag.
   * 
   * @return the consumer tag
   */
  String basicConsume(String queue, boolean autoAck, Consumer consumer) throws IOException;

  /**
   * Registers the {@code consumer}. A broker generated tag is used if {@code consumerTag} is
   * empty, and a fresh one is generated each time the consumer is recovered.
   * 
   * @return the consumer tag
   */
  String basicConsume(String queue, boolean autoAck, String consumerTag, boolean exclusive,
      Map<String, Object> arguments, Consumer consumer) throws IOException;

  void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

  void basicPublish(String exchange, String routingKey, AMQP.BasicProperties properties,
      byte[] body) throws IOException;

  /**
   * Sets the channel's prefetch count. The setting is re-applied when the channel is recovered.
   */
  void basicQos(int prefetchCount) throws IOException;

  void basicReject(long deliveryTag, boolean requeue) throws IOException;

  void close() throws IOException;

  void exchangeDeclare(String exchange, String type) throws IOException;

  void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  void exchangeDelete(String exchange) throws IOException;

  /**
   * Returns the channel's current number, which changes when the channel is recovered.
   */
  int getChannelNumber();

  RecoverableConnection getConnection();

  /**
   * Returns the current name of the queue that was declared on this channel as {@code name}, or
   * that was last known as {@code name}, else null if this channel never declared such a queue.
   * Server-named queues are renamed by the broker each time they are recovered.
   */
  String getCurrentQueueName(String name);

  /**
   * Returns the current names of the queues declared on this channel, in declaration order.
   */
  List<String> getQueueNames();

  ChannelState getState();

  /**
   * Returns whether the channel is open or recovering.
   */
  boolean isOpen();

  void queueBind(String queue, String exchange, String routingKey) throws IOException;

  void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments)
      throws IOException;

  /**
   * Declares a server-named, non-durable, exclusive, auto-delete queue.
   * 
   * @return the name assigned by the broker
   */
  String queueDeclare() throws IOException;

  /**
   * Declares the {@code queue}, or a server-named queue if {@code queue} is empty.
   * 
   * @return the name of the queue
   */
  String queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  void queueDelete(String queue) throws IOException;

  void queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException;
}
