package io.tether.transport.amqp;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

import io.tether.internal.util.Exceptions;
import io.tether.transport.TransportChannel;
import io.tether.transport.TransportShutdownListener;

/**
 * A {@link TransportChannel} backed by a RabbitMQ client channel. The client reports broker
 * rejections as shutdown signals, either thrown directly or as the cause of an
 * {@link IOException}; both are translated to {@link io.tether.BrokerException}s.
 * 
 * @author Tether Authors
 */
class AmqpChannel implements TransportChannel {
  private final Channel channel;

  AmqpChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public int getChannelNumber() {
    return channel.getChannelNumber();
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void addShutdownListener(final TransportShutdownListener listener) {
    channel.addShutdownListener(new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException cause) {
        listener.shutdownCompleted(Exceptions.toBrokerException(cause, getChannelNumber()));
      }
    });
  }

  @Override
  public void basicQos(int prefetchCount) throws IOException {
    try {
      channel.basicQos(prefetchCount);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) throws IOException {
    try {
      channel.exchangeDeclare(exchange, type, durable, autoDelete, arguments);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void exchangeDelete(String exchange) throws IOException {
    try {
      channel.exchangeDelete(exchange);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public String queueDeclare(String queue, boolean durable, boolean exclusive,
      boolean autoDelete, Map<String, Object> arguments) throws IOException {
    try {
      return channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments).getQueue();
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void queueDelete(String queue) throws IOException {
    try {
      channel.queueDelete(queue);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void queueBind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException {
    try {
      channel.queueBind(queue, exchange, routingKey, arguments);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments) throws IOException {
    try {
      channel.queueUnbind(queue, exchange, routingKey, arguments);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public String basicConsume(String queue, boolean autoAck, String consumerTag,
      boolean exclusive, Map<String, Object> arguments, Consumer consumer) throws IOException {
    try {
      return channel.basicConsume(queue, autoAck, consumerTag, false, exclusive, arguments,
          consumer);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void basicCancel(String consumerTag) throws IOException {
    try {
      channel.basicCancel(consumerTag);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void basicPublish(String exchange, String routingKey, AMQP.BasicProperties properties,
      byte[] body) throws IOException {
    try {
      channel.basicPublish(exchange, routingKey, properties, body);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void basicAck(long deliveryTag, boolean multiple) throws IOException {
    try {
      channel.basicAck(deliveryTag, multiple);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
    try {
      channel.basicNack(deliveryTag, multiple, requeue);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void basicReject(long deliveryTag, boolean requeue) throws IOException {
    try {
      channel.basicReject(deliveryTag, requeue);
    } catch (IOException e) {
      throw translate(e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public void close() throws IOException {
    try {
      if (channel.isOpen())
        channel.close();
    } catch (TimeoutException e) {
      throw new IOException("Timed out closing channel " + getChannelNumber(), e);
    } catch (ShutdownSignalException e) {
      throw translate(e);
    }
  }

  @Override
  public String toString() {
    return "channel-" + getChannelNumber();
  }

  private IOException translate(IOException e) {
    ShutdownSignalException sse = Exceptions.extractCause(e, ShutdownSignalException.class);
    return sse == null ? e : Exceptions.toBrokerException(sse, getChannelNumber());
  }

  private IOException translate(ShutdownSignalException e) {
    return Exceptions.toBrokerException(e, getChannelNumber());
  }
}
