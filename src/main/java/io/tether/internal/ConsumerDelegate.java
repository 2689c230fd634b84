package io.tether.internal;

import java.io.IOException;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Delegates consumer callbacks to the application's consumer, presenting delivery tags that keep
 * increasing across channel recoveries and dropping deliveries from a channel that has been
 * replaced.
 * 
 * @author Tether Authors
 */
public class ConsumerDelegate implements Consumer {
  private final ChannelHandler channelHandler;
  final Consumer delegate;
  private volatile boolean closed;

  ConsumerDelegate(ChannelHandler channelHandler, Consumer delegate) {
    this.channelHandler = channelHandler;
    this.delegate = delegate;
  }

  /**
   * Returns the application's consumer.
   */
  public Consumer getDelegate() {
    return delegate;
  }

  @Override
  public void handleCancel(String consumerTag) throws IOException {
    channelHandler.consumerCancelled(consumerTag);
    delegate.handleCancel(consumerTag);
  }

  @Override
  public void handleCancelOk(String consumerTag) {
    delegate.handleCancelOk(consumerTag);
  }

  @Override
  public void handleConsumeOk(String consumerTag) {
    delegate.handleConsumeOk(consumerTag);
  }

  @Override
  public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties,
      byte[] body) throws IOException {
    if (closed)
      return;
    long deliveryTag = channelHandler.deliveryTagReceived(envelope.getDeliveryTag());
    delegate.handleDelivery(consumerTag, new Envelope(deliveryTag, envelope.isRedeliver(),
        envelope.getExchange(), envelope.getRoutingKey()), properties, body);
  }

  @Override
  public void handleRecoverOk(String consumerTag) {
    delegate.handleRecoverOk(consumerTag);
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    delegate.handleShutdownSignal(consumerTag, sig);
  }

  @Override
  public String toString() {
    return delegate.toString();
  }

  void close() {
    closed = true;
  }

  void open() {
    closed = false;
  }
}
