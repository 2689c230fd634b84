package io.tether.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Records the delivery tags and cancellations it receives.
 */
class RecordingConsumer implements Consumer {
  final List<Long> deliveryTags = Collections.synchronizedList(new ArrayList<Long>());
  final List<String> cancelled = Collections.synchronizedList(new ArrayList<String>());

  @Override
  public void handleConsumeOk(String consumerTag) {
  }

  @Override
  public void handleCancelOk(String consumerTag) {
  }

  @Override
  public void handleCancel(String consumerTag) {
    cancelled.add(consumerTag);
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
  }

  @Override
  public void handleRecoverOk(String consumerTag) {
  }

  @Override
  public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties,
      byte[] body) {
    deliveryTags.add(envelope.getDeliveryTag());
  }
}
