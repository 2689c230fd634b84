package io.tether.internal;

import java.util.Map;

/**
 * A recorded consumer registration. Like a {@link BindingRecord}, the consumed queue is
 * referenced through its {@link QueueRecord} when it was declared on the same channel.
 * 
 * @author Tether Authors
 */
public final class ConsumerRecord {
  private final boolean serverTag;
  private final boolean autoAck;
  private final boolean exclusive;
  private final Map<String, Object> arguments;
  private final ConsumerDelegate consumer;
  private volatile String consumerTag;
  private volatile QueueRecord queue;
  private volatile String queueName;

  ConsumerRecord(QueueRecord queue, String queueName, String consumerTag, boolean serverTag,
      boolean autoAck, boolean exclusive, Map<String, Object> arguments,
      ConsumerDelegate consumer) {
    this.queue = queue;
    this.queueName = queueName;
    this.consumerTag = consumerTag;
    this.serverTag = serverTag;
    this.autoAck = autoAck;
    this.exclusive = exclusive;
    this.arguments = ExchangeRecord.copy(arguments);
    this.consumer = consumer;
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public ConsumerDelegate getConsumer() {
    return consumer;
  }

  public String getConsumerTag() {
    return consumerTag;
  }

  /**
   * Returns the record of the consumed queue, else null if the queue was not declared on the
   * consumer's channel.
   */
  public QueueRecord getQueue() {
    return queue;
  }

  /**
   * Returns the current name of the consumed queue.
   */
  public String getQueueName() {
    QueueRecord q = queue;
    return q != null ? q.getName() : queueName;
  }

  public boolean isAutoAck() {
    return autoAck;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  /**
   * Returns whether the broker generated the consumer tag, in which case a fresh one is requested
   * on recovery.
   */
  public boolean isServerTag() {
    return serverTag;
  }

  /**
   * Returns the tag to request when re-registering the consumer.
   */
  String getRequestedTag() {
    return serverTag ? "" : consumerTag;
  }

  void link(QueueRecord queue) {
    this.queue = queue;
    this.queueName = queue.getName();
  }

  void setConsumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
  }

  @Override
  public String toString() {
    return "ConsumerRecord [tag=" + consumerTag + ", queue=" + getQueueName() + "]";
  }
}
