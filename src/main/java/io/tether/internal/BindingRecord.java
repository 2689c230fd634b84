package io.tether.internal;

import java.util.Map;

/**
 * A recorded binding of a queue to an exchange. The queue is referenced through its
 * {@link QueueRecord} when the queue was declared on the same channel, so that renames of
 * server-named queues carry over. Otherwise the queue name is held as given.
 * 
 * @author Tether Authors
 */
public final class BindingRecord {
  private final String exchange;
  private final String routingKey;
  private final Map<String, Object> arguments;
  private volatile QueueRecord queue;
  private volatile String queueName;

  BindingRecord(QueueRecord queue, String queueName, String exchange, String routingKey,
      Map<String, Object> arguments) {
    this.queue = queue;
    this.queueName = queueName;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.arguments = ExchangeRecord.copy(arguments);
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public String getExchange() {
    return exchange;
  }

  /**
   * Returns the current name of the bound queue.
   */
  public String getQueueName() {
    QueueRecord q = queue;
    return q != null ? q.getName() : queueName;
  }

  /**
   * Returns the record of the bound queue, else null if the queue was not declared on the
   * binding's channel.
   */
  public QueueRecord getQueue() {
    return queue;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  boolean matches(String queueName, String exchange, String routingKey,
      Map<String, Object> arguments) {
    return getQueueName().equals(queueName) && this.exchange.equals(exchange)
        && this.routingKey.equals(routingKey) && equal(this.arguments, arguments);
  }

  void link(QueueRecord queue) {
    this.queue = queue;
    this.queueName = queue.getName();
  }

  static boolean equal(Map<String, Object> a, Map<String, Object> b) {
    boolean aEmpty = a == null || a.isEmpty();
    boolean bEmpty = b == null || b.isEmpty();
    if (aEmpty || bEmpty)
      return aEmpty == bEmpty;
    return a.equals(b);
  }

  @Override
  public String toString() {
    return "BindingRecord [queue=" + getQueueName() + ", exchange=" + exchange + ", routingKey="
        + routingKey + "]";
  }
}
