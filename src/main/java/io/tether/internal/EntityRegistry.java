package io.tether.internal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the exchanges, queues, bindings and consumers declared on a single channel, in
 * declaration order. The registry is owned by its channel: it is mutated only by the channel's own
 * operations and by the {@link RenamePropagator} while that channel recovers.
 * 
 * @author Tether Authors
 */
public class EntityRegistry {
  private final Map<String, ExchangeRecord> exchanges = new LinkedHashMap<String, ExchangeRecord>();
  private final Map<String, QueueRecord> queues = new LinkedHashMap<String, QueueRecord>();
  private final List<BindingRecord> bindings = new ArrayList<BindingRecord>();
  private final Map<String, ConsumerRecord> consumers = new LinkedHashMap<String, ConsumerRecord>();

  public synchronized void clear() {
    exchanges.clear();
    queues.clear();
    bindings.clear();
    consumers.clear();
  }

  /**
   * Returns the recorded queue currently named {@code name}, else null.
   */
  public synchronized QueueRecord getQueue(String name) {
    return queues.get(name);
  }

  /**
   * Returns the recorded queue currently or originally named {@code name}, else null.
   */
  public synchronized QueueRecord findQueue(String name) {
    QueueRecord queue = queues.get(name);
    if (queue == null)
      for (QueueRecord candidate : queues.values())
        if (candidate.getOriginalName().equals(name))
          return candidate;
    return queue;
  }

  public synchronized ExchangeRecord getExchange(String name) {
    return exchanges.get(name);
  }

  public synchronized ConsumerRecord getConsumer(String consumerTag) {
    return consumers.get(consumerTag);
  }

  public synchronized List<ExchangeRecord> getExchanges() {
    return new ArrayList<ExchangeRecord>(exchanges.values());
  }

  public synchronized List<QueueRecord> getQueues() {
    return new ArrayList<QueueRecord>(queues.values());
  }

  public synchronized List<BindingRecord> getBindings() {
    return new ArrayList<BindingRecord>(bindings);
  }

  public synchronized List<ConsumerRecord> getConsumers() {
    return new ArrayList<ConsumerRecord>(consumers.values());
  }

  /**
   * Returns the bindings of the {@code queue}, in declaration order.
   */
  public synchronized List<BindingRecord> getBindings(QueueRecord queue) {
    List<BindingRecord> result = new ArrayList<BindingRecord>();
    for (BindingRecord binding : bindings)
      if (binding.getQueue() == queue)
        result.add(binding);
    return result;
  }

  /**
   * Returns the consumers of the {@code queue}, in registration order.
   */
  public synchronized List<ConsumerRecord> getConsumers(QueueRecord queue) {
    List<ConsumerRecord> result = new ArrayList<ConsumerRecord>();
    for (ConsumerRecord consumer : consumers.values())
      if (consumer.getQueue() == queue)
        result.add(consumer);
    return result;
  }

  public synchronized boolean isEmpty() {
    return exchanges.isEmpty() && queues.isEmpty() && bindings.isEmpty() && consumers.isEmpty();
  }

  synchronized ExchangeRecord recordExchange(String name, String type, boolean durable,
      boolean autoDelete, Map<String, Object> arguments) {
    ExchangeRecord exchange = new ExchangeRecord(name, type, durable, autoDelete, arguments);
    exchanges.put(name, exchange);
    return exchange;
  }

  /**
   * Records a queue declaration, returning the existing record if the queue was already declared
   * on this channel.
   */
  synchronized QueueRecord recordQueue(String name, boolean serverNamed, boolean durable,
      boolean exclusive, boolean autoDelete, Map<String, Object> arguments) {
    QueueRecord queue = queues.get(name);
    if (queue == null) {
      queue = new QueueRecord(name, serverNamed, durable, exclusive, autoDelete, arguments);
      queues.put(name, queue);
    }
    return queue;
  }

  synchronized BindingRecord recordBinding(String queueName, String exchange, String routingKey,
      Map<String, Object> arguments) {
    for (BindingRecord binding : bindings)
      if (binding.matches(queueName, exchange, routingKey, arguments))
        return binding;
    BindingRecord binding = new BindingRecord(queues.get(queueName), queueName, exchange,
        routingKey, arguments);
    bindings.add(binding);
    return binding;
  }

  synchronized ConsumerRecord recordConsumer(String queueName, String consumerTag,
      boolean serverTag, boolean autoAck, boolean exclusive, Map<String, Object> arguments,
      ConsumerDelegate consumer) {
    ConsumerRecord record = new ConsumerRecord(queues.get(queueName), queueName, consumerTag,
        serverTag, autoAck, exclusive, arguments, consumer);
    consumers.put(consumerTag, record);
    return record;
  }

  /**
   * Removes the exchange along with the bindings that route from it.
   */
  synchronized ExchangeRecord removeExchange(String name) {
    for (Iterator<BindingRecord> it = bindings.iterator(); it.hasNext();)
      if (it.next().getExchange().equals(name))
        it.remove();
    return exchanges.remove(name);
  }

  /**
   * Removes the queue along with its bindings and consumers.
   */
  synchronized QueueRecord removeQueue(String name) {
    for (Iterator<BindingRecord> it = bindings.iterator(); it.hasNext();)
      if (it.next().getQueueName().equals(name))
        it.remove();
    for (Iterator<ConsumerRecord> it = consumers.values().iterator(); it.hasNext();)
      if (it.next().getQueueName().equals(name))
        it.remove();
    return queues.remove(name);
  }

  synchronized boolean removeBinding(String queueName, String exchange, String routingKey,
      Map<String, Object> arguments) {
    for (Iterator<BindingRecord> it = bindings.iterator(); it.hasNext();)
      if (it.next().matches(queueName, exchange, routingKey, arguments)) {
        it.remove();
        return true;
      }
    return false;
  }

  synchronized ConsumerRecord removeConsumer(String consumerTag) {
    return consumers.remove(consumerTag);
  }

  /**
   * Re-keys the {@code consumer} under the tag generated for it during recovery.
   */
  synchronized void retagConsumer(ConsumerRecord consumer, String newTag) {
    rekey(consumers, consumer.getConsumerTag(), newTag, consumer);
    consumer.setConsumerTag(newTag);
  }

  /**
   * Re-keys the {@code queue} under its {@code newName}, preserving declaration order.
   */
  synchronized void rekeyQueue(QueueRecord queue, String oldName, String newName) {
    rekey(queues, oldName, newName, queue);
  }

  private static <V> void rekey(Map<String, V> map, String oldKey, String newKey, V value) {
    Map<String, V> reordered = new LinkedHashMap<String, V>();
    for (Map.Entry<String, V> entry : map.entrySet())
      if (entry.getKey().equals(oldKey))
        reordered.put(newKey, value);
      else if (!entry.getKey().equals(newKey))
        reordered.put(entry.getKey(), entry.getValue());
    map.clear();
    map.putAll(reordered);
  }

  @Override
  public synchronized String toString() {
    return "EntityRegistry [exchanges=" + exchanges.size() + ", queues=" + queues.size()
        + ", bindings=" + bindings.size() + ", consumers=" + consumers.size() + "]";
  }
}
