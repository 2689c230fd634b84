package io.tether.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Propagates the broker-assigned name of a re-declared server-named queue to every binding and
 * consumer recorded in the same channel's registry.
 * 
 * <p>
 * Renames are scoped to a single channel. A queue that is bound or consumed from a channel other
 * than the one that declared it keeps its old name there.
 * 
 * @author Tether Authors
 */
class RenamePropagator {
  private static final Logger log = LoggerFactory.getLogger(RenamePropagator.class);

  /**
   * Renames the queue recorded as {@code oldName} to {@code newName}, rewriting the queue
   * reference of each binding and consumer in the {@code registry} that pointed at
   * {@code oldName}.
   * 
   * @throws IllegalArgumentException if no queue named {@code oldName} is recorded
   */
  void rename(String oldName, String newName, EntityRegistry registry) {
    if (oldName.equals(newName))
      return;

    synchronized (registry) {
      QueueRecord queue = registry.getQueue(oldName);
      if (queue == null)
        throw new IllegalArgumentException("No queue named " + oldName + " is recorded");

      int rewritten = 0;
      for (BindingRecord binding : registry.getBindings())
        if (binding.getQueue() == queue)
          rewritten++;
        else if (binding.getQueue() == null && binding.getQueueName().equals(oldName)) {
          binding.link(queue);
          rewritten++;
        }
      for (ConsumerRecord consumer : registry.getConsumers())
        if (consumer.getQueue() == queue)
          rewritten++;
        else if (consumer.getQueue() == null && consumer.getQueueName().equals(oldName)) {
          consumer.link(queue);
          rewritten++;
        }

      queue.setName(newName);
      registry.rekeyQueue(queue, oldName, newName);
      log.debug("Renamed queue {} to {}, updating {} dependent bindings and consumers", oldName,
          newName, rewritten);
    }
  }
}
