package io.tether.internal;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tether.ChannelRecoveryException;
import io.tether.ChannelState;
import io.tether.RecoveryStep;
import io.tether.transport.TransportChannel;
import io.tether.transport.TransportConnection;

/**
 * Reopens a channel on a recovered connection and replays its recorded topology, strictly in the
 * order exchanges, queues, bindings, consumers. Each server-named queue is renamed as soon as it
 * is redeclared, so that the bindings and consumers replayed after it use the new name.
 *
 * <p>
 * The channel's lock is held for the whole replay. The first failure aborts the replay of the
 * channel and is reported as a {@link ChannelRecoveryException} naming the step and entity.
 * 
 * @author Tether Authors
 */
class ChannelRecoveryExecutor {
  private static final Logger log = LoggerFactory.getLogger(ChannelRecoveryExecutor.class);
  private final RenamePropagator renamePropagator;

  ChannelRecoveryExecutor(RenamePropagator renamePropagator) {
    this.renamePropagator = renamePropagator;
  }

  /**
   * Recovers the {@code channel} on the {@code connection}, replaying its topology if
   * {@code replayTopology} is true.
   *
   * @throws ChannelRecoveryException if the channel cannot be reopened or an entity cannot be
   *           replayed
   */
  RecoveredChannel recover(ChannelHandler channel, TransportConnection connection,
      boolean replayTopology) throws ChannelRecoveryException {
    channel.lock.lock();
    try {
      int previousChannelNumber = channel.getChannelNumber();
      log.info("Recovering {}", channel);
      channel.notifyRecoveryStarted();

      checkActive(channel, RecoveryStep.OPEN_CHANNEL, null);
      TransportChannel newChannel;
      try {
        newChannel = connection.createChannel();
        channel.replaceDelegate(newChannel);
      } catch (IOException e) {
        throw new ChannelRecoveryException(channel.toString(), RecoveryStep.OPEN_CHANNEL, null, e);
      }
      channel.notifyRecovery();

      EntityRegistry registry = channel.registry;
      Map<String, String> renamedQueues = new LinkedHashMap<String, String>();
      Map<String, String> retaggedConsumers = new LinkedHashMap<String, String>();
      if (!replayTopology) {
        registry.clear();
        return new RecoveredChannel(channel, previousChannelNumber,
            newChannel.getChannelNumber(), 0, 0, 0, 0, renamedQueues, retaggedConsumers);
      }

      int exchanges = 0;
      for (ExchangeRecord exchange : registry.getExchanges()) {
        if (exchange.isPredefined())
          continue;
        checkActive(channel, RecoveryStep.EXCHANGES, exchange.getName());
        try {
          newChannel.exchangeDeclare(exchange.getName(), exchange.getType(),
              exchange.isDurable(), exchange.isAutoDelete(), exchange.getArguments());
        } catch (IOException e) {
          throw new ChannelRecoveryException(channel.toString(), RecoveryStep.EXCHANGES,
              exchange.getName(), e);
        }
        log.debug("Recovered exchange {} via {}", exchange.getName(), channel);
        exchanges++;
      }

      int queues = 0;
      for (QueueRecord queue : registry.getQueues()) {
        String oldName = queue.getName();
        checkActive(channel, RecoveryStep.QUEUES, oldName);
        String newName;
        try {
          newName = newChannel.queueDeclare(queue.getDeclaredName(), queue.isDurable(),
              queue.isExclusive(), queue.isAutoDelete(), queue.getArguments());
        } catch (IOException e) {
          throw new ChannelRecoveryException(channel.toString(), RecoveryStep.QUEUES, oldName, e);
        }
        if (!oldName.equals(newName)) {
          renamePropagator.rename(oldName, newName, registry);
          if (oldName.equals(channel.lastGeneratedQueueName))
            channel.lastGeneratedQueueName = newName;
          renamedQueues.put(oldName, newName);
          log.info("Recovered queue {} as {} via {}", oldName, newName, channel);
        } else
          log.debug("Recovered queue {} via {}", oldName, channel);
        queues++;
      }

      int bindings = 0;
      for (BindingRecord binding : bindingsInQueueOrder(registry)) {
        String queueName = binding.getQueueName();
        checkActive(channel, RecoveryStep.BINDINGS, queueName);
        try {
          newChannel.queueBind(queueName, binding.getExchange(), binding.getRoutingKey(),
              binding.getArguments());
        } catch (IOException e) {
          throw new ChannelRecoveryException(channel.toString(), RecoveryStep.BINDINGS, queueName,
              e);
        }
        log.debug("Recovered binding of {} to {} with {} via {}", queueName,
            binding.getExchange(), binding.getRoutingKey(), channel);
        bindings++;
      }

      int consumers = 0;
      for (ConsumerRecord consumer : consumersInQueueOrder(registry)) {
        String oldTag = consumer.getConsumerTag();
        checkActive(channel, RecoveryStep.CONSUMERS, oldTag);
        ConsumerDelegate delegate = consumer.getConsumer();
        channel.notifyConsumerRecoveryStarted(delegate.getDelegate());
        String newTag;
        try {
          delegate.open();
          newTag = newChannel.basicConsume(consumer.getQueueName(), consumer.isAutoAck(),
              consumer.getRequestedTag(), consumer.isExclusive(), consumer.getArguments(),
              delegate);
        } catch (IOException e) {
          delegate.close();
          channel.notifyConsumerRecoveryFailure(delegate.getDelegate(), e);
          throw new ChannelRecoveryException(channel.toString(), RecoveryStep.CONSUMERS, oldTag,
              e);
        }
        if (!oldTag.equals(newTag)) {
          registry.retagConsumer(consumer, newTag);
          retaggedConsumers.put(oldTag, newTag);
        }
        log.debug("Recovered consumer-{} of {} via {}", newTag, consumer.getQueueName(), channel);
        channel.notifyConsumerRecoveryCompleted(delegate.getDelegate());
        consumers++;
      }

      return new RecoveredChannel(channel, previousChannelNumber, newChannel.getChannelNumber(),
          exchanges, queues, bindings, consumers, renamedQueues, retaggedConsumers);
    } finally {
      channel.lock.unlock();
    }
  }

  /**
   * Returns the bindings grouped by the recorded queue they reference, in queue declaration
   * order, followed by the bindings of queues not declared on the channel.
   */
  private static List<BindingRecord> bindingsInQueueOrder(EntityRegistry registry) {
    List<BindingRecord> result = new ArrayList<BindingRecord>();
    for (QueueRecord queue : registry.getQueues())
      result.addAll(registry.getBindings(queue));
    for (BindingRecord binding : registry.getBindings())
      if (binding.getQueue() == null)
        result.add(binding);
    return result;
  }

  private static List<ConsumerRecord> consumersInQueueOrder(EntityRegistry registry) {
    List<ConsumerRecord> result = new ArrayList<ConsumerRecord>();
    for (QueueRecord queue : registry.getQueues())
      result.addAll(registry.getConsumers(queue));
    for (ConsumerRecord consumer : registry.getConsumers())
      if (consumer.getQueue() == null)
        result.add(consumer);
    return result;
  }

  /**
   * Aborts the replay if the channel was closed or the recovering thread was interrupted.
   */
  private static void checkActive(ChannelHandler channel, RecoveryStep step, String entityName)
      throws ChannelRecoveryException {
    if (channel.getState() != ChannelState.RECOVERING || Thread.currentThread().isInterrupted())
      throw new ChannelRecoveryException(channel.toString(), step, entityName,
          new InterruptedIOException("Recovery of " + channel + " was abandoned"));
  }
}
