package io.tether.internal;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;

import io.tether.BrokerException;
import io.tether.ChannelState;
import io.tether.RecoverableChannel;
import io.tether.RecoverableConnection;
import io.tether.config.Config;
import io.tether.event.ChannelListener;
import io.tether.event.ConsumerListener;
import io.tether.internal.util.Assert;
import io.tether.internal.util.concurrent.ReentrantCircuit;
import io.tether.transport.TransportChannel;
import io.tether.transport.TransportShutdownListener;

/**
 * Handles channel operations, recording the topology they declare so that it can be replayed
 * when the connection is recovered.
 * 
 * @author Tether Authors
 */
public class ChannelHandler implements RecoverableChannel {
  private static final long REPLACEMENT_POLL_MILLIS = 10;

  final Logger log = LoggerFactory.getLogger(getClass());
  private final ConnectionHandler connectionHandler;
  private final Config config;
  final EntityRegistry registry = new EntityRegistry();
  /** Held by application operations and for the whole of a replay. */
  final ReentrantLock lock = new ReentrantLock();
  /** Open while the channel is recovering. */
  final ReentrantCircuit circuit = new ReentrantCircuit();
  private volatile TransportChannel delegate;
  private volatile ChannelState state = ChannelState.OPEN;
  private volatile Throwable recoveryFailure;
  private volatile int prefetchCount = -1;
  volatile String lastGeneratedQueueName;
  volatile long previousMaxDeliveryTag;
  volatile long maxDeliveryTag;
  /** Set once the broker's closure of the channel has been reported. */
  private final AtomicBoolean brokerClosureReported = new AtomicBoolean();
  /** A broker closure that arrived while an operation was in progress. */
  private final AtomicReference<BrokerException> pendingBrokerClosure =
      new AtomicReference<BrokerException>();

  /**
   * An operation against the current transport channel.
   */
  private abstract static class Invocation<T> {
    private final String name;
    /** The exchange, queue or consumer tag the operation targets, else null. */
    private final String entityName;

    Invocation(String name) {
      this(name, null);
    }

    Invocation(String name, String entityName) {
      this.name = name;
      this.entityName = entityName;
    }

    abstract T call(TransportChannel channel) throws IOException;

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Discards the channel when the broker closes it outside of recovery. A closure caused by an
   * operation in progress is reported by that operation, with the entity it targeted.
   */
  private class ChannelShutdownListener implements TransportShutdownListener {
    private final TransportChannel channel;

    ChannelShutdownListener(TransportChannel channel) {
      this.channel = channel;
    }

    @Override
    public void shutdownCompleted(BrokerException cause) {
      if (channel != delegate || cause.isHard() || cause.isInitiatedByApplication()
          || state != ChannelState.OPEN)
        return;

      BrokerException failure = cause.onConnection(connectionHandler.getName());
      if (lock.isLocked()) {
        pendingBrokerClosure.set(failure);
        if (lock.isLocked())
          return;
        failure = pendingBrokerClosure.getAndSet(null);
        if (failure == null)
          return;
      }
      closedByBroker(failure);
    }
  }

  ChannelHandler(ConnectionHandler connectionHandler, TransportChannel delegate, Config config) {
    this.connectionHandler = connectionHandler;
    this.config = config;
    this.delegate = delegate;
    delegate.addShutdownListener(new ChannelShutdownListener(delegate));
  }

  @Override
  public void basicAck(final long deliveryTag, final boolean multiple) throws IOException {
    invoke(new Invocation<Void>("basicAck") {
      @Override
      Void call(TransportChannel channel) throws IOException {
        long tag = deliveryTag - previousMaxDeliveryTag;
        if (tag > 0)
          channel.basicAck(tag, multiple);
        return null;
      }
    });
  }

  @Override
  public void basicCancel(final String consumerTag) throws IOException {
    invoke(new Invocation<Void>("basicCancel", consumerTag) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        channel.basicCancel(consumerTag);
        registry.removeConsumer(consumerTag);
        return null;
      }
    });
  }

  @Override
  public String basicConsume(String queue, boolean autoAck, Consumer consumer) throws IOException {
    return basicConsume(queue, autoAck, "", false, null, consumer);
  }

  @Override
  public String basicConsume(final String queue, final boolean autoAck, final String consumerTag,
      final boolean exclusive, final Map<String, Object> arguments, Consumer consumer)
      throws IOException {
    Assert.notNull(consumerTag, "consumerTag");
    final ConsumerDelegate consumerDelegate = new ConsumerDelegate(this,
        Assert.notNull(consumer, "consumer"));
    return invoke(new Invocation<String>("basicConsume", resolveQueueName(queue)) {
      @Override
      String call(TransportChannel channel) throws IOException {
        String queueName = resolveQueueName(queue);
        String tag = channel.basicConsume(queueName, autoAck, consumerTag, exclusive, arguments,
            consumerDelegate);
        if (config.isTopologyRecoveryEnabled()) {
          checkQueueLocality(queueName);
          registry.recordConsumer(queueName, tag, consumerTag.isEmpty(), autoAck, exclusive,
              arguments, consumerDelegate);
        }
        log.info("Created consumer-{} of {} via {}", tag, queueName, ChannelHandler.this);
        return tag;
      }
    });
  }

  @Override
  public void basicNack(final long deliveryTag, final boolean multiple, final boolean requeue)
      throws IOException {
    invoke(new Invocation<Void>("basicNack") {
      @Override
      Void call(TransportChannel channel) throws IOException {
        long tag = deliveryTag - previousMaxDeliveryTag;
        if (tag > 0)
          channel.basicNack(tag, multiple, requeue);
        return null;
      }
    });
  }

  @Override
  public void basicPublish(final String exchange, final String routingKey,
      final AMQP.BasicProperties properties, final byte[] body) throws IOException {
    invoke(new Invocation<Void>("basicPublish", exchange) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        channel.basicPublish(exchange, routingKey, properties, body);
        return null;
      }
    });
  }

  @Override
  public void basicQos(final int prefetchCount) throws IOException {
    Assert.isTrue(prefetchCount >= 0, "prefetchCount must be >= 0");
    invoke(new Invocation<Void>("basicQos") {
      @Override
      Void call(TransportChannel channel) throws IOException {
        channel.basicQos(prefetchCount);
        ChannelHandler.this.prefetchCount = prefetchCount;
        return null;
      }
    });
  }

  @Override
  public void basicReject(final long deliveryTag, final boolean requeue) throws IOException {
    invoke(new Invocation<Void>("basicReject") {
      @Override
      Void call(TransportChannel channel) throws IOException {
        long tag = deliveryTag - previousMaxDeliveryTag;
        if (tag > 0)
          channel.basicReject(tag, requeue);
        return null;
      }
    });
  }

  @Override
  public void close() throws IOException {
    if (!isOpen())
      return;
    discard(ChannelState.CLOSED);
    lock.lock();
    try {
      TransportChannel channel = delegate;
      if (channel.isOpen())
        channel.close();
    } finally {
      lock.unlock();
    }
    log.info("Closed {}", this);
  }

  @Override
  public void exchangeDeclare(String exchange, String type) throws IOException {
    exchangeDeclare(exchange, type, false, false, null);
  }

  @Override
  public void exchangeDeclare(final String exchange, final String type, final boolean durable,
      final boolean autoDelete, final Map<String, Object> arguments) throws IOException {
    invoke(new Invocation<Void>("exchangeDeclare", exchange) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        channel.exchangeDeclare(exchange, type, durable, autoDelete, arguments);
        if (config.isTopologyRecoveryEnabled())
          registry.recordExchange(exchange, type, durable, autoDelete, arguments);
        return null;
      }
    });
  }

  @Override
  public void exchangeDelete(final String exchange) throws IOException {
    invoke(new Invocation<Void>("exchangeDelete", exchange) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        channel.exchangeDelete(exchange);
        registry.removeExchange(exchange);
        return null;
      }
    });
  }

  @Override
  public int getChannelNumber() {
    return delegate.getChannelNumber();
  }

  @Override
  public RecoverableConnection getConnection() {
    return connectionHandler;
  }

  @Override
  public String getCurrentQueueName(String name) {
    QueueRecord queue = registry.findQueue(name);
    return queue == null ? null : queue.getName();
  }

  @Override
  public List<String> getQueueNames() {
    List<String> names = new ArrayList<String>();
    for (QueueRecord queue : registry.getQueues())
      names.add(queue.getName());
    return names;
  }

  @Override
  public ChannelState getState() {
    return state;
  }

  @Override
  public boolean isOpen() {
    ChannelState current = state;
    return current == ChannelState.OPEN || current == ChannelState.RECOVERING;
  }

  @Override
  public void queueBind(String queue, String exchange, String routingKey) throws IOException {
    queueBind(queue, exchange, routingKey, null);
  }

  @Override
  public void queueBind(final String queue, final String exchange, final String routingKey,
      final Map<String, Object> arguments) throws IOException {
    invoke(new Invocation<Void>("queueBind", resolveQueueName(queue)) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        String queueName = resolveQueueName(queue);
        channel.queueBind(queueName, exchange, routingKey, arguments);
        if (config.isTopologyRecoveryEnabled()) {
          checkQueueLocality(queueName);
          registry.recordBinding(queueName, exchange, routingKey, arguments);
        }
        return null;
      }
    });
  }

  @Override
  public String queueDeclare() throws IOException {
    return queueDeclare("", false, true, true, null);
  }

  @Override
  public String queueDeclare(final String queue, final boolean durable, final boolean exclusive,
      final boolean autoDelete, final Map<String, Object> arguments) throws IOException {
    Assert.notNull(queue, "queue");
    return invoke(new Invocation<String>("queueDeclare", queue.isEmpty() ? null : queue) {
      @Override
      String call(TransportChannel channel) throws IOException {
        String name = channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
        boolean serverNamed = queue.isEmpty();
        if (serverNamed)
          lastGeneratedQueueName = name;
        if (config.isTopologyRecoveryEnabled())
          registry.recordQueue(name, serverNamed, durable, exclusive, autoDelete, arguments);
        log.debug("Declared queue {} via {}", name, ChannelHandler.this);
        return name;
      }
    });
  }

  @Override
  public void queueDelete(final String queue) throws IOException {
    invoke(new Invocation<Void>("queueDelete", resolveQueueName(queue)) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        String queueName = resolveQueueName(queue);
        channel.queueDelete(queueName);
        registry.removeQueue(queueName);
        return null;
      }
    });
  }

  @Override
  public void queueUnbind(final String queue, final String exchange, final String routingKey,
      final Map<String, Object> arguments) throws IOException {
    invoke(new Invocation<Void>("queueUnbind", resolveQueueName(queue)) {
      @Override
      Void call(TransportChannel channel) throws IOException {
        String queueName = resolveQueueName(queue);
        channel.queueUnbind(queueName, exchange, routingKey, arguments);
        registry.removeBinding(queueName, exchange, routingKey, arguments);
        return null;
      }
    });
  }

  @Override
  public String toString() {
    return String.format("channel-%s on %s", delegate.getChannelNumber(), connectionHandler);
  }

  /**
   * Called by a consumer when the broker cancels it.
   */
  void consumerCancelled(String consumerTag) {
    if (registry.removeConsumer(consumerTag) != null)
      log.info("Consumer-{} was cancelled by the broker via {}", consumerTag, this);
  }

  /**
   * Records a delivery's tag, returning the tag as presented to the application.
   */
  long deliveryTagReceived(long deliveryTag) {
    long tag = deliveryTag + previousMaxDeliveryTag;
    if (tag > maxDeliveryTag)
      maxDeliveryTag = tag;
    return tag;
  }

  /**
   * Blocks operations on the channel until it is recovered.
   */
  void connectionLost() {
    if (!isOpen())
      return;
    state = ChannelState.RECOVERING;
    circuit.open();
    for (ConsumerRecord consumer : registry.getConsumers())
      consumer.getConsumer().close();
  }

  /**
   * Permanently closes the channel after its connection was closed or abandoned.
   */
  void connectionClosed() {
    if (isOpen())
      discard(ChannelState.CLOSED);
  }

  TransportChannel getDelegate() {
    return delegate;
  }

  /**
   * Replaces the transport channel with the {@code channel} that was reopened for recovery,
   * migrating the channel's settings to it.
   */
  void replaceDelegate(TransportChannel channel) throws IOException {
    if (prefetchCount >= 0)
      channel.basicQos(prefetchCount);
    channel.addShutdownListener(new ChannelShutdownListener(channel));
    previousMaxDeliveryTag = maxDeliveryTag;
    delegate = channel;
  }

  /**
   * Resumes operations on the channel after a successful recovery.
   */
  void recovered() {
    if (state != ChannelState.RECOVERING)
      return;
    state = ChannelState.OPEN;
    circuit.close();
    log.info("Recovered {}", this);
    notifyRecoveryCompleted();
  }

  /**
   * Marks the channel as failed, removing it from its connection.
   */
  void recoveryFailed(Throwable failure) {
    if (state != ChannelState.RECOVERING)
      return;
    recoveryFailure = failure;
    log.error("Failed to recover {}", this, failure);
    discard(ChannelState.FAILED);
    if (delegate.isOpen())
      try {
        delegate.close();
      } catch (IOException e) {
        log.debug("Failed to close {} after failed recovery", this, e);
      }
    notifyRecoveryFailure(failure);
  }

  void notifyChannelException(BrokerException failure) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onChannelException(this, failure);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  void notifyCreate() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onCreate(this);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  void notifyRecoveryStarted() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryStarted(this);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  void notifyRecovery() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecovery(this);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  private void notifyRecoveryCompleted() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryCompleted(this);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  private void notifyRecoveryFailure(Throwable failure) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryFailure(this, failure);
      } catch (Exception e) {
        log.warn("Channel listener {} failed", listener, e);
      }
  }

  void notifyConsumerRecoveryStarted(Consumer consumer) {
    for (ConsumerListener listener : config.getConsumerListeners())
      try {
        listener.onRecoveryStarted(consumer, this);
      } catch (Exception e) {
        log.warn("Consumer listener {} failed", listener, e);
      }
  }

  void notifyConsumerRecoveryCompleted(Consumer consumer) {
    for (ConsumerListener listener : config.getConsumerListeners())
      try {
        listener.onRecoveryCompleted(consumer, this);
      } catch (Exception e) {
        log.warn("Consumer listener {} failed", listener, e);
      }
  }

  void notifyConsumerRecoveryFailure(Consumer consumer, Throwable failure) {
    for (ConsumerListener listener : config.getConsumerListeners())
      try {
        listener.onRecoveryFailure(consumer, this, failure);
      } catch (Exception e) {
        log.warn("Consumer listener {} failed", listener, e);
      }
  }

  /**
   * Performs the {@code invocation} once the channel is not recovering. An invocation that fails
   * because the connection was lost is retried once against the recovered channel.
   */
  private <T> T invoke(Invocation<T> invocation) throws IOException {
    boolean retried = false;
    while (true) {
      awaitRecovery();
      TransportChannel channel = delegate;
      lock.lock();
      try {
        assertOpen();
        if (channel != delegate)
          continue;
        return invocation.call(channel);
      } catch (BrokerException e) {
        BrokerException failure = e.onConnection(connectionHandler.getName()).forEntity(
            invocation.entityName);
        if (failure.isSoft()) {
          if (!failure.isInitiatedByApplication())
            closedByBroker(failure);
          throw failure;
        }
        if (retried || !connectionHandler.canRecover())
          throw failure;
        retried = true;
        log.debug("{} on {} failed due to a connection closure, retrying after recovery",
            invocation, this);
      } finally {
        lock.unlock();
        BrokerException pending = pendingBrokerClosure.getAndSet(null);
        if (pending != null)
          closedByBroker(pending);
      }
      awaitReplacement(channel);
    }
  }

  private void assertOpen() {
    ChannelState current = state;
    if (current == ChannelState.FAILED)
      throw new IllegalStateException(this + " failed to recover", recoveryFailure);
    Assert.state(current != ChannelState.CLOSED, "%s is closed", this);
  }

  private void awaitRecovery() throws IOException {
    try {
      circuit.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for " + this + " to recover");
    }
  }

  /**
   * Waits until the {@code channel} that failed with a connection closure has been replaced, or
   * until this channel can no longer be recovered.
   */
  private void awaitReplacement(TransportChannel channel) throws IOException {
    try {
      while (delegate == channel && isOpen())
        if (circuit.isClosed())
          Thread.sleep(REPLACEMENT_POLL_MILLIS);
        else
          circuit.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for " + this + " to recover");
    }
  }

  /**
   * Discards the channel after the broker closed it with the soft {@code failure}, reporting the
   * closure once.
   */
  private void closedByBroker(BrokerException failure) {
    if (state != ChannelState.OPEN || !brokerClosureReported.compareAndSet(false, true))
      return;
    log.error("{} was closed by the broker: {}", this, failure.getMessage());
    discard(ChannelState.CLOSED);
    notifyChannelException(failure);
  }

  private void checkQueueLocality(String queueName) {
    if (registry.getQueue(queueName) == null)
      connectionHandler.checkQueueLocality(this, queueName);
  }

  /**
   * Sets the terminal {@code newState}, removing the channel from its connection and releasing
   * operations waiting on it.
   */
  private void discard(ChannelState newState) {
    state = newState;
    for (ConsumerRecord consumer : registry.getConsumers())
      consumer.getConsumer().close();
    connectionHandler.removeChannel(this);
    circuit.close();
  }

  /**
   * Returns the name of the last server-named queue declared on this channel if {@code queue} is
   * empty, else {@code queue}.
   */
  private String resolveQueueName(String queue) {
    if (queue == null || !queue.isEmpty())
      return queue;
    String last = lastGeneratedQueueName;
    return last == null ? queue : last;
  }
}
