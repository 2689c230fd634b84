package io.tether.internal;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.Arrays;

import net.jodah.concurrentunit.Waiter;

import org.testng.annotations.Test;

import com.rabbitmq.client.Consumer;

import io.tether.ChannelRecoveryException;
import io.tether.ChannelState;
import io.tether.ConnectionFailureException;
import io.tether.ConnectionFailureException.Phase;
import io.tether.ConnectionFailureException.Reason;
import io.tether.ConnectionState;
import io.tether.RecoverableChannel;
import io.tether.RecoverableConnection;
import io.tether.RecoveryState;
import io.tether.RecoveryStep;
import io.tether.ReplyCodes;
import io.tether.config.RecoveryPolicy;
import io.tether.event.DefaultChannelListener;
import io.tether.event.DefaultConnectionListener;
import io.tether.event.DefaultConsumerListener;
import io.tether.util.Duration;

@Test
public class ConnectionRecoveryTest extends AbstractRecoveryTest {
  public void shouldRecoverServerNamedQueueUnderNewName() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    String queue = channel.queueDeclare();
    channel.queueBind(queue, "amq.direct", "key");
    channel.basicConsume(queue, true, new RecordingConsumer());
    assertEquals(queue, "amq.gen-1");

    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
    assertEquals(channel.getState(), ChannelState.OPEN);
    assertEquals(channel.getCurrentQueueName(queue), "amq.gen-2");
    assertEquals(channel.getQueueNames(), Arrays.asList("amq.gen-2"));
    assertFalse(broker.hasQueue("amq.gen-1"));
    assertEquals(broker.getBindings("amq.gen-2"), Arrays.asList("amq.direct:key"));
    assertEquals(broker.getConsumerTags("amq.gen-2").size(), 1);
  }

  public void shouldReplayTopologyInOrder() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.exchangeDeclare("amq.direct", "direct", true, false, null);
    channel.exchangeDeclare("x", "direct");
    channel.queueDeclare("q1", true, false, false, null);
    channel.queueDeclare("q2", true, false, false, null);
    channel.queueBind("q2", "x", "k2");
    channel.queueBind("q1", "x", "k1");
    channel.basicConsume("q2", true, "c2", false, null, new RecordingConsumer());
    channel.basicConsume("q1", true, "c1", false, null, new RecordingConsumer());
    broker.clearCalls();

    dropAndAwaitRecovery();

    assertEquals(broker.getCalls(), Arrays.asList("connect", "exchangeDeclare x",
        "queueDeclare q1", "queueDeclare q2", "queueBind q1 x k1", "queueBind q2 x k2",
        "basicConsume q1 c1", "basicConsume q2 c2"));
  }

  public void shouldReplayDurableTopologyIdempotently() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.exchangeDeclare("events", "topic", true, false, null);
    channel.queueDeclare("audit", true, false, false, null);
    channel.queueBind("audit", "events", "#");

    dropAndAwaitRecovery();
    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
    assertEquals(broker.getBindings("audit"), Arrays.asList("events:#"));
    assertEquals(broker.getCalls("exchangeDeclare events").size(), 3);
  }

  public void shouldIsolateChannelFailures() throws Throwable {
    connect();
    RecoverableChannel a = connection.createChannel();
    RecoverableChannel b = connection.createChannel();
    a.queueDeclare("a", true, false, false, null);
    b.exchangeDeclare("bx", "direct");

    broker.setUnreachable(true);
    broker.dropConnections();
    broker.putExchange("bx", "fanout", true);
    broker.setUnreachable(false);
    recoveryWaiter.await(5000);

    assertEquals(connection.getRecoveryState(), RecoveryState.DEGRADED);
    assertEquals(a.getState(), ChannelState.OPEN);
    assertEquals(b.getState(), ChannelState.FAILED);
    assertEquals(connection.getChannels(), Arrays.asList(a));
    assertEquals(eventsStartingWith("channel.onRecoveryFailure").size(), 1);

    ChannelRecoveryException failure = (ChannelRecoveryException) channelFailures.get(0);
    assertEquals(failure.getStep(), RecoveryStep.EXCHANGES);
    assertEquals(failure.getEntityName(), "bx");
    assertEquals(failure.getBrokerException().getReplyCode(), ReplyCodes.PRECONDITION_FAILED);

    a.queueDeclare("a2", false, false, false, null);
    assertTrue(broker.hasQueue("a2"));
    try {
      b.queueDeclare("b2", false, false, false, null);
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  public void shouldReopenChannelsEmptyWhenTopologyRecoveryDisabled() throws Throwable {
    config.withTopologyRecovery(false);
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.exchangeDeclare("x", "direct");
    String queue = channel.queueDeclare();
    channel.queueBind(queue, "x", "key");
    channel.basicConsume(queue, true, new RecordingConsumer());
    assertTrue(handler(channel).registry.isEmpty());
    broker.clearCalls();

    dropAndAwaitRecovery();

    assertEquals(broker.getCalls(), Arrays.asList("connect"));
    assertEquals(channel.getState(), ChannelState.OPEN);
    assertTrue(channel.getQueueNames().isEmpty());
    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
  }

  public void shouldTreatLossAsTerminalWhenAutomaticRecoveryDisabled() throws Throwable {
    config.withAutomaticRecovery(false);
    connect();
    RecoverableChannel channel = connection.createChannel();

    broker.dropConnections();
    Thread.sleep(100);

    assertEquals(connection.getRecoveryState(), RecoveryState.LOST);
    assertEquals(connection.getState(), ConnectionState.FAILED);
    assertFalse(connection.isOpen());
    assertEquals(broker.getConnectAttempts(), 1);
    assertEquals(channel.getState(), ChannelState.CLOSED);
    assertTrue(events.contains("connection.onConnectionLost"));
    assertFalse(events.contains("connection.onRecoveryStarted"));
    try {
      connection.createChannel();
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  public void shouldNotFollowServerNamedQueueAcrossChannels() throws Throwable {
    connect();
    RecoverableChannel x = connection.createChannel();
    RecoverableChannel y = connection.createChannel();
    String queue = x.queueDeclare();
    y.queueBind(queue, "amq.direct", "key");

    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.DEGRADED);
    assertEquals(x.getState(), ChannelState.OPEN);
    assertEquals(x.getCurrentQueueName(queue), "amq.gen-2");
    assertEquals(y.getState(), ChannelState.FAILED);
    ChannelRecoveryException failure = (ChannelRecoveryException) channelFailures.get(0);
    assertEquals(failure.getStep(), RecoveryStep.BINDINGS);
    assertEquals(failure.getEntityName(), queue);
    assertEquals(failure.getBrokerException().getReplyCode(), ReplyCodes.NOT_FOUND);
  }

  public void shouldPresentIncreasingDeliveryTagsAcrossRecovery() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    RecordingConsumer consumer = new RecordingConsumer();
    channel.queueDeclare("q", false, false, false, null);
    channel.basicConsume("q", false, consumer);
    channel.basicPublish("", "q", null, "1".getBytes());
    channel.basicPublish("", "q", null, "2".getBytes());
    channel.basicAck(1, false);

    dropAndAwaitRecovery();

    channel.basicPublish("", "q", null, "3".getBytes());
    assertEquals(consumer.deliveryTags, Arrays.asList(1L, 2L, 3L));

    // A tag from the replaced channel is dropped, a current one is translated
    channel.basicAck(2, false);
    channel.basicAck(3, false);
    assertEquals(broker.getChannel(channel.getChannelNumber()).getAcks(), Arrays.asList(1L));
  }

  public void shouldRegenerateServerConsumerTags() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.queueDeclare("q", true, false, false, null);
    String generated = channel.basicConsume("q", true, new RecordingConsumer());
    String chosen = channel.basicConsume("q", true, "mine", false, null, new RecordingConsumer());
    assertEquals(generated, "amq.ctag-1");

    dropAndAwaitRecovery();

    assertEquals(broker.getConsumerTags("q"), Arrays.asList("amq.ctag-2", chosen));
    ChannelHandler handler = handler(channel);
    assertNull(handler.registry.getConsumer(generated));
    assertNotNull(handler.registry.getConsumer("amq.ctag-2"));

    channel.basicCancel("amq.ctag-2");
    assertEquals(broker.getConsumerTags("q"), Arrays.asList(chosen));
    assertNull(handler.registry.getConsumer("amq.ctag-2"));
  }

  public void shouldReapplyPrefetchCount() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.basicQos(10);

    dropAndAwaitRecovery();

    assertEquals(broker.getChannel(channel.getChannelNumber()).getPrefetchCount(), 10);
  }

  public void shouldAbandonRecoveryWhenPolicyExceeded() throws Throwable {
    config.withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.millis(20))
        .withMaxAttempts(2));
    connect();
    RecoverableChannel channel = connection.createChannel();

    broker.setUnreachable(true);
    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.LOST);
    assertEquals(connection.getState(), ConnectionState.FAILED);
    assertEquals(broker.getConnectAttempts(), 3);
    assertEquals(channel.getState(), ChannelState.CLOSED);
    ConnectionFailureException failure = (ConnectionFailureException) connectionFailure;
    assertEquals(failure.getPhase(), Phase.TRANSPORT_LOSS);
    assertEquals(failure.getReason(), Reason.UNREACHABLE);
  }

  public void shouldStopReconnectingWhenClosed() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    broker.setUnreachable(true);
    broker.dropConnections();
    Thread.sleep(100);

    connection.close();
    Thread.sleep(50);
    int attempts = broker.getConnectAttempts();
    Thread.sleep(100);

    assertEquals(broker.getConnectAttempts(), attempts);
    assertEquals(connection.getRecoveryState(), RecoveryState.CLOSED);
    assertEquals(connection.getState(), ConnectionState.CLOSED);
    assertEquals(channel.getState(), ChannelState.CLOSED);
  }

  public void shouldRecoverRepeatedly() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    String queue = channel.queueDeclare();

    dropAndAwaitRecovery();
    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
    assertEquals(channel.getCurrentQueueName(queue), "amq.gen-3");
    assertEquals(broker.getQueueNames(), Arrays.asList("amq.gen-3"));
  }

  public void shouldRecoverFromBrokerInitiatedClose() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.queueDeclare("q", false, false, false, null);

    broker.closeConnections(ReplyCodes.CONNECTION_FORCED);
    recoveryWaiter.await(5000);

    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
    assertEquals(channel.getState(), ChannelState.OPEN);
  }

  public void shouldBlockOperationsUntilRecovered() throws Throwable {
    connect();
    final RecoverableChannel channel = connection.createChannel();
    broker.setUnreachable(true);
    broker.dropConnections();

    final Waiter waiter = new Waiter();
    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          channel.queueDeclare("blocked", false, false, false, null);
          waiter.resume();
        } catch (Exception e) {
          waiter.fail(e);
        }
      }
    }).start();

    Thread.sleep(100);
    assertEquals(channel.getState(), ChannelState.RECOVERING);
    assertFalse(broker.hasQueue("blocked"));
    broker.setUnreachable(false);
    waiter.await(5000);
    assertTrue(broker.hasQueue("blocked"));
    assertEquals(channel.getQueueNames(), Arrays.asList("blocked"));
  }

  public void shouldNotifyListenersInOrder() throws Throwable {
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.queueDeclare("q", false, false, false, null);
    channel.basicConsume("q", true, new RecordingConsumer());

    dropAndAwaitRecovery();

    assertEquals(events, Arrays.asList("connection.onCreate", "channel.onCreate",
        "connection.onConnectionLost", "connection.onRecoveryStarted", "connection.onRecovery",
        "channel.onRecoveryStarted", "channel.onRecovery", "consumer.onRecoveryStarted",
        "consumer.onRecoveryCompleted", "channel.onRecoveryCompleted",
        "connection.onRecoveryCompleted"));
  }

  public void shouldNotRetryInitialConnect() throws Throwable {
    broker.setUnreachable(true);
    try {
      connect();
      fail();
    } catch (ConnectionFailureException e) {
      assertEquals(e.getPhase(), Phase.INITIAL_CONNECT);
      assertEquals(e.getReason(), Reason.UNREACHABLE);
    }

    Thread.sleep(100);
    assertEquals(broker.getConnectAttempts(), 1);
    assertEquals(events, Arrays.asList("connection.onCreateFailure"));
  }

  public void shouldRecoverWhenListenersThrow() throws Throwable {
    config.withConnectionListeners(new DefaultConnectionListener() {
      @Override
      public void onRecovery(RecoverableConnection connection) {
        throw new IllegalStateException("connection listener");
      }
    }, new RecordingConnectionListener()).withChannelListeners(new DefaultChannelListener() {
      @Override
      public void onRecoveryStarted(RecoverableChannel channel) {
        throw new IllegalStateException("channel listener");
      }
    }, new RecordingChannelListener()).withConsumerListeners(new DefaultConsumerListener() {
      @Override
      public void onRecoveryStarted(Consumer consumer, RecoverableChannel channel) {
        throw new IllegalStateException("consumer listener");
      }
    });
    connect();
    RecoverableChannel channel = connection.createChannel();
    channel.queueDeclare("q", false, false, false, null);
    channel.basicConsume("q", true, new RecordingConsumer());

    dropAndAwaitRecovery();

    assertEquals(connection.getRecoveryState(), RecoveryState.STABLE);
    assertEquals(channel.getState(), ChannelState.OPEN);
    assertEquals(eventsStartingWith("channel.onRecoveryCompleted").size(), 1);
  }
}
