package io.tether.internal;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.jodah.concurrentunit.Waiter;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.tether.ConnectionFailureException;
import io.tether.ConnectionFailureException.Phase;
import io.tether.ConnectionFailureException.Reason;
import io.tether.ConnectionOptions;
import io.tether.ConnectionState;
import io.tether.config.Config;
import io.tether.config.RecoveryPolicy;
import io.tether.internal.SupervisorEvent.Type;
import io.tether.transport.Transport;
import io.tether.transport.TransportConnection;
import io.tether.util.Duration;

@Test
public class ConnectionSupervisorTest {
  FakeBroker broker;
  ExecutorService executor;
  Config config;
  ConnectionSupervisor supervisor;
  List<SupervisorEvent> events;
  Waiter waiter;

  @BeforeMethod
  protected void beforeMethod() {
    broker = new FakeBroker();
    executor = Executors.newCachedThreadPool();
    config = new Config().withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.millis(20)));
    events = Collections.synchronizedList(new ArrayList<SupervisorEvent>());
    waiter = new Waiter();
  }

  @AfterMethod
  protected void afterMethod() throws Exception {
    if (supervisor != null)
      supervisor.close();
    executor.shutdownNow();
  }

  public void shouldReconnectAfterFailedAttempts() throws Throwable {
    createSupervisor();
    supervisor.connect();
    broker.failConnects(3);
    broker.dropConnections();
    waiter.await(5000);

    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST, Type.RECONNECTING,
        Type.RECONNECT_FAILED, Type.RECONNECT_FAILED, Type.RECONNECT_FAILED, Type.CONNECTED));
    SupervisorEvent connected = events.get(events.size() - 1);
    assertEquals(connected.getAttempt(), 4);
    assertTrue(connected.isRecovery());
    assertTrue(connected.getConnection().isOpen());
    assertEquals(supervisor.getState(), ConnectionState.CONNECTED);
    assertEquals(broker.getConnectAttempts(), 5);
  }

  public void shouldNotRetryInitialConnect() throws Throwable {
    createSupervisor();
    broker.setUnreachable(true);
    try {
      supervisor.connect();
      fail();
    } catch (ConnectionFailureException e) {
      assertEquals(e.getPhase(), Phase.INITIAL_CONNECT);
      assertEquals(e.getReason(), Reason.UNREACHABLE);
      assertEquals(e.getAddress(), "amqp://localhost:5672/");
    }

    Thread.sleep(100);
    assertEquals(broker.getConnectAttempts(), 1);
    assertEquals(supervisor.getState(), ConnectionState.FAILED);
    assertTrue(events.isEmpty());
  }

  public void shouldNotReconnectWhenAutomaticRecoveryDisabled() throws Throwable {
    config.withAutomaticRecovery(false);
    createSupervisor();
    supervisor.connect();
    broker.dropConnections();
    Thread.sleep(100);

    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST));
    assertEquals(supervisor.getState(), ConnectionState.FAILED);
    assertEquals(broker.getConnectAttempts(), 1);
  }

  public void shouldAbandonWhenMaxAttemptsExceeded() throws Throwable {
    config.withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.millis(20))
        .withMaxAttempts(2));
    createSupervisor();
    supervisor.connect();
    broker.setUnreachable(true);
    broker.dropConnections();
    waiter.await(5000);

    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST, Type.RECONNECTING,
        Type.RECONNECT_FAILED, Type.RECONNECT_FAILED, Type.ABANDONED));
    ConnectionFailureException failure = (ConnectionFailureException) events.get(
        events.size() - 1).getFailure();
    assertEquals(failure.getPhase(), Phase.TRANSPORT_LOSS);
    assertEquals(failure.getReason(), Reason.UNREACHABLE);
    assertEquals(supervisor.getState(), ConnectionState.FAILED);
  }

  public void shouldAbandonWhenMaxDurationExceeded() throws Throwable {
    config.withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.millis(20))
        .withMaxDuration(Duration.millis(100)));
    createSupervisor();
    supervisor.connect();
    broker.setUnreachable(true);
    broker.dropConnections();
    waiter.await(5000);

    assertEquals(events.get(events.size() - 1).getType(), Type.ABANDONED);
  }

  public void shouldStopWaitingWhenClosed() throws Throwable {
    config.withRecoveryPolicy(new RecoveryPolicy().withInterval(Duration.mins(1)));
    createSupervisor();
    supervisor.connect();
    broker.dropConnections();
    Thread.sleep(50);

    long start = System.currentTimeMillis();
    supervisor.close();
    Thread.sleep(100);

    assertEquals(broker.getConnectAttempts(), 1);
    assertEquals(supervisor.getState(), ConnectionState.CLOSED);
    assertTrue(System.currentTimeMillis() - start < 1000);
    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST, Type.RECONNECTING));
  }

  public void shouldCloseConnectionOpenedWhileClosing() throws Throwable {
    supervisor = new ConnectionSupervisor(new Transport() {
      @Override
      public TransportConnection newConnection(ConnectionOptions options, String connectionName)
          throws IOException {
        TransportConnection connection = broker.newConnection(options, connectionName);
        if (broker.getConnectAttempts() > 1)
          supervisor.close();
        return connection;
      }
    }, new ConnectionOptions(), config, "sup", executor);
    supervisor.addListener(new SupervisorListener() {
      @Override
      public void onEvent(SupervisorEvent event) {
        events.add(event);
      }
    });
    supervisor.connect();
    broker.dropConnections();
    Thread.sleep(200);

    assertEquals(broker.getConnectAttempts(), 2);
    assertEquals(broker.getOpenConnectionCount(), 0);
    assertEquals(supervisor.getState(), ConnectionState.CLOSED);
    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST, Type.RECONNECTING));
  }

  public void shouldIgnoreApplicationClose() throws Throwable {
    createSupervisor();
    supervisor.connect().close();
    Thread.sleep(50);

    assertEquals(types(), Arrays.asList(Type.CONNECTED));
  }

  public void shouldDetectLossOfRecoveredConnection() throws Throwable {
    createSupervisor();
    supervisor.connect();
    broker.dropConnections();
    waiter.await(5000);
    broker.dropConnections();
    waiter.await(5000);

    assertEquals(types(), Arrays.asList(Type.CONNECTED, Type.LOST, Type.RECONNECTING,
        Type.CONNECTED, Type.LOST, Type.RECONNECTING, Type.CONNECTED));
    assertEquals(broker.getOpenConnectionCount(), 1);
  }

  private void createSupervisor() {
    supervisor = new ConnectionSupervisor(broker, new ConnectionOptions(), config, "sup",
        executor);
    supervisor.addListener(new SupervisorListener() {
      @Override
      public void onEvent(SupervisorEvent event) {
        events.add(event);
        if (event.getType() == Type.ABANDONED || event.getType() == Type.CONNECTED
            && event.isRecovery())
          waiter.resume();
      }
    });
  }

  private List<Type> types() {
    List<Type> types = new ArrayList<Type>();
    synchronized (events) {
      for (SupervisorEvent event : events)
        types.add(event.getType());
    }
    return types;
  }
}
