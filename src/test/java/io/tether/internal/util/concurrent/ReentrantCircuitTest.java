package io.tether.internal.util.concurrent;

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import net.jodah.concurrentunit.Waiter;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.tether.util.Duration;

@Test
public class ReentrantCircuitTest {
  ReentrantCircuit circuit;

  @BeforeMethod
  protected void beforeMethod() {
    circuit = new ReentrantCircuit();
  }

  public void shouldInitiallyBeClosed() {
    assertTrue(circuit.isClosed());
  }

  public void shouldHandleOpenCloseCycles() {
    for (int i = 0; i < 3; i++) {
      circuit.open();
      circuit.close();
    }

    assertTrue(circuit.isClosed());
  }

  public void shouldHandleRepeatedOpens() {
    for (int i = 0; i < 3; i++)
      circuit.open();

    assertFalse(circuit.isClosed());
  }

  public void shouldReturnWhenAwaitAndAlreadyClosed() throws Throwable {
    long t = System.currentTimeMillis();
    circuit.await();
    assertTrue(circuit.await(Duration.mins(3)));
    assertTrue(circuit.await(Duration.inf()));

    // Awaits should return immediately
    assertTrue(System.currentTimeMillis() - t < 500);
  }

  public void shouldTimeOutWhileOpen() throws Throwable {
    circuit.open();
    long t = System.currentTimeMillis();
    assertFalse(circuit.await(Duration.millis(100)));
    assertTrue(System.currentTimeMillis() - t >= 90);
  }

  public void shouldReleaseTimedWaiterWhenClosed() throws Throwable {
    circuit.open();
    final Waiter waiter = new Waiter();
    new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          waiter.assertTrue(circuit.await(Duration.mins(1)));
          waiter.resume();
        } catch (InterruptedException e) {
          waiter.fail(e);
        }
      }
    }).start();

    Thread.sleep(200);
    circuit.close();
    waiter.await(1000);
  }

  public void shouldHandleConcurrentWaiters() throws Throwable {
    circuit.open();

    final Waiter waiter = new Waiter();
    for (int i = 0; i < 3; i++)
      new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            circuit.await();
            waiter.resume();
          } catch (InterruptedException e) {
            waiter.fail(e);
          }
        }
      }).start();

    Thread.sleep(300);
    circuit.close();
    waiter.await(1000, 3);
  }

  public void shouldAbortAwaitWhenInterrupted() throws Throwable {
    circuit.open();

    final Waiter waiter = new Waiter();
    Thread thread = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          circuit.await();
          waiter.fail("Expected interruption");
        } catch (InterruptedException e) {
          waiter.resume();
        }
      }
    });
    thread.start();

    Thread.sleep(100);
    thread.interrupt();
    waiter.await(1000);
    assertFalse(circuit.isClosed());
  }
}
