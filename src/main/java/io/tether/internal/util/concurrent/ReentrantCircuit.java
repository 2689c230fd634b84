package io.tether.internal.util.concurrent;

import java.util.concurrent.locks.AbstractQueuedSynchronizer;

import io.tether.util.Duration;

/**
 * A circuit that accepts re-entrant {@link #open()} and {@link #close()} calls. While the circuit
 * is open, threads calling {@link #await()} block until it is closed or they are interrupted.
 * 
 * <p>
 * Circuits start out closed.
 * 
 * @author Tether Authors
 */
public class ReentrantCircuit {
  private final Sync sync = new Sync();

  /**
   * Synchronization state of 0 = closed, 1 = open.
   */
  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = -1283476581927456019L;

    @Override
    protected int tryAcquireShared(int ignored) {
      return isClosed() ? 1 : -1;
    }

    @Override
    protected boolean tryReleaseShared(int ignored) {
      setState(0);
      return true;
    }

    boolean isClosed() {
      return getState() == 0;
    }

    void open() {
      compareAndSetState(0, 1);
    }
  }

  /**
   * Waits until the circuit is closed, aborting if interrupted.
   */
  public void await() throws InterruptedException {
    sync.acquireSharedInterruptibly(0);
  }

  /**
   * Waits up to {@code waitDuration} for the circuit to be closed, aborting if interrupted.
   * 
   * @return true if the circuit was closed within the wait duration, else false
   */
  public boolean await(Duration waitDuration) throws InterruptedException {
    if (!waitDuration.finite) {
      await();
      return true;
    }
    return sync.tryAcquireSharedNanos(0, waitDuration.toNanos());
  }

  /**
   * Closes the circuit, releasing any waiting threads.
   */
  public void close() {
    sync.releaseShared(1);
  }

  public boolean isClosed() {
    return sync.isClosed();
  }

  /**
   * Opens the circuit.
   */
  public void open() {
    sync.open();
  }

  @Override
  public String toString() {
    return isClosed() ? "closed" : "open";
  }
}
