package io.tether.internal;

import io.tether.transport.TransportConnection;

/**
 * An event in the lifecycle of a supervised physical connection.
 * 
 * @author Tether Authors
 */
public final class SupervisorEvent {
  public enum Type {
    /** A connection was established, initially or by a reconnect. */
    CONNECTED,
    /** The connection was closed by something other than the application. */
    LOST,
    /** Reconnect attempts are starting. */
    RECONNECTING,
    /** A reconnect attempt failed. Another attempt follows unless recovery is abandoned. */
    RECONNECT_FAILED,
    /** The connection and its channels finished recovering. */
    RECOVERED,
    /** Reconnect attempts were exhausted. Terminal. */
    ABANDONED
  }

  private final Type type;
  private final int attempt;
  private final Throwable failure;
  private final TransportConnection connection;
  private final boolean recovery;

  private SupervisorEvent(Type type, int attempt, Throwable failure,
      TransportConnection connection, boolean recovery) {
    this.type = type;
    this.attempt = attempt;
    this.failure = failure;
    this.connection = connection;
    this.recovery = recovery;
  }

  static SupervisorEvent connected(TransportConnection connection, int attempt, boolean recovery) {
    return new SupervisorEvent(Type.CONNECTED, attempt, null, connection, recovery);
  }

  static SupervisorEvent of(Type type, int attempt, Throwable failure) {
    return new SupervisorEvent(type, attempt, failure, null, false);
  }

  /**
   * Returns the reconnect attempt the event relates to, else 0.
   */
  public int getAttempt() {
    return attempt;
  }

  /**
   * Returns the established connection for {@link Type#CONNECTED} events, else null.
   */
  public TransportConnection getConnection() {
    return connection;
  }

  /**
   * Returns the failure for {@link Type#LOST}, {@link Type#RECONNECT_FAILED} and
   * {@link Type#ABANDONED} events, else null.
   */
  public Throwable getFailure() {
    return failure;
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns whether a {@link Type#CONNECTED} event resulted from a reconnect.
   */
  public boolean isRecovery() {
    return recovery;
  }

  @Override
  public String toString() {
    return type + (attempt > 0 ? " #" + attempt : "");
  }
}
