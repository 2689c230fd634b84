package io.tether;

import java.io.IOException;

import io.tether.internal.util.Assert;

/**
 * Failure to establish a physical connection. The {@link Phase} tells an initial connection
 * failure, which is never retried, from a failure to re-establish a lost connection. The
 * {@link Reason} lets callers tell a misconfigured endpoint from a transient network problem.
 * 
 * @author Tether Authors
 */
public class ConnectionFailureException extends IOException {
  private static final long serialVersionUID = -4431370934512781926L;

  public enum Phase {
    /** The first connection attempt made by {@link Connections#create}. */
    INITIAL_CONNECT,
    /** An established connection was lost and could not be re-established. */
    TRANSPORT_LOSS
  }

  public enum Reason {
    /** Nothing accepted the connection at the endpoint. */
    UNREACHABLE,
    /** The endpoint's host name could not be resolved. */
    UNRESOLVABLE,
    /** The broker rejected the credentials. */
    AUTHENTICATION,
    /** The connection attempt timed out. */
    TIMEOUT,
    /** Any other I/O failure. */
    IO
  }

  private final Phase phase;
  private final Reason reason;
  private final String address;

  public ConnectionFailureException(Phase phase, Reason reason, String address, Throwable cause) {
    super(String.format("%s failure (%s) for %s",
        phase == Phase.INITIAL_CONNECT ? "Connection" : "Reconnection", reason, address), cause);
    this.phase = Assert.notNull(phase, "phase");
    this.reason = Assert.notNull(reason, "reason");
    this.address = address;
  }

  /**
   * Returns the endpoint the connection was attempted to.
   */
  public String getAddress() {
    return address;
  }

  public Phase getPhase() {
    return phase;
  }

  public Reason getReason() {
    return reason;
  }
}
