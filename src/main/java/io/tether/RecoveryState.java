package io.tether;

/**
 * State of a connection's recovery.
 * 
 * <pre>
 * IDLE -> CONNECTION_LOST -> RECONNECTING -> CHANNELS_RECOVERING -> STABLE | DEGRADED
 * </pre>
 * 
 * With topology recovery disabled, {@code RECONNECTING} moves straight to {@code STABLE}. With
 * automatic recovery disabled, {@code CONNECTION_LOST} moves straight to {@code LOST}.
 * 
 * @author Tether Authors
 */
public enum RecoveryState {
  /** Connected, no recovery has taken place yet. */
  IDLE,
  /** The transport was lost. */
  CONNECTION_LOST,
  /** Reconnect attempts are being made. */
  RECONNECTING,
  /** Connected again, channels are being re-opened and their topology replayed. */
  CHANNELS_RECOVERING,
  /** Every channel recovered. */
  STABLE,
  /** At least one channel failed to recover. Channels that did recover remain usable. */
  DEGRADED,
  /** The connection was lost and will not be recovered. Terminal. */
  LOST,
  /** The application closed the connection. Terminal. */
  CLOSED;

  /**
   * Returns whether no further transitions can occur.
   */
  public boolean isTerminal() {
    return this == LOST || this == CLOSED;
  }
}
