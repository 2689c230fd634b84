package io.tether;

/**
 * The ordered steps of replaying a channel's topology after a reconnect.
 * 
 * @author Tether Authors
 */
public enum RecoveryStep {
  /** Re-open the channel on the new connection and migrate its settings. */
  OPEN_CHANNEL,
  /** Re-declare exchanges, skipping predefined ones. */
  EXCHANGES,
  /** Re-declare queues in declaration order, renaming server-named queues. */
  QUEUES,
  /** Re-bind queues to exchanges. */
  BINDINGS,
  /** Re-register consumers. */
  CONSUMERS
}
