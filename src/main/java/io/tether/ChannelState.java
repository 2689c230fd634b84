package io.tether;

/**
 * State of a channel.
 * 
 * @author Tether Authors
 */
public enum ChannelState {
  OPEN, RECOVERING,
  /** Recovery failed. The channel is discarded and never reused. */
  FAILED,
  /** Closed by the application, by a channel-level error, or with its connection. */
  CLOSED
}
