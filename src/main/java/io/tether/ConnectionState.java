package io.tether;

/**
 * State of a physical connection.
 * 
 * @author Tether Authors
 */
public enum ConnectionState {
  CONNECTED, RECOVERING,
  /** Lost and not recovered. */
  FAILED, CLOSED
}
