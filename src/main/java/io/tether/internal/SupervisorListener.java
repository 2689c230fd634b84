package io.tether.internal;

/**
 * Receives the event stream of a {@link ConnectionSupervisor}. Events are delivered on the
 * thread that produced them.
 * 
 * @author Tether Authors
 */
public interface SupervisorListener {
  void onEvent(SupervisorEvent event);
}
