package io.tether.event;

import io.tether.RecoverableChannel;

import com.rabbitmq.client.Consumer;

/**
 * Listens for {@link Consumer} related events.
 * 
 * @author Tether Authors
 */
public interface ConsumerListener {
  /**
   * Called when recovery of the {@code consumer} on the {@code channel} is started.
   */
  void onRecoveryStarted(Consumer consumer, RecoverableChannel channel);

  /**
   * Called when recovery of the {@code consumer} on the {@code channel} is successfully
   * completed.
   */
  void onRecoveryCompleted(Consumer consumer, RecoverableChannel channel);

  /**
   * Called when the {@code consumer} fails to recover on the {@code channel}.
   */
  void onRecoveryFailure(Consumer consumer, RecoverableChannel channel, Throwable failure);
}
