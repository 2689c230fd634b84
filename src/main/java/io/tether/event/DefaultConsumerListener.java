package io.tether.event;

import io.tether.RecoverableChannel;

import com.rabbitmq.client.Consumer;

/**
 * No-op consumer listener for sub-classing.
 * 
 * @author Tether Authors
 */
public abstract class DefaultConsumerListener implements ConsumerListener {
  @Override
  public void onRecoveryStarted(Consumer consumer, RecoverableChannel channel) {
  }

  @Override
  public void onRecoveryCompleted(Consumer consumer, RecoverableChannel channel) {
  }

  @Override
  public void onRecoveryFailure(Consumer consumer, RecoverableChannel channel, Throwable failure) {
  }
}
