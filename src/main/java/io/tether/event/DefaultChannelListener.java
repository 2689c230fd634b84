package io.tether.event;

import io.tether.BrokerException;
import io.tether.RecoverableChannel;

/**
 * No-op channel listener for sub-classing.
 * 
 * @author Tether Authors
 */
public abstract class DefaultChannelListener implements ChannelListener {
  @Override
  public void onChannelException(RecoverableChannel channel, BrokerException failure) {
  }

  @Override
  public void onCreate(RecoverableChannel channel) {
  }

  @Override
  public void onCreateFailure(Throwable failure) {
  }

  @Override
  public void onRecovery(RecoverableChannel channel) {
  }

  @Override
  public void onRecoveryCompleted(RecoverableChannel channel) {
  }

  @Override
  public void onRecoveryFailure(RecoverableChannel channel, Throwable failure) {
  }

  @Override
  public void onRecoveryStarted(RecoverableChannel channel) {
  }
}
