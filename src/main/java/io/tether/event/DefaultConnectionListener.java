package io.tether.event;

import io.tether.RecoverableConnection;

/**
 * No-op connection listener for sub-classing.
 * 
 * @author Tether Authors
 */
public abstract class DefaultConnectionListener implements ConnectionListener {
  @Override
  public void onCreate(RecoverableConnection connection) {
  }

  @Override
  public void onCreateFailure(Throwable failure) {
  }

  @Override
  public void onConnectionLost(RecoverableConnection connection, Throwable cause) {
  }

  @Override
  public void onRecovery(RecoverableConnection connection) {
  }

  @Override
  public void onRecoveryCompleted(RecoverableConnection connection) {
  }

  @Override
  public void onRecoveryFailure(RecoverableConnection connection, Throwable failure) {
  }

  @Override
  public void onRecoveryStarted(RecoverableConnection connection) {
  }
}
