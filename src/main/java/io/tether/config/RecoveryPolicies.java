package io.tether.config;

/**
 * Factory methods for recovery policies.
 * 
 * @author Tether Authors
 */
public final class RecoveryPolicies {
  private RecoveryPolicies() {
  }

  /**
   * Returns a RecoveryPolicy that never recovers.
   */
  public static RecoveryPolicy recoverNever() {
    return new RecoveryPolicy().withMaxAttempts(0);
  }

  /**
   * Returns a RecoveryPolicy that always recovers, attempting every
   * {@link RecoveryPolicy#DEFAULT_INTERVAL}.
   */
  public static RecoveryPolicy recoverAlways() {
    return new RecoveryPolicy().withMaxAttempts(-1);
  }
}
