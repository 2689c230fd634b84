package io.tether.internal;

import io.tether.config.RecoveryPolicy;
import io.tether.util.Duration;

/**
 * Tracks the attempts made under a {@link RecoveryPolicy} during one recovery.
 * 
 * @author Tether Authors
 */
final class RecoveryStats {
  private final int maxAttempts;
  private final long maxDuration;
  private final long interval;
  private final long startTime;
  private int attemptCount;

  RecoveryStats(RecoveryPolicy recoveryPolicy) {
    maxAttempts = recoveryPolicy.getMaxAttempts();
    interval = recoveryPolicy.getInterval().toNanos();
    maxDuration = recoveryPolicy.getMaxDuration() == null ? -1 : recoveryPolicy.getMaxDuration()
        .toNanos();
    startTime = System.nanoTime();
  }

  int getAttemptCount() {
    return attemptCount;
  }

  /**
   * Returns the amount of time to wait before the next attempt, never exceeding the time left
   * under the policy's max duration.
   */
  Duration getWaitTime() {
    if (maxDuration == -1)
      return Duration.nanos(interval);
    long remaining = maxDuration - (System.nanoTime() - startTime);
    return Duration.nanos(Math.max(0, Math.min(interval, remaining)));
  }

  /**
   * Records an attempt, returning the attempt number.
   */
  int incrementAttempts() {
    return ++attemptCount;
  }

  /**
   * Returns true if the max attempts or max duration for the policy have been exceeded else
   * false.
   */
  boolean isPolicyExceeded() {
    boolean withinMaxAttempts = maxAttempts == -1 || attemptCount < maxAttempts;
    boolean withinMaxDuration = maxDuration == -1 || System.nanoTime() - startTime < maxDuration;
    return !withinMaxAttempts || !withinMaxDuration;
  }
}
