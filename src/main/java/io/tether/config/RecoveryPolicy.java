package io.tether.config;

import io.tether.internal.util.Assert;
import io.tether.util.Duration;

/**
 * Policy that defines how connection recovery is attempted. Attempts are made against the same
 * endpoint on a fixed interval. There is no backoff: the failures that outlast a few attempts,
 * such as a misconfigured endpoint or a sustained outage, are not fixed by waiting longer.
 * 
 * @author Tether Authors
 */
public class RecoveryPolicy {
  /** The interval used when none is configured. */
  public static final Duration DEFAULT_INTERVAL = Duration.seconds(5);

  private int maxAttempts;
  private Duration maxDuration;
  private Duration interval;

  /**
   * Creates a recovery policy that always attempts, every {@link #DEFAULT_INTERVAL}.
   */
  public RecoveryPolicy() {
    maxAttempts = -1;
    interval = DEFAULT_INTERVAL;
  }

  /**
   * Returns whether the policy allows any attempts based on the configured maxAttempts and
   * maxDuration.
   */
  public boolean allowsAttempts() {
    return (maxAttempts == -1 || maxAttempts > 0)
        && (maxDuration == null || maxDuration.length > 0);
  }

  /**
   * Returns the interval to wait before each attempt.
   * 
   * @see #withInterval(Duration)
   */
  public Duration getInterval() {
    return interval;
  }

  /**
   * Returns the max attempts, -1 meaning unlimited.
   * 
   * @see #withMaxAttempts(int)
   */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the max duration to perform attempts for, else null if unbounded.
   * 
   * @see #withMaxDuration(Duration)
   */
  public Duration getMaxDuration() {
    return maxDuration;
  }

  /**
   * Sets the {@code interval} to wait before each attempt.
   * 
   * @throws NullPointerException if {@code interval} is null
   * @throws IllegalArgumentException if {@code interval} is not finite
   */
  public RecoveryPolicy withInterval(Duration interval) {
    Assert.notNull(interval, "interval");
    Assert.isTrue(interval.finite, "The interval must be finite");
    this.interval = interval;
    return this;
  }

  /**
   * Sets the max number of attempts to perform. -1 indicates to always attempt.
   * 
   * @throws IllegalArgumentException if {@code maxAttempts} is < -1
   */
  public RecoveryPolicy withMaxAttempts(int maxAttempts) {
    Assert.isTrue(maxAttempts >= -1, "The maxAttempts must be >= -1");
    this.maxAttempts = maxAttempts;
    return this;
  }

  /**
   * Sets the max duration to perform attempts for.
   * 
   * @throws NullPointerException if {@code maxDuration} is null
   */
  public RecoveryPolicy withMaxDuration(Duration maxDuration) {
    this.maxDuration = Assert.notNull(maxDuration, "maxDuration");
    return this;
  }

  @Override
  public String toString() {
    return "RecoveryPolicy [interval=" + interval + ", maxAttempts=" + maxAttempts
        + ", maxDuration=" + maxDuration + "]";
  }
}
