package io.tether.config;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import org.testng.annotations.Test;

import io.tether.util.Duration;

@Test
public class RecoveryPolicyTest {
  public void shouldDefaultToFiveSecondIntervalWithoutAttemptCap() {
    RecoveryPolicy policy = RecoveryPolicies.recoverAlways();
    assertEquals(policy.getInterval(), Duration.seconds(5));
    assertEquals(policy.getMaxAttempts(), -1);
    assertNull(policy.getMaxDuration());
    assertTrue(policy.allowsAttempts());
  }

  public void shouldNotAllowAttempts() {
    assertFalse(RecoveryPolicies.recoverNever().allowsAttempts());
    assertFalse(new RecoveryPolicy().withMaxDuration(Duration.millis(0)).allowsAttempts());
  }

  public void shouldAllowAttempts() {
    assertTrue(new RecoveryPolicy().withMaxAttempts(1).allowsAttempts());
    assertTrue(new RecoveryPolicy().withMaxDuration(Duration.millis(10)).allowsAttempts());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectInfiniteInterval() {
    new RecoveryPolicy().withInterval(Duration.inf());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectInvalidMaxAttempts() {
    new RecoveryPolicy().withMaxAttempts(-2);
  }
}
