package io.tether.util;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.fail;

import java.util.concurrent.TimeUnit;

import org.testng.annotations.Test;

@Test
public class DurationTest {
  public void testValidDurationStrings() {
    assertEquals(Duration.of("5ns"), Duration.nanos(5));
    assertEquals(Duration.of("5microsecond"), Duration.of(5, TimeUnit.MICROSECONDS));
    assertEquals(Duration.of("5milliseconds"), Duration.millis(5));
    assertEquals(Duration.of("500 ms"), Duration.millis(500));
    assertEquals(Duration.of("5 seconds"), Duration.seconds(5));
    assertEquals(Duration.of(" 5s "), Duration.seconds(5));
    assertEquals(Duration.of("5 minutes"), Duration.mins(5));
    assertEquals(Duration.of("5 hours"), Duration.of(5, TimeUnit.HOURS));
    assertEquals(Duration.of("5 days"), Duration.of(5, TimeUnit.DAYS));
    assertEquals(Duration.of("inf"), Duration.inf());
    assertEquals(Duration.of("infinite"), Duration.inf());

    // Interesting value but legal nevertheless
    assertEquals(Duration.of("0s"), Duration.seconds(0));
  }

  private void testInvalidDurationString(String duration) {
    try {
      Duration.of(duration);
      fail("Duration string '" + duration + "' should not parse correctly.");
    } catch (IllegalArgumentException expected) {
    }
  }

  public void testInvalidDurationStrings() {
    testInvalidDurationString("foobar");
    testInvalidDurationString("ms3");
    testInvalidDurationString("34 lightyears");
    testInvalidDurationString("34 seconds a day");
    testInvalidDurationString("5 days a week");
    testInvalidDurationString("");
    testInvalidDurationString("2");
    testInvalidDurationString("ns");
    testInvalidDurationString("-5s");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectNegativeLengths() {
    Duration.millis(-1);
  }

  public void shouldConvertBetweenUnits() {
    assertEquals(Duration.seconds(5).toMillis(), 5000);
    assertEquals(Duration.millis(1500).toSeconds(), 1);
    assertEquals(Duration.millis(2).toNanos(), 2000000);
    assertFalse(Duration.inf().finite);
    assertEquals(Duration.seconds(1).toString(), "1 second");
    assertEquals(Duration.inf().toString(), "infinite");
  }
}
