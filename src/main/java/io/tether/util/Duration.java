package io.tether.util;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.tether.internal.util.Assert;

/**
 * Duration unit, consisting of length and time unit.
 * 
 * @author Tether Authors
 */
public class Duration implements Serializable {
  private static final long serialVersionUID = 3715406512938624001L;
  /** A duration of Long.MAX_VALUE Days */
  public static final Duration INFINITE = new Duration();
  private static final Pattern PATTERN = Pattern.compile("(\\d+)\\s*(" + "ns|nanosecond(s)?|"
      + "us|microsecond(s)?|" + "ms|millisecond(s)?|" + "s|second(s)?|" + "m|minute(s)?|"
      + "h|hour(s)?|" + "d|day(s)?" + ')');
  private static final Map<String, TimeUnit> SUFFIXES = new HashMap<String, TimeUnit>();

  public final long length;
  public final TimeUnit timeUnit;
  public final boolean finite;

  static {
    suffixes(TimeUnit.NANOSECONDS, "ns", "nanosecond");
    suffixes(TimeUnit.MICROSECONDS, "us", "microsecond");
    suffixes(TimeUnit.MILLISECONDS, "ms", "millisecond");
    suffixes(TimeUnit.SECONDS, "s", "second");
    suffixes(TimeUnit.MINUTES, "m", "minute");
    suffixes(TimeUnit.HOURS, "h", "hour");
    suffixes(TimeUnit.DAYS, "d", "day");
  }

  /** Infinite constructor. */
  private Duration() {
    finite = false;
    this.length = Long.MAX_VALUE;
    this.timeUnit = TimeUnit.DAYS;
  }

  private Duration(long length, TimeUnit timeUnit) {
    Assert.isTrue(length >= 0, "The length must be non-negative: %s", length);
    this.length = length;
    this.timeUnit = Assert.notNull(timeUnit, "timeUnit");
    finite = !(length == Long.MAX_VALUE && TimeUnit.DAYS.equals(timeUnit));
  }

  private static void suffixes(TimeUnit unit, String abbreviation, String singular) {
    SUFFIXES.put(abbreviation, unit);
    SUFFIXES.put(singular, unit);
    SUFFIXES.put(singular + 's', unit);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if ((obj == null) || (getClass() != obj.getClass()))
      return false;
    final Duration duration = (Duration) obj;
    return (length == duration.length) && (timeUnit == duration.timeUnit);
  }

  @Override
  public int hashCode() {
    return (31 * (int) (length ^ (length >>> 32))) + timeUnit.hashCode();
  }

  public long toMillis() {
    return TimeUnit.MILLISECONDS.convert(length, timeUnit);
  }

  public long toNanos() {
    return TimeUnit.NANOSECONDS.convert(length, timeUnit);
  }

  public long toSeconds() {
    return TimeUnit.SECONDS.convert(length, timeUnit);
  }

  @Override
  public String toString() {
    if (!finite)
      return "infinite";
    String units = timeUnit.toString().toLowerCase(Locale.ENGLISH);
    if (length == 1)
      units = units.substring(0, units.length() - 1);
    return Long.toString(length) + ' ' + units;
  }

  /**
   * Returns an infinite duration of Long.MAX_VALUE days.
   */
  public static Duration inf() {
    return INFINITE;
  }

  /**
   * Returns a Duration of {@code count} milliseconds.
   */
  public static Duration millis(long count) {
    return new Duration(count, TimeUnit.MILLISECONDS);
  }

  /**
   * Returns a Duration of {@code count} minutes.
   */
  public static Duration mins(long count) {
    return new Duration(count, TimeUnit.MINUTES);
  }

  /**
   * Returns a Duration of {@code count} nanoseconds.
   */
  public static Duration nanos(long count) {
    return new Duration(count, TimeUnit.NANOSECONDS);
  }

  /**
   * Returns a Duration of {@code count} {@code unit}s.
   */
  public static Duration of(long count, TimeUnit unit) {
    return new Duration(count, unit);
  }

  /**
   * Returns a Duration from the parsed {@code duration}. Example:
   * 
   * <pre>
   * 5s
   * 500 ms
   * 10 minutes
   * inf
   * </pre>
   * 
   * @throws IllegalArgumentException if {@code duration} is not a valid duration
   */
  public static Duration of(String duration) {
    Assert.notNull(duration, "duration");
    String trimmed = duration.trim();
    if ("inf".equals(trimmed) || "infinite".equals(trimmed))
      return INFINITE;
    Matcher matcher = PATTERN.matcher(trimmed);
    Assert.isTrue(matcher.matches(), "Invalid duration: %s", duration);
    return new Duration(Long.parseLong(matcher.group(1)), SUFFIXES.get(matcher.group(2)));
  }

  /**
   * Returns a Duration of {@code count} seconds.
   */
  public static Duration seconds(long count) {
    return new Duration(count, TimeUnit.SECONDS);
  }
}
