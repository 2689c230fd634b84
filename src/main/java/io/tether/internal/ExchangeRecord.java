package io.tether.internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A recorded exchange declaration.
 * 
 * @author Tether Authors
 */
public final class ExchangeRecord {
  private final String name;
  private final String type;
  private final boolean durable;
  private final boolean autoDelete;
  private final Map<String, Object> arguments;

  ExchangeRecord(String name, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) {
    this.name = name;
    this.type = type;
    this.durable = durable;
    this.autoDelete = autoDelete;
    this.arguments = copy(arguments);
  }

  /**
   * Returns whether {@code exchange} names an exchange the broker always provides: the default
   * exchange and the {@code amq.*} exchanges.
   */
  public static boolean isPredefined(String exchange) {
    return exchange.isEmpty() || exchange.startsWith("amq.");
  }

  static Map<String, Object> copy(Map<String, Object> arguments) {
    return arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(
        arguments));
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public boolean isAutoDelete() {
    return autoDelete;
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean isPredefined() {
    return isPredefined(name);
  }

  @Override
  public String toString() {
    return "ExchangeRecord [name=" + name + ", type=" + type + "]";
  }
}
