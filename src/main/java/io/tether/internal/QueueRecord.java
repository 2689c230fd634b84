package io.tether.internal;

import java.util.Map;

/**
 * A recorded queue declaration. The name of a server-named queue is reassigned by the broker
 * each time the queue is re-declared, and only the {@link RenamePropagator} changes it.
 * 
 * @author Tether Authors
 */
public final class QueueRecord {
  private final String originalName;
  private final boolean serverNamed;
  private final boolean durable;
  private final boolean exclusive;
  private final boolean autoDelete;
  private final Map<String, Object> arguments;
  private volatile String name;

  QueueRecord(String name, boolean serverNamed, boolean durable, boolean exclusive,
      boolean autoDelete, Map<String, Object> arguments) {
    this.originalName = name;
    this.name = name;
    this.serverNamed = serverNamed;
    this.durable = durable;
    this.exclusive = exclusive;
    this.autoDelete = autoDelete;
    this.arguments = ExchangeRecord.copy(arguments);
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  /**
   * Returns the queue's current name.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the name the queue had when it was first declared.
   */
  public String getOriginalName() {
    return originalName;
  }

  public boolean isAutoDelete() {
    return autoDelete;
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  /**
   * Returns whether the broker assigned the queue's name.
   */
  public boolean isServerNamed() {
    return serverNamed;
  }

  /**
   * Returns the name to request when re-declaring the queue.
   */
  String getDeclaredName() {
    return serverNamed ? "" : name;
  }

  void setName(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return "QueueRecord [name=" + name + (serverNamed ? ", server-named" : "") + "]";
  }
}
