package io.tether.internal;

import java.util.Collections;
import java.util.Map;

/**
 * The outcome of a successful channel replay.
 * 
 * @author Tether Authors
 */
public final class RecoveredChannel {
  private final ChannelHandler channel;
  private final int previousChannelNumber;
  private final int channelNumber;
  private final int exchanges;
  private final int queues;
  private final int bindings;
  private final int consumers;
  private final Map<String, String> renamedQueues;
  private final Map<String, String> retaggedConsumers;

  RecoveredChannel(ChannelHandler channel, int previousChannelNumber, int channelNumber,
      int exchanges, int queues, int bindings, int consumers, Map<String, String> renamedQueues,
      Map<String, String> retaggedConsumers) {
    this.channel = channel;
    this.previousChannelNumber = previousChannelNumber;
    this.channelNumber = channelNumber;
    this.exchanges = exchanges;
    this.queues = queues;
    this.bindings = bindings;
    this.consumers = consumers;
    this.renamedQueues = Collections.unmodifiableMap(renamedQueues);
    this.retaggedConsumers = Collections.unmodifiableMap(retaggedConsumers);
  }

  public ChannelHandler getChannel() {
    return channel;
  }

  public int getChannelNumber() {
    return channelNumber;
  }

  public int getPreviousChannelNumber() {
    return previousChannelNumber;
  }

  /** Returns the number of exchanges redeclared. Predefined exchanges are not counted. */
  public int getExchangeCount() {
    return exchanges;
  }

  public int getQueueCount() {
    return queues;
  }

  public int getBindingCount() {
    return bindings;
  }

  public int getConsumerCount() {
    return consumers;
  }

  /**
   * Returns the old to new names of the server-named queues that were renamed by the broker.
   */
  public Map<String, String> getRenamedQueues() {
    return renamedQueues;
  }

  /**
   * Returns the old to new tags of the consumers that received a broker generated tag.
   */
  public Map<String, String> getRetaggedConsumers() {
    return retaggedConsumers;
  }

  @Override
  public String toString() {
    return String.format(
        "channel-%s (was channel-%s) with %s exchanges, %s queues, %s bindings, %s consumers",
        channelNumber, previousChannelNumber, exchanges, queues, bindings, consumers);
  }
}
