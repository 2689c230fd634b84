package io.tether;

import java.io.IOException;

/**
 * Failure to replay a channel's topology during recovery. Recovery of the channel is abandoned
 * while other channels on the same connection continue to recover.
 * 
 * @author Tether Authors
 */
public class ChannelRecoveryException extends IOException {
  private static final long serialVersionUID = 7613360183570329514L;

  private final String channel;
  private final RecoveryStep step;
  private final String entityName;

  public ChannelRecoveryException(String channel, RecoveryStep step, String entityName,
      IOException cause) {
    super(String.format("Failed to recover %s at %s%s", channel, step,
        entityName == null ? "" : " for '" + entityName + "'"), cause);
    this.channel = channel;
    this.step = step;
    this.entityName = entityName;
  }

  /**
   * Returns a description of the channel whose recovery failed.
   */
  public String getChannel() {
    return channel;
  }

  public RecoveryStep getStep() {
    return step;
  }

  /**
   * Returns the name of the entity being replayed when recovery failed, else null.
   */
  public String getEntityName() {
    return entityName;
  }

  /**
   * Returns the broker failure that aborted the recovery, else null if the failure did not come
   * from the broker.
   */
  public BrokerException getBrokerException() {
    return getCause() instanceof BrokerException ? (BrokerException) getCause() : null;
  }
}
