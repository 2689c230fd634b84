package io.tether;

import java.io.IOException;
import java.util.Locale;

import io.tether.internal.util.Assert;

/**
 * A failure reported by the broker or detected on the transport. Rather than a hierarchy of
 * exception types, the failure carries an explicit {@link Severity}: {@link Severity#SOFT soft}
 * failures close only the channel they occurred on, while {@link Severity#HARD hard} failures
 * invalidate the entire connection.
 * 
 * @author Tether Authors
 */
public class BrokerException extends IOException {
  private static final long serialVersionUID = 5203617140939925287L;

  /** Whether the failure affects a single channel or the whole connection. */
  public enum Severity {
    /** Channel-level. The connection and its other channels remain usable. */
    SOFT,
    /** Connection-level. The connection must be re-established. */
    HARD
  }

  /** Who initiated the closure that carried the failure. */
  public enum Initiator {
    APPLICATION, BROKER,
    /** The network or the client library detected the failure, e.g. a reset socket. */
    TRANSPORT
  }

  /** Reply code used when the transport failed without a protocol close. */
  public static final int NO_REPLY_CODE = 0;

  private final Severity severity;
  private final int replyCode;
  private final String replyText;
  private final Initiator initiator;
  private final String connectionName;
  private final int channelNumber;
  private final String entityName;

  private BrokerException(Severity severity, int replyCode, String replyText,
      Initiator initiator, String connectionName, int channelNumber, String entityName,
      Throwable cause) {
    super(message(severity, replyCode, replyText, initiator, connectionName, channelNumber,
        entityName), cause);
    this.severity = Assert.notNull(severity, "severity");
    this.replyCode = replyCode;
    this.replyText = replyText;
    this.initiator = Assert.notNull(initiator, "initiator");
    this.connectionName = connectionName;
    this.channelNumber = channelNumber;
    this.entityName = entityName;
  }

  /**
   * Returns a channel-level failure with the {@code replyCode} for the {@code channelNumber}.
   */
  public static BrokerException soft(int replyCode, String replyText, Initiator initiator,
      int channelNumber) {
    return new BrokerException(Severity.SOFT, replyCode, replyText, initiator, null,
        channelNumber, null, null);
  }

  /**
   * Returns a connection-level failure with the {@code replyCode}.
   */
  public static BrokerException hard(int replyCode, String replyText, Initiator initiator) {
    return new BrokerException(Severity.HARD, replyCode, replyText, initiator, null, -1, null,
        null);
  }

  /**
   * Returns a connection-level failure for a transport that failed without a protocol close.
   */
  public static BrokerException transportFailure(Throwable cause) {
    return new BrokerException(Severity.HARD, NO_REPLY_CODE,
        cause == null ? "transport failure" : String.valueOf(cause.getMessage()),
        Initiator.TRANSPORT, null, -1, null, cause);
  }

  /**
   * Returns a copy of this failure that references the {@code connectionName} it occurred on.
   */
  public BrokerException onConnection(String connectionName) {
    return copy(connectionName, entityName);
  }

  /**
   * Returns a copy of this failure that references the {@code entityName} it concerns.
   */
  public BrokerException forEntity(String entityName) {
    return copy(connectionName, entityName);
  }

  public Severity getSeverity() {
    return severity;
  }

  public int getReplyCode() {
    return replyCode;
  }

  public String getReplyText() {
    return replyText;
  }

  public Initiator getInitiator() {
    return initiator;
  }

  /**
   * Returns the name of the connection the failure occurred on, else null if not known.
   */
  public String getConnectionName() {
    return connectionName;
  }

  /**
   * Returns the number of the channel the failure occurred on, else -1 for connection-level
   * failures.
   */
  public int getChannelNumber() {
    return channelNumber;
  }

  /**
   * Returns the name of the exchange, queue or consumer the failure concerns, else null.
   */
  public String getEntityName() {
    return entityName;
  }

  public boolean isSoft() {
    return severity == Severity.SOFT;
  }

  public boolean isHard() {
    return severity == Severity.HARD;
  }

  public boolean isInitiatedByApplication() {
    return initiator == Initiator.APPLICATION;
  }

  private BrokerException copy(String connectionName, String entityName) {
    BrokerException copy = new BrokerException(severity, replyCode, replyText, initiator,
        connectionName, channelNumber, entityName, getCause());
    copy.setStackTrace(getStackTrace());
    return copy;
  }

  private static String message(Severity severity, int replyCode, String replyText,
      Initiator initiator, String connectionName, int channelNumber, String entityName) {
    StringBuilder sb = new StringBuilder();
    sb.append(severity == Severity.SOFT ? "channel error" : "connection error");
    if (replyCode != NO_REPLY_CODE)
      sb.append(' ').append(ReplyCodes.describe(replyCode));
    if (replyText != null)
      sb.append(": ").append(replyText);
    sb.append(" (initiated by ").append(initiator.name().toLowerCase(Locale.ENGLISH));
    if (channelNumber != -1)
      sb.append(", channel ").append(channelNumber);
    if (connectionName != null)
      sb.append(", connection ").append(connectionName);
    if (entityName != null)
      sb.append(", entity '").append(entityName).append('\'');
    return sb.append(')').toString();
  }
}
