package io.tether.internal.util;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

import io.tether.BrokerException;
import io.tether.BrokerException.Initiator;
import io.tether.ConnectionFailureException;
import io.tether.ConnectionFailureException.Reason;
import io.tether.ReplyCodes;

public final class Exceptions {
  private Exceptions() {}

  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T extractCause(Throwable t, Class<T> type) {
    Throwable cause = t;
    while (cause != null) {
      if (type.isAssignableFrom(cause.getClass()))
        return (T) cause;
      cause = cause.getCause();
    }

    return null;
  }

  /**
   * Reliably returns whether the shutdown signal represents a connection closure.
   */
  public static boolean isConnectionClosure(ShutdownSignalException e) {
    return e instanceof AlreadyClosedException ? e.getReference() instanceof Connection : e
        .isHardError();
  }

  /**
   * Classifies the failure to open a connection.
   */
  public static Reason connectFailureReason(Throwable t) {
    ConnectionFailureException cfe = extractCause(t, ConnectionFailureException.class);
    if (cfe != null)
      return cfe.getReason();
    if (extractCause(t, UnknownHostException.class) != null)
      return Reason.UNRESOLVABLE;
    if (extractCause(t, AuthenticationFailureException.class) != null
        || extractCause(t, PossibleAuthenticationFailureException.class) != null)
      return Reason.AUTHENTICATION;
    BrokerException be = extractCause(t, BrokerException.class);
    if (be != null && be.getReplyCode() == ReplyCodes.ACCESS_REFUSED)
      return Reason.AUTHENTICATION;
    if (extractCause(t, SocketTimeoutException.class) != null
        || extractCause(t, TimeoutException.class) != null)
      return Reason.TIMEOUT;
    if (extractCause(t, ConnectException.class) != null
        || extractCause(t, NoRouteToHostException.class) != null)
      return Reason.UNREACHABLE;
    return Reason.IO;
  }

  /**
   * Converts the client's shutdown signal to a {@link BrokerException}, classifying it by the
   * reply code of the close method that carried it.
   */
  public static BrokerException toBrokerException(ShutdownSignalException e, int channelNumber) {
    boolean connectionClosure = isConnectionClosure(e);
    Method reason = e.getReason();
    int replyCode = BrokerException.NO_REPLY_CODE;
    String replyText = null;
    if (reason instanceof AMQP.Connection.Close) {
      replyCode = ((AMQP.Connection.Close) reason).getReplyCode();
      replyText = ((AMQP.Connection.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Channel.Close) {
      replyCode = ((AMQP.Channel.Close) reason).getReplyCode();
      replyText = ((AMQP.Channel.Close) reason).getReplyText();
    }

    Initiator initiator;
    if (e.isInitiatedByApplication())
      initiator = Initiator.APPLICATION;
    else if (replyCode == BrokerException.NO_REPLY_CODE || e.getCause() instanceof EOFException)
      initiator = Initiator.TRANSPORT;
    else
      initiator = Initiator.BROKER;

    if (connectionClosure) {
      if (initiator == Initiator.TRANSPORT)
        return BrokerException.transportFailure(e.getCause() == null ? e : e.getCause());
      return BrokerException.hard(replyCode, replyText, initiator);
    }
    return BrokerException.soft(replyCode, replyText, initiator, channelNumber);
  }
}
