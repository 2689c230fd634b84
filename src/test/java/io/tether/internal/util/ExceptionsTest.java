package io.tether.internal.util;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import org.testng.annotations.Test;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

import io.tether.BrokerException;
import io.tether.BrokerException.Initiator;
import io.tether.ConnectionFailureException.Reason;
import io.tether.ReplyCodes;

@Test
public class ExceptionsTest {
  public void shouldClassifyConnectFailures() {
    assertEquals(Exceptions.connectFailureReason(new UnknownHostException("nowhere")),
        Reason.UNRESOLVABLE);
    assertEquals(Exceptions.connectFailureReason(new AuthenticationFailureException("denied")),
        Reason.AUTHENTICATION);
    assertEquals(Exceptions.connectFailureReason(new SocketTimeoutException()), Reason.TIMEOUT);
    assertEquals(Exceptions.connectFailureReason(new IOException(new ConnectException())),
        Reason.UNREACHABLE);
    assertEquals(Exceptions.connectFailureReason(BrokerException.hard(ReplyCodes.ACCESS_REFUSED,
        "login refused", Initiator.BROKER)), Reason.AUTHENTICATION);
    assertEquals(Exceptions.connectFailureReason(new EOFException()), Reason.IO);
  }

  public void shouldExtractCause() {
    ConnectException cause = new ConnectException();
    assertSame(Exceptions.extractCause(new IOException(new RuntimeException(cause)),
        ConnectException.class), cause);
  }

  public void shouldTranslateChannelClose() {
    AMQP.Channel.Close close = new AMQP.Channel.Close.Builder()
        .replyCode(ReplyCodes.PRECONDITION_FAILED).replyText("inequivalent arg").build();
    ShutdownSignalException sse = new ShutdownSignalException(false, false, close, null);

    BrokerException e = Exceptions.toBrokerException(sse, 3);

    assertTrue(e.isSoft());
    assertEquals(e.getReplyCode(), ReplyCodes.PRECONDITION_FAILED);
    assertEquals(e.getReplyText(), "inequivalent arg");
    assertEquals(e.getInitiator(), Initiator.BROKER);
    assertEquals(e.getChannelNumber(), 3);
  }

  public void shouldTranslateConnectionClose() {
    AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
        .replyCode(ReplyCodes.CONNECTION_FORCED).replyText("shutdown").build();
    ShutdownSignalException sse = new ShutdownSignalException(true, false, close, null);

    BrokerException e = Exceptions.toBrokerException(sse, 3);

    assertTrue(e.isHard());
    assertEquals(e.getReplyCode(), ReplyCodes.CONNECTION_FORCED);
    assertEquals(e.getInitiator(), Initiator.BROKER);
    assertFalse(e.isInitiatedByApplication());
  }

  public void shouldTranslateApplicationClose() {
    AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
        .replyCode(200).replyText("OK").build();
    ShutdownSignalException sse = new ShutdownSignalException(true, true, close, null);

    assertTrue(Exceptions.toBrokerException(sse, -1).isInitiatedByApplication());
  }

  public void shouldTranslateTransportFailure() {
    ShutdownSignalException sse = new ShutdownSignalException(true, false, null, null, "",
        new EOFException("connection reset"));

    BrokerException e = Exceptions.toBrokerException(sse, -1);

    assertTrue(e.isHard());
    assertEquals(e.getInitiator(), Initiator.TRANSPORT);
    assertEquals(e.getReplyCode(), BrokerException.NO_REPLY_CODE);
  }
}
