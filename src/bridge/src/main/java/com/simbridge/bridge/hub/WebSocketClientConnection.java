package com.simbridge.bridge.hub;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * {@link ClientConnection} over a WebSocket session.
 *
 * <p>{@link #send(String)} only queues the payload; a task on the shared send executor writes the
 * queue to the socket in order, so a viewer with a stalled socket never holds up the caller. Once a
 * write has been in progress longer than the send time limit, or the queued payloads exceed the
 * buffer limit, further sends fail with {@link SessionLimitExceededException}. A failed write
 * closes the session and fails the next send.
 */
public class WebSocketClientConnection implements ClientConnection {
  private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

  private final WebSocketSession session;
  private final Executor sendExecutor;
  private final long sendTimeLimitMs;
  private final int bufferSizeLimit;
  private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
  private final AtomicInteger bufferedChars = new AtomicInteger();
  private final AtomicBoolean draining = new AtomicBoolean();
  private volatile long writeStartedAt;
  private volatile Throwable failure;

  public WebSocketClientConnection(
      WebSocketSession session, Executor sendExecutor, int sendTimeLimitMs, int bufferSizeLimit) {
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    this.sendExecutor = sendExecutor;
    this.sendTimeLimitMs = sendTimeLimitMs;
    this.bufferSizeLimit = bufferSizeLimit;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(String payload) throws IOException {
    Throwable failed = failure;
    if (failed != null) {
      throw new IOException("Earlier send to " + id() + " failed", failed);
    }
    long started = writeStartedAt;
    if (started > 0) {
      long elapsed = System.currentTimeMillis() - started;
      if (elapsed > sendTimeLimitMs) {
        throw new SessionLimitExceededException(
            "Send time " + elapsed + " (ms) for session '" + id() + "' exceeded the allowed limit "
                + sendTimeLimitMs,
            CloseStatus.SESSION_NOT_RELIABLE);
      }
    }
    if (bufferedChars.get() + payload.length() > bufferSizeLimit) {
      throw new SessionLimitExceededException(
          "Buffer size " + bufferedChars.get() + " for session '" + id() + "' exceeds the allowed limit "
              + bufferSizeLimit,
          CloseStatus.SESSION_NOT_RELIABLE);
    }
    bufferedChars.addAndGet(payload.length());
    outbound.add(payload);
    scheduleDrain();
  }

  int pending() {
    return outbound.size();
  }

  private void scheduleDrain() throws IOException {
    if (!draining.compareAndSet(false, true)) {
      return;
    }
    try {
      sendExecutor.execute(this::drain);
    } catch (RejectedExecutionException ex) {
      draining.set(false);
      throw new IOException("Send executor for " + id() + " is shut down", ex);
    }
  }

  private void drain() {
    try {
      String next;
      while ((next = outbound.poll()) != null) {
        bufferedChars.addAndGet(-next.length());
        writeStartedAt = System.currentTimeMillis();
        try {
          session.sendMessage(new TextMessage(next));
        } catch (IOException | RuntimeException ex) {
          failure = ex;
          outbound.clear();
          bufferedChars.set(0);
          log.debug("Write to WebSocket session {} failed: {}", id(), ex.getMessage());
          close();
          return;
        } finally {
          writeStartedAt = 0;
        }
      }
    } finally {
      draining.set(false);
    }
    // A payload queued after the last poll but before the flag reset still needs a writer.
    if (!outbound.isEmpty()) {
      try {
        scheduleDrain();
      } catch (IOException ex) {
        failure = ex;
        log.debug("Cannot reschedule writes for WebSocket session {}: {}", id(), ex.getMessage());
      }
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void close() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (IOException ex) {
      log.debug("Closing WebSocket session {} failed: {}", id(), ex.getMessage());
    }
  }

  @Override
  public String toString() {
    return "ws:" + id();
  }
}
