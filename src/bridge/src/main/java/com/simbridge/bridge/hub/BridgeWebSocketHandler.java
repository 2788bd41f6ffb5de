package com.simbridge.bridge.hub;

import com.simbridge.bridge.config.BridgeProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/** Adapts WebSocket sessions to {@link BroadcastHub} connections. */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(BridgeWebSocketHandler.class);

  private final BroadcastHub hub;
  private final int sendTimeLimitMs;
  private final int sendBufferSizeLimit;
  private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
  private final ExecutorService sendExecutor;

  public BridgeWebSocketHandler(BroadcastHub hub, BridgeProperties properties) {
    this.hub = hub;
    this.sendTimeLimitMs = (int) properties.getHub().getSendTimeLimit().toMillis();
    this.sendBufferSizeLimit = properties.getHub().getSendBufferSizeLimit();
    AtomicInteger counter = new AtomicInteger();
    this.sendExecutor = Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "hub-send-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  @jakarta.annotation.PreDestroy
  public void stop() {
    sendExecutor.shutdown();
    try {
      if (!sendExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        sendExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      sendExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    ClientConnection connection = new WebSocketClientConnection(
        session, sendExecutor, sendTimeLimitMs, sendBufferSizeLimit);
    connections.put(session.getId(), connection);
    if (!hub.onOpen(connection)) {
      connections.remove(session.getId());
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    ClientConnection connection = connections.get(session.getId());
    if (connection == null) {
      return;
    }
    hub.onMessage(connection, message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Transport error on session {}: {}", session.getId(), exception.getMessage());
    ClientConnection connection = connections.remove(session.getId());
    if (connection != null) {
      hub.onClose(connection);
      connection.close();
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    ClientConnection connection = connections.remove(session.getId());
    if (connection != null) {
      hub.onClose(connection);
    }
  }
}
