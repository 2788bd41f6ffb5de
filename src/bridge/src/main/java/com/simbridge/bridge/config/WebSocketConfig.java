package com.simbridge.bridge.config;

import com.simbridge.bridge.hub.BridgeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Exposes the viewer WebSocket endpoint at {@code bridge.hub.path}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final BridgeWebSocketHandler handler;
  private final BridgeProperties properties;

  public WebSocketConfig(BridgeWebSocketHandler handler, BridgeProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, properties.getHub().getPath())
        .setAllowedOriginPatterns(properties.getHub().getAllowedOrigins().toArray(String[]::new));
  }
}
