package com.simbridge.bridge.relay;

import com.simbridge.bridge.config.BridgeProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Session code of this bridge run; present only when the remote relay is enabled. */
@Component
public class RelaySession {
  private static final Logger log = LoggerFactory.getLogger(RelaySession.class);

  private final String code;

  @Autowired
  public RelaySession(BridgeProperties properties) {
    this(properties.getRelay().isEnabled() ? new SessionCodeGenerator().next() : null);
  }

  RelaySession(String code) {
    this.code = code;
    if (code != null) {
      log.info("Relay session code: {}", code);
    }
  }

  public Optional<String> code() {
    return Optional.ofNullable(code);
  }
}
