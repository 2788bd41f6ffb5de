package com.simbridge.bridge.auth;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Signed-in viewer whose identity tags completed flights.
 *
 * <p>The last {@code auth} message wins. Tokens are kept in memory only and never logged.
 */
@Component
public class UserSession implements AuthenticationListener {
  private static final Logger log = LoggerFactory.getLogger(UserSession.class);

  private final AtomicReference<Identity> identity = new AtomicReference<>();

  @Override
  public void onAuthenticated(String userId, String token) {
    String normalizedUser = blankToNull(userId);
    if (normalizedUser == null) {
      Identity previous = identity.getAndSet(null);
      if (previous != null) {
        log.info("Viewer signed out (user {})", previous.userId());
      }
      return;
    }
    identity.set(new Identity(normalizedUser, blankToNull(token)));
    log.info("Viewer signed in as user {}", normalizedUser);
  }

  public Optional<Identity> current() {
    return Optional.ofNullable(identity.get());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  /** User id plus optional bearer token. */
  public record Identity(String userId, String token) {
    @Override
    public String toString() {
      return "Identity[userId=" + userId + ", token=" + (token == null ? "none" : "***") + "]";
    }
  }
}
