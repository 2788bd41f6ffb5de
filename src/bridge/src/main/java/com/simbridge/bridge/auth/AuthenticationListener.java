package com.simbridge.bridge.auth;

/** Receives viewer sign-in state. A {@code null} user id means signed out. */
public interface AuthenticationListener {
  void onAuthenticated(String userId, String token);
}
