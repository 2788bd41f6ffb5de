package com.simbridge.bridge.hub;

import java.io.IOException;

/** One connected viewer. */
public interface ClientConnection {

  String id();

  void send(String payload) throws IOException;

  boolean isOpen();

  void close();
}
