package com.simbridge.bridge.hub;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** In-memory viewer that records what it was sent and can be told to fail. */
final class RecordingConnection implements ClientConnection {
  private final String id;
  private final List<String> sent = new CopyOnWriteArrayList<>();
  private volatile IOException failure;
  private volatile boolean open = true;
  private volatile int closeCalls;

  RecordingConnection(String id) {
    this.id = id;
  }

  static RecordingConnection failing(String id, IOException failure) {
    RecordingConnection connection = new RecordingConnection(id);
    connection.failure = failure;
    return connection;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public void send(String payload) throws IOException {
    if (failure != null) {
      throw failure;
    }
    sent.add(payload);
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
    closeCalls++;
  }

  List<String> sent() {
    return sent;
  }

  int closeCalls() {
    return closeCalls;
  }

  @Override
  public String toString() {
    return "test:" + id;
  }
}
