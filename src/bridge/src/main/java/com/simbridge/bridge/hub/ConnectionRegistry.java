package com.simbridge.bridge.hub;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe set of open viewer connections.
 *
 * <p>Registration and {@link #closeAll()} share a lock, so no connection can slip in while the hub
 * shuts down. Reads and removals are lock-free.
 */
public class ConnectionRegistry {
  private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();
  private final Object lifecycleLock = new Object();
  private volatile boolean closed;

  /** @return false when the registry was already closed; the caller owns the connection then */
  public boolean register(ClientConnection connection) {
    synchronized (lifecycleLock) {
      if (closed) {
        return false;
      }
      connections.add(connection);
      return true;
    }
  }

  public boolean remove(ClientConnection connection) {
    return connections.remove(connection);
  }

  /** Point-in-time copy, safe to iterate while connections come and go. */
  public List<ClientConnection> connections() {
    return new ArrayList<>(connections);
  }

  public int size() {
    return connections.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Closes every connection and refuses further registrations. Returns how many were closed. */
  public int closeAll() {
    List<ClientConnection> snapshot;
    synchronized (lifecycleLock) {
      closed = true;
      snapshot = new ArrayList<>(connections);
      connections.clear();
    }
    for (ClientConnection connection : snapshot) {
      connection.close();
    }
    return snapshot.size();
  }
}
