package com.simbridge.bridge.relay;

/** Receives a copy of every broadcast payload for remote viewers. */
public interface RelaySink {
  void publish(String payload);
}
