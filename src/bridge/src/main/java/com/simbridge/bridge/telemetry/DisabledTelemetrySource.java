package com.simbridge.bridge.telemetry;

import com.simbridge.tracker.model.TelemetrySnapshot;
import java.util.Optional;

/** Placeholder used when no simulator link is configured. */
public class DisabledTelemetrySource implements TelemetrySource {

  @Override
  public String name() {
    return "disabled";
  }

  @Override
  public void connect() {
    throw new TelemetrySourceException("no telemetry source configured (bridge.telemetry.source=disabled)");
  }

  @Override
  public Optional<TelemetrySnapshot> poll() {
    return Optional.empty();
  }

  @Override
  public boolean isConnected() {
    return false;
  }

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public void disconnect() {
  }
}
