package com.simbridge.bridge.dispatch;

import com.simbridge.tracker.flight.FlightEvent;
import com.simbridge.tracker.model.TelemetrySnapshot;

/** Unit of outbound work queued by the telemetry pump. */
public interface BridgeEvent {

  record SnapshotCaptured(TelemetrySnapshot snapshot) implements BridgeEvent {
  }

  record SourceStatusChanged(boolean connected) implements BridgeEvent {
  }

  record FlightEventRaised(FlightEvent event) implements BridgeEvent {
  }
}
