package com.simbridge.tracker.flight;

import com.simbridge.tracker.model.TelemetrySnapshot;

/** Monotonic maxima observed since liftoff. */
public record Peaks(double maxAltitudeAgl, double maxAltitudeMsl, double maxGForce) {

  /** Liftoff baseline: altitudes start at zero, G starts at the liftoff load factor. */
  public static Peaks atLiftoff(TelemetrySnapshot snapshot) {
    return new Peaks(0.0, 0.0, snapshot.gForce());
  }

  public Peaks observe(TelemetrySnapshot snapshot) {
    return new Peaks(
        Math.max(maxAltitudeAgl, snapshot.altitudeAgl()),
        Math.max(maxAltitudeMsl, snapshot.altitude()),
        Math.max(maxGForce, snapshot.gForce()));
  }
}
