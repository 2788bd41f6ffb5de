package com.simbridge.tracker.flight;

import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;

/**
 * Complete state carried from one tick to the next.
 *
 * @param phase current tracking phase
 * @param previous last sample seen, or {@code null} before the ground/air baseline exists
 * @param approach rolling approach window
 * @param lastLandingAt time of the last accepted landing, used for debouncing
 */
public record TrackerState(
    FlightPhase phase,
    TelemetrySnapshot previous,
    ApproachRecorder approach,
    Instant lastLandingAt) {

  public static TrackerState initial(TrackerRules rules) {
    return new TrackerState(
        FlightPhase.IDLE,
        null,
        ApproachRecorder.empty(rules.approachCapacity(), rules.approachCeilingFt()),
        null);
  }

  public boolean hasBaseline() {
    return previous != null;
  }

  public boolean isTracking() {
    return !(phase instanceof FlightPhase.Idle);
  }
}
