package com.simbridge.tracker.flight;

import com.simbridge.tracker.model.FlightRecord;
import com.simbridge.tracker.model.LandingEvent;
import java.time.Instant;
import java.util.List;

/** Lifecycle events emitted by the state machine. */
public interface FlightEvent {

  record TakeoffDetected(Instant at, double liftoffSpeed, boolean validated) implements FlightEvent {}

  /** Liftoff above the in-air spawn threshold; nothing is tracked. */
  record TakeoffDiscarded(Instant at, double liftoffSpeed, String reason) implements FlightEvent {}

  record FlightValidated(Instant at, String origin) implements FlightEvent {}

  record LandingDetected(LandingEvent landing) implements FlightEvent {}

  /** Touchdown that failed at least one plausibility rule. */
  record LandingRejected(Instant at, List<String> reasons) implements FlightEvent {
    public LandingRejected {
      reasons = List.copyOf(reasons);
    }
  }

  record FlightCompleted(FlightRecord record) implements FlightEvent {}

  /** Accepted landing whose flight does not qualify for the flight log. */
  record FlightRecordDiscarded(Instant at, String reason) implements FlightEvent {}

  record FlightCancelled(Instant at, String reason) implements FlightEvent {}
}
