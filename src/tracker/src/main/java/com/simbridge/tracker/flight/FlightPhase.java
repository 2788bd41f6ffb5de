package com.simbridge.tracker.flight;

import java.time.Instant;

/**
 * Tracking phase of the state machine.
 *
 * <ul>
 *   <li>{@link Idle}: on the ground, or airborne without a takeoff worth tracking</li>
 *   <li>{@link AirborneUnvalidated}: lifted off below takeoff speed, waiting for real flight speed</li>
 *   <li>{@link AirborneValidated}: confirmed flight, distance and approach data are accumulated</li>
 * </ul>
 */
public interface FlightPhase {
  Idle IDLE = new Idle();

  String label();

  record Idle() implements FlightPhase {
    @Override
    public String label() {
      return "idle";
    }
  }

  record AirborneUnvalidated(Instant takeoffAt, Peaks peaks) implements FlightPhase {
    @Override
    public String label() {
      return "airborne-unvalidated";
    }
  }

  record AirborneValidated(FlightState flight) implements FlightPhase {
    @Override
    public String label() {
      return "airborne-validated";
    }
  }
}
