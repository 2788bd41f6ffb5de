package com.simbridge.tracker.flight;

import com.simbridge.tracker.geo.DistanceAccumulator;
import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;

/**
 * Accumulated data of the flight currently being tracked.
 *
 * <p>Origin and destination are filled at most once: a value that is already known is never
 * replaced by a later hint.
 */
public record FlightState(
    Instant takeoffAt,
    String origin,
    String destination,
    String aircraftType,
    Peaks peaks,
    DistanceAccumulator distance) {

  static FlightState start(
      Instant takeoffAt, String origin, RouteSpec routeHint, TelemetrySnapshot snapshot, Peaks peaks) {
    return new FlightState(
        takeoffAt,
        origin,
        routeHint == null ? null : routeHint.destination(),
        snapshot.aircraftTitle(),
        peaks,
        DistanceAccumulator.startingAt(snapshot.latitude(), snapshot.longitude()));
  }

  FlightState observe(TelemetrySnapshot snapshot, double maxStepNm) {
    return new FlightState(
        takeoffAt,
        origin,
        destination,
        aircraftType,
        peaks.observe(snapshot),
        distance.advance(snapshot.latitude(), snapshot.longitude(), maxStepNm));
  }

  FlightState withRouteHint(RouteSpec routeHint) {
    if (routeHint == null) {
      return this;
    }
    boolean fillOrigin = origin == null && routeHint.origin() != null;
    boolean fillDestination = destination == null && routeHint.destination() != null;
    if (!fillOrigin && !fillDestination) {
      return this;
    }
    return new FlightState(
        takeoffAt,
        fillOrigin ? routeHint.origin() : origin,
        fillDestination ? routeHint.destination() : destination,
        aircraftType,
        peaks,
        distance);
  }

  public double distanceNm() {
    return distance.totalNm();
  }
}
