package com.simbridge.tracker.flight;

import com.simbridge.tracker.geo.GreatCircle;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Drives a state machine through scripted samples with a controllable clock. */
final class FlightScript {
  // Mid-Atlantic, far from any airport in the bundled table.
  static final double START_LAT = 45.0;
  static final double START_LON = -30.0;

  private final FlightStateMachine machine;
  private final List<FlightEvent> events = new ArrayList<>();
  private Instant now = Instant.parse("2024-05-01T10:00:00Z");
  private double latitude = START_LAT;
  private double longitude = START_LON;

  FlightScript(FlightStateMachine machine) {
    this.machine = machine;
  }

  static double latitudeDegreesFor(double nauticalMiles) {
    return Math.toDegrees(nauticalMiles / GreatCircle.EARTH_RADIUS_NM);
  }

  static TelemetrySnapshot.Builder sample(boolean onGround, double groundSpeed, double altitudeAgl) {
    return TelemetrySnapshot.builder()
        .aircraftTitle("Cessna 172 Skyhawk")
        .onGround(onGround)
        .groundSpeed(groundSpeed)
        .altitudeAgl(altitudeAgl)
        .altitude(altitudeAgl + 350.0)
        .verticalSpeed(onGround ? 0.0 : -180.0)
        .gForce(1.0)
        .pitch(2.5)
        .bank(-1.2)
        .angleOfAttack(4.0)
        .sideslip(0.3)
        .headingMagnetic(271.0)
        .lateralG(0.02)
        .longitudinalG(-0.11);
  }

  FlightScript at(Instant instant) {
    this.now = instant;
    return this;
  }

  FlightScript advance(long seconds) {
    now = now.plusSeconds(seconds);
    return this;
  }

  FlightScript moveNorth(double nauticalMiles) {
    latitude += latitudeDegreesFor(nauticalMiles);
    return this;
  }

  FlightScript feed(TelemetrySnapshot.Builder builder) {
    events.addAll(machine.accept(builder.latitude(latitude).longitude(longitude).build(), now));
    return this;
  }

  FlightScript ground() {
    return feed(sample(true, 0.0, 0.0));
  }

  FlightScript airborne(double groundSpeed, double altitudeAgl) {
    return feed(sample(false, groundSpeed, altitudeAgl));
  }

  /**
   * Baseline on the ground, liftoff, {@code steps} airborne samples spread over the duration and
   * distance, then a touchdown exactly {@code durationSeconds} after liftoff.
   */
  FlightScript fly(double liftoffSpeed, long durationSeconds, double distanceNm, double maxAgl, int steps) {
    ground();
    advance(1);
    airborne(liftoffSpeed, 20.0);
    long stepSeconds = durationSeconds / (steps + 1);
    double stepNm = distanceNm / steps;
    for (int i = 1; i <= steps; i++) {
      advance(stepSeconds);
      moveNorth(stepNm);
      double agl = i == steps ? Math.min(150.0, maxAgl) : maxAgl;
      airborne(Math.max(liftoffSpeed, 110.0), agl);
    }
    at(touchdownAfter(durationSeconds, stepSeconds, steps));
    return feed(sample(true, 60.0, 0.0));
  }

  private Instant touchdownAfter(long durationSeconds, long stepSeconds, int steps) {
    return now.minusSeconds(stepSeconds * steps).plusSeconds(durationSeconds);
  }

  List<FlightEvent> events() {
    return events;
  }

  <T extends FlightEvent> List<T> eventsOf(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast).toList();
  }

  Instant now() {
    return now;
  }

  double latitude() {
    return latitude;
  }
}
