package com.simbridge.tracker.flight;

import static org.assertj.core.api.Assertions.assertThat;

import com.simbridge.tracker.geo.AirportDirectory;
import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlightTransitionsTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final AirportDirectory NEAR_FRANKFURT =
      (lat, lon, radius) -> radius >= 10.0 ? Optional.of("EDDF") : Optional.empty();

  private final FlightTransitions transitions = new FlightTransitions(TrackerRules.defaults(), NEAR_FRANKFURT);

  @Test
  void advanceIsPureForTheSameInput() {
    TrackerState grounded = transitions
        .advance(TrackerState.initial(TrackerRules.defaults()), tick(FlightScript.sample(true, 0, 0), T0, null))
        .state();
    Tick liftoff = tick(FlightScript.sample(false, 90, 15), T0.plusSeconds(1), null);

    Transition first = transitions.advance(grounded, liftoff);
    Transition second = transitions.advance(grounded, liftoff);

    assertThat(first).isEqualTo(second);
    assertThat(grounded.phase()).isInstanceOf(FlightPhase.Idle.class);
  }

  @Test
  void originPrefersGpsPreviousWaypoint() {
    TelemetrySnapshot snapshot = FlightScript.sample(false, 90, 15).gpsWpPrevId(" lfpg ").build();

    assertThat(transitions.resolveOrigin(snapshot, new RouteSpec("EDDM", null))).isEqualTo("LFPG");
  }

  @Test
  void originFallsBackToRouteHintWhenGpsIdentifierIsNotIcao() {
    TelemetrySnapshot snapshot = FlightScript.sample(false, 90, 15).gpsWpPrevId("RW25L").build();

    assertThat(transitions.resolveOrigin(snapshot, new RouteSpec("EDDM", null))).isEqualTo("EDDM");
  }

  @Test
  void originFallsBackToNearestAirport() {
    TelemetrySnapshot snapshot = FlightScript.sample(false, 90, 15).build();

    assertThat(transitions.resolveOrigin(snapshot, null)).isEqualTo("EDDF");
  }

  @Test
  void destinationPrefersGpsApproachAirport() {
    TelemetrySnapshot snapshot = FlightScript.sample(true, 50, 0).gpsApproachAirportId("EGLL").build();

    assertThat(transitions.resolveDestination(snapshot, new RouteSpec("EDDF", "EHAM"))).isEqualTo("EGLL");
    assertThat(transitions.resolveDestination(FlightScript.sample(true, 50, 0).build(), new RouteSpec("EDDF", "EHAM")))
        .isEqualTo("EHAM");
  }

  @Test
  void routeHintNeverOverwritesResolvedOrigin() {
    TrackerState state = transitions
        .advance(TrackerState.initial(TrackerRules.defaults()), tick(FlightScript.sample(true, 0, 0), T0, null))
        .state();
    state = transitions.advance(state, tick(
        FlightScript.sample(false, 90, 15).gpsWpPrevId("LFPG"), T0.plusSeconds(1), null)).state();
    state = transitions.advance(state, tick(
        FlightScript.sample(false, 120, 800), T0.plusSeconds(20), new RouteSpec("EDDM", "LIRF"))).state();

    FlightState flight = ((FlightPhase.AirborneValidated) state.phase()).flight();
    assertThat(flight.origin()).isEqualTo("LFPG");
    assertThat(flight.destination()).isEqualTo("LIRF");
  }

  private static Tick tick(TelemetrySnapshot.Builder builder, Instant at, RouteSpec hint) {
    return new Tick(builder.latitude(50.03).longitude(8.56).build(), at, hint);
  }
}
