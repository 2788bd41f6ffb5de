package com.simbridge.tracker.flight;

import com.simbridge.tracker.geo.AirportDirectory;
import com.simbridge.tracker.geo.IcaoCodes;
import com.simbridge.tracker.model.LandingEvent;
import com.simbridge.tracker.model.LandingRating;
import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Step function of the flight state machine: {@code (state, tick) -> (state, events)}.
 *
 * <p>No field of this class changes after construction and {@link #advance} has no side effects,
 * so any sequence of ticks can be replayed against it. Airport lookups go through the
 * {@link AirportDirectory}, which must be deterministic for the same input.
 *
 * <p>Per tick, ground/air transitions are evaluated first and the airborne bookkeeping (peaks,
 * promotion, distance, approach window) runs afterwards, so the liftoff tick is already counted as
 * airborne.
 */
public class FlightTransitions {
  private final TrackerRules rules;
  private final AirportDirectory airports;

  public FlightTransitions(TrackerRules rules, AirportDirectory airports) {
    this.rules = rules;
    this.airports = airports;
  }

  public Transition advance(TrackerState state, Tick tick) {
    TelemetrySnapshot snapshot = tick.snapshot();
    if (!state.hasBaseline()) {
      // First sample only tells us where we are; a process start mid-flight must not look like a takeoff.
      return new Transition(
          new TrackerState(FlightPhase.IDLE, snapshot, state.approach(), state.lastLandingAt()),
          List.of());
    }

    boolean wasOnGround = state.previous().onGround();
    boolean onGround = snapshot.onGround();
    List<FlightEvent> events = new ArrayList<>();

    if (!wasOnGround && onGround) {
      return touchdown(state, tick, events);
    }

    FlightPhase phase = state.phase();
    ApproachRecorder approach = state.approach();
    if (wasOnGround && !onGround) {
      phase = liftoff(tick, events);
      approach = approach.cleared();
    }

    if (!onGround) {
      phase = airborne(phase, tick, events);
      if (phase instanceof FlightPhase.AirborneValidated) {
        approach = approach.record(new ApproachSample(
            tick.observedAt(),
            snapshot.altitudeAgl(),
            snapshot.latitude(),
            snapshot.longitude(),
            snapshot.verticalSpeed(),
            snapshot.groundSpeed()));
      }
    }

    return new Transition(new TrackerState(phase, snapshot, approach, state.lastLandingAt()), events);
  }

  /**
   * Drops any flight in progress and forgets the ground/air baseline. Never emits a landing.
   */
  public Transition disconnect(TrackerState state, Instant at, String reason) {
    List<FlightEvent> events = new ArrayList<>();
    if (state.isTracking()) {
      events.add(new FlightEvent.FlightCancelled(at, reason));
    }
    return new Transition(
        new TrackerState(FlightPhase.IDLE, null, state.approach().cleared(), state.lastLandingAt()),
        events);
  }

  private FlightPhase liftoff(Tick tick, List<FlightEvent> events) {
    TelemetrySnapshot snapshot = tick.snapshot();
    double speed = snapshot.groundSpeed();
    if (speed > rules.maxTakeoffSpeedKt()) {
      events.add(new FlightEvent.TakeoffDiscarded(
          tick.observedAt(),
          speed,
          "in-air spawn: liftoff at " + speed + " kt above " + rules.maxTakeoffSpeedKt() + " kt"));
      return FlightPhase.IDLE;
    }

    Peaks peaks = Peaks.atLiftoff(snapshot);
    if (speed >= rules.minTakeoffSpeedKt()) {
      events.add(new FlightEvent.TakeoffDetected(tick.observedAt(), speed, true));
      return validate(tick.observedAt(), peaks, tick, events);
    }
    events.add(new FlightEvent.TakeoffDetected(tick.observedAt(), speed, false));
    return new FlightPhase.AirborneUnvalidated(tick.observedAt(), peaks);
  }

  private FlightPhase airborne(FlightPhase phase, Tick tick, List<FlightEvent> events) {
    TelemetrySnapshot snapshot = tick.snapshot();
    if (phase instanceof FlightPhase.AirborneUnvalidated unvalidated) {
      Peaks peaks = unvalidated.peaks().observe(snapshot);
      if (snapshot.groundSpeed() < rules.minTakeoffSpeedKt()) {
        return new FlightPhase.AirborneUnvalidated(unvalidated.takeoffAt(), peaks);
      }
      phase = validate(unvalidated.takeoffAt(), peaks, tick, events);
    }
    if (phase instanceof FlightPhase.AirborneValidated validated) {
      FlightState flight = validated.flight()
          .observe(snapshot, rules.maxStepNm())
          .withRouteHint(tick.routeHint());
      return new FlightPhase.AirborneValidated(flight);
    }
    return phase;
  }

  private FlightPhase.AirborneValidated validate(
      Instant takeoffAt, Peaks peaks, Tick tick, List<FlightEvent> events) {
    String origin = resolveOrigin(tick.snapshot(), tick.routeHint());
    events.add(new FlightEvent.FlightValidated(tick.observedAt(), origin));
    return new FlightPhase.AirborneValidated(
        FlightState.start(takeoffAt, origin, tick.routeHint(), tick.snapshot(), peaks));
  }

  private Transition touchdown(TrackerState state, Tick tick, List<FlightEvent> events) {
    Instant now = tick.observedAt();
    TelemetrySnapshot snapshot = tick.snapshot();
    List<String> reasons = landingRejections(state, now);
    Instant lastLandingAt = state.lastLandingAt();

    if (reasons.isEmpty()) {
      FlightState flight = ((FlightPhase.AirborneValidated) state.phase()).flight();
      String destination = resolveDestination(snapshot, tick.routeHint());
      LandingEvent landing = landingEvent(state, flight, destination, tick);
      events.add(new FlightEvent.LandingDetected(landing));
      events.add(FlightRecords.materialize(flight, destination, landing, now, rules));
      lastLandingAt = now;
    } else {
      events.add(new FlightEvent.LandingRejected(now, reasons));
    }

    return new Transition(
        new TrackerState(FlightPhase.IDLE, snapshot, state.approach().cleared(), lastLandingAt),
        events);
  }

  List<String> landingRejections(TrackerState state, Instant now) {
    List<String> reasons = new ArrayList<>();
    FlightPhase phase = state.phase();
    Instant takeoffAt = null;
    Peaks peaks = null;
    if (phase instanceof FlightPhase.AirborneValidated validated) {
      takeoffAt = validated.flight().takeoffAt();
      peaks = validated.flight().peaks();
      double distance = validated.flight().distanceNm();
      if (distance < rules.minDistanceNm()) {
        reasons.add(String.format(
            Locale.ROOT, "distance %.1f NM < %.1f NM", distance, rules.minDistanceNm()));
      }
    } else if (phase instanceof FlightPhase.AirborneUnvalidated unvalidated) {
      reasons.add("takeoff never validated: ground speed stayed below " + rules.minTakeoffSpeedKt() + " kt");
      takeoffAt = unvalidated.takeoffAt();
      peaks = unvalidated.peaks();
    } else {
      reasons.add("no tracked takeoff");
    }

    if (takeoffAt != null) {
      long airborneSeconds = Duration.between(takeoffAt, now).getSeconds();
      if (airborneSeconds < rules.minFlightDuration().getSeconds()) {
        reasons.add("flight time " + airborneSeconds + "s < " + rules.minFlightDuration().getSeconds() + "s");
      }
    }
    if (peaks != null) {
      if (peaks.maxAltitudeAgl() < rules.minAltitudeAglFt()) {
        reasons.add(String.format(
            Locale.ROOT, "max AGL %.0f ft < %.0f ft", peaks.maxAltitudeAgl(), rules.minAltitudeAglFt()));
      }
      if (peaks.maxGForce() < rules.minPeakGForce()) {
        reasons.add(String.format(
            Locale.ROOT, "max G %.2f < %.2f", peaks.maxGForce(), rules.minPeakGForce()));
      }
    }
    Instant lastLandingAt = state.lastLandingAt();
    if (lastLandingAt != null && Duration.between(lastLandingAt, now).compareTo(rules.landingDebounce()) < 0) {
      reasons.add("bounce: previous landing " + Duration.between(lastLandingAt, now).toMillis() + " ms ago");
    }
    return reasons;
  }

  private LandingEvent landingEvent(TrackerState state, FlightState flight, String destination, Tick tick) {
    TelemetrySnapshot touchdown = tick.snapshot();
    TelemetrySnapshot last = state.previous();
    double touchdownVs = Rounding.round(last.verticalSpeed(), 0);
    LandingRating rating = LandingRating.fromVerticalSpeed(touchdownVs);
    return new LandingEvent(
        tick.observedAt(),
        touchdownVs,
        Rounding.round(last.gForce(), 2),
        Rounding.round(last.groundSpeed(), 0),
        rating,
        rating.score(),
        touchdown.aircraftTitle(),
        destination,
        Rounding.round(last.pitch(), 1),
        Rounding.round(last.bank(), 1),
        Rounding.round(last.angleOfAttack(), 1),
        Rounding.round(last.sideslip(), 1),
        Rounding.round(last.headingMagnetic(), 0),
        Rounding.round(last.lateralG(), 2),
        Rounding.round(last.longitudinalG(), 2),
        state.approach().toTrace(tick.observedAt(), touchdown.latitude(), touchdown.longitude()),
        flight.origin(),
        destination != null ? destination : flight.destination(),
        Duration.between(flight.takeoffAt(), tick.observedAt()).getSeconds(),
        Rounding.round(flight.distanceNm(), 1));
  }

  String resolveOrigin(TelemetrySnapshot snapshot, RouteSpec routeHint) {
    return resolveAirport(snapshot.gpsWpPrevId(), routeHint == null ? null : routeHint.origin(), snapshot);
  }

  String resolveDestination(TelemetrySnapshot snapshot, RouteSpec routeHint) {
    return resolveAirport(
        snapshot.gpsApproachAirportId(), routeHint == null ? null : routeHint.destination(), snapshot);
  }

  private String resolveAirport(String gpsIdentifier, String hinted, TelemetrySnapshot snapshot) {
    String fromGps = IcaoCodes.normalize(gpsIdentifier);
    if (fromGps != null) {
      return fromGps;
    }
    if (hinted != null) {
      return hinted;
    }
    return airports
        .nearest(snapshot.latitude(), snapshot.longitude(), rules.airportSearchRadiusNm())
        .orElse(null);
  }

  public TrackerRules rules() {
    return rules;
  }
}
