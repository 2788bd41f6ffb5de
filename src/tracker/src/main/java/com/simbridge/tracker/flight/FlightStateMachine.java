package com.simbridge.tracker.flight;

import com.simbridge.tracker.geo.AirportDirectory;
import com.simbridge.tracker.model.LandingEvent;
import com.simbridge.tracker.model.RouteSpec;
import com.simbridge.tracker.model.TelemetrySnapshot;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the current {@link TrackerState}.
 *
 * <p>Ticks and disconnects are serialized on this instance; the ingestion loop is the only
 * expected caller. The route hint is written by connection handlers and read on the next tick.
 */
public class FlightStateMachine {
  private static final Logger log = LoggerFactory.getLogger(FlightStateMachine.class);

  private final FlightTransitions transitions;
  private final AtomicReference<RouteSpec> routeHint = new AtomicReference<>();
  private TrackerState state;

  public FlightStateMachine(TrackerRules rules, AirportDirectory airports) {
    this(new FlightTransitions(rules, airports));
  }

  public FlightStateMachine(FlightTransitions transitions) {
    this.transitions = transitions;
    this.state = TrackerState.initial(transitions.rules());
  }

  /** Applies one sample and returns the events it produced, in order. */
  public synchronized List<FlightEvent> accept(TelemetrySnapshot snapshot, Instant observedAt) {
    Transition transition = transitions.advance(state, new Tick(snapshot, observedAt, routeHint.get()));
    state = transition.state();
    transition.events().forEach(FlightStateMachine::logEvent);
    return transition.events();
  }

  /** Abandons any flight in progress; the next sample re-establishes the ground/air baseline. */
  public synchronized List<FlightEvent> disconnect(Instant at, String reason) {
    Transition transition = transitions.disconnect(state, at, reason);
    state = transition.state();
    transition.events().forEach(FlightStateMachine::logEvent);
    return transition.events();
  }

  public void updateRouteHint(RouteSpec route) {
    routeHint.set(route == null || route.isEmpty() ? null : route);
  }

  public RouteSpec routeHint() {
    return routeHint.get();
  }

  public synchronized TrackerState state() {
    return state;
  }

  public synchronized FlightPhase phase() {
    return state.phase();
  }

  private static void logEvent(FlightEvent event) {
    if (event instanceof FlightEvent.TakeoffDetected takeoff) {
      log.info("Takeoff detected at {} kt (validated={})", takeoff.liftoffSpeed(), takeoff.validated());
    } else if (event instanceof FlightEvent.TakeoffDiscarded discarded) {
      log.info("Takeoff ignored: {}", discarded.reason());
    } else if (event instanceof FlightEvent.FlightValidated validated) {
      log.info("Flight tracking started, origin={}", validated.origin());
    } else if (event instanceof FlightEvent.LandingDetected detected) {
      LandingEvent landing = detected.landing();
      log.info(
          "Landing at {}: {} fpm, {} G, rating={}",
          landing.airport(),
          landing.verticalSpeed(),
          landing.gForce(),
          landing.rating().label());
    } else if (event instanceof FlightEvent.LandingRejected rejected) {
      log.info("Landing not counted: {}", String.join("; ", rejected.reasons()));
    } else if (event instanceof FlightEvent.FlightCompleted completed) {
      log.info(
          "Flight completed {} -> {}, {} NM in {}s, score={}",
          completed.record().origin(),
          completed.record().destination(),
          completed.record().distanceNm(),
          completed.record().flightDurationSeconds(),
          completed.record().score());
    } else if (event instanceof FlightEvent.FlightRecordDiscarded discarded) {
      log.info("Flight not logged: {}", discarded.reason());
    } else if (event instanceof FlightEvent.FlightCancelled cancelled) {
      log.info("Flight tracking cancelled: {}", cancelled.reason());
    }
  }
}
