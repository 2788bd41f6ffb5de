package com.simbridge.tracker.flight;

import com.simbridge.tracker.model.FlightRecord;
import com.simbridge.tracker.model.LandingEvent;
import java.time.Duration;
import java.time.Instant;

/**
 * Builds the flight-log entry for an accepted landing.
 *
 * <p>The flight log has its own minimum bar, separate from landing acceptance: a landing can be
 * shown to viewers while its flight is still too short for the log.
 */
public final class FlightRecords {
  private FlightRecords() {}

  /**
   * Materializes the record or explains why there is none.
   *
   * @return {@link FlightEvent.FlightCompleted} or {@link FlightEvent.FlightRecordDiscarded}
   */
  public static FlightEvent materialize(
      FlightState flight, String destination, LandingEvent landing, Instant arrivalAt, TrackerRules rules) {
    long durationSeconds = Duration.between(flight.takeoffAt(), arrivalAt).getSeconds();
    double distanceNm = Rounding.round(flight.distanceNm(), 2);
    String resolvedDestination = destination != null ? destination : flight.destination();

    if (durationSeconds < rules.minRecordDuration().getSeconds()) {
      return new FlightEvent.FlightRecordDiscarded(
          arrivalAt,
          "flight too short: " + durationSeconds + "s < " + rules.minRecordDuration().getSeconds() + "s");
    }
    if (distanceNm < rules.minRecordDistanceNm()) {
      return new FlightEvent.FlightRecordDiscarded(
          arrivalAt,
          "distance too short: " + distanceNm + " NM < " + rules.minRecordDistanceNm() + " NM");
    }
    if (flight.origin() == null && resolvedDestination == null) {
      return new FlightEvent.FlightRecordDiscarded(arrivalAt, "neither origin nor destination known");
    }

    int ratingScore = landing.rating().score();
    return new FlightEvent.FlightCompleted(new FlightRecord(
        null,
        flight.origin(),
        resolvedDestination,
        flight.aircraftType(),
        flight.takeoffAt(),
        arrivalAt,
        durationSeconds,
        distanceNm,
        (int) flight.peaks().maxAltitudeMsl(),
        ratingScore,
        landing.verticalSpeed(),
        landing.gForce(),
        null,
        FlightRecord.score(distanceNm, durationSeconds, ratingScore)));
  }
}
