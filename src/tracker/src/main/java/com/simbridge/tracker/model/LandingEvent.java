package com.simbridge.tracker.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of an accepted touchdown, broadcast to viewers as soon as the landing is detected.
 *
 * <p>Kinematic and attitude values are those of the last airborne sample.
 */
public record LandingEvent(
    Instant timestamp,
    double verticalSpeed,
    double gForce,
    double groundSpeed,
    LandingRating rating,
    int ratingScore,
    String aircraftTitle,
    String airport,
    double pitch,
    double bank,
    double angleOfAttack,
    double sideslip,
    double headingMagnetic,
    double lateralG,
    double longitudinalG,
    List<ApproachPoint> approachData,
    String origin,
    String destination,
    long flightDurationSeconds,
    double distanceNm) {

  public LandingEvent {
    approachData = approachData == null ? List.of() : List.copyOf(approachData);
  }
}
