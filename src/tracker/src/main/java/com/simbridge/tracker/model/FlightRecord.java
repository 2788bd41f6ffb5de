package com.simbridge.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Completed flight handed to the flight log.
 *
 * <p>JSON uses the column names of the {@code flights} table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlightRecord(
    @JsonProperty("user_id") String userId,
    @JsonProperty("origin") String origin,
    @JsonProperty("destination") String destination,
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("departure_time") Instant departureTime,
    @JsonProperty("arrival_time") Instant arrivalTime,
    @JsonProperty("flight_duration_seconds") long flightDurationSeconds,
    @JsonProperty("distance_nm") double distanceNm,
    @JsonProperty("max_altitude_ft") int maxAltitudeFt,
    @JsonProperty("landing_rating") int landingRating,
    @JsonProperty("landing_vs") double landingVerticalSpeed,
    @JsonProperty("landing_gforce") double landingGForce,
    @JsonProperty("session_code") String sessionCode,
    @JsonProperty("score") int score) {

  static final double ASSUMED_CRUISE_KNOTS = 400.0;

  /**
   * Distance-based score with a landing bonus.
   *
   * <p>The distance part is scaled down when the flight was faster than a 400 kt cruise would
   * allow (time acceleration); flying slower never earns more than the distance itself.
   */
  public static int score(double distanceNm, long durationSeconds, int ratingScore) {
    double expectedSeconds = distanceNm / ASSUMED_CRUISE_KNOTS * 3600.0;
    double timeFactor = expectedSeconds > 0 ? Math.min(1.0, durationSeconds / expectedSeconds) : 1.0;
    return (int) Math.round(distanceNm * timeFactor) + ratingScore * 10;
  }

  public FlightRecord withOwner(String ownerUserId, String ownerSessionCode) {
    return new FlightRecord(
        ownerUserId,
        origin,
        destination,
        aircraftType,
        departureTime,
        arrivalTime,
        flightDurationSeconds,
        distanceNm,
        maxAltitudeFt,
        landingRating,
        landingVerticalSpeed,
        landingGForce,
        ownerSessionCode,
        score);
  }
}
