package com.simbridge.tracker.flight;

import java.time.Duration;

/**
 * Plausibility thresholds applied by the flight state machine.
 *
 * @param minFlightDuration shortest airborne time for an accepted landing
 * @param minAltitudeAglFt highest AGL that must have been reached
 * @param minTakeoffSpeedKt liftoff speed below which the takeoff stays unvalidated
 * @param maxTakeoffSpeedKt liftoff speed above which the aircraft was spawned in the air
 * @param minPeakGForce peak load factor that must have been reached (pause/freeze guard)
 * @param minDistanceNm accumulated distance required for an accepted landing
 * @param maxStepNm per-tick distance cap; larger jumps are not accumulated
 * @param approachCeilingFt approach samples are kept below this AGL
 * @param approachCapacity number of approach samples retained
 * @param landingDebounce minimum spacing between two accepted landings
 * @param airportSearchRadiusNm radius for the nearest-airport fallback
 * @param minRecordDuration shortest flight written to the flight log
 * @param minRecordDistanceNm shortest distance written to the flight log
 */
public record TrackerRules(
    Duration minFlightDuration,
    double minAltitudeAglFt,
    double minTakeoffSpeedKt,
    double maxTakeoffSpeedKt,
    double minPeakGForce,
    double minDistanceNm,
    double maxStepNm,
    double approachCeilingFt,
    int approachCapacity,
    Duration landingDebounce,
    double airportSearchRadiusNm,
    Duration minRecordDuration,
    double minRecordDistanceNm) {

  public static TrackerRules defaults() {
    return new TrackerRules(
        Duration.ofSeconds(180),
        100.0,
        40.0,
        250.0,
        0.5,
        5.0,
        10.0,
        3000.0,
        60,
        Duration.ofSeconds(5),
        10.0,
        Duration.ofSeconds(120),
        5.0);
  }
}
