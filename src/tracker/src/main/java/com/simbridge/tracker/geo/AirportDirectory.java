package com.simbridge.tracker.geo;

import java.util.Optional;

/** Nearest-airport lookup used as the last fallback when resolving origin and destination. */
public interface AirportDirectory {

  /**
   * Finds the closest known airport within a radius.
   *
   * @param latitude aircraft latitude
   * @param longitude aircraft longitude
   * @param maxDistanceNm search radius in nautical miles (inclusive)
   * @return ICAO identifier of the closest airport, or empty when none is in range
   */
  Optional<String> nearest(double latitude, double longitude, double maxDistanceNm);
}
