package com.simbridge.bridge.airport;

/** Outcome of one coordinate lookup: found, not_found or error. */
public record AirportLookupResult(String status, AirportCoords coords) {

  public static AirportLookupResult found(AirportCoords coords) {
    return new AirportLookupResult("found", coords);
  }

  public static AirportLookupResult notFound() {
    return new AirportLookupResult("not_found", null);
  }

  public static AirportLookupResult error() {
    return new AirportLookupResult("error", null);
  }

  public boolean isFound() {
    return coords != null;
  }
}
