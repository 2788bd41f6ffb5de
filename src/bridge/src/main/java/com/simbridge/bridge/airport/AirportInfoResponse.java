package com.simbridge.bridge.airport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of the airport info payload. The API answers {@code 200} with empty fields for unknown
 * codes, so presence of both coordinates is the only reliable "found" signal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirportInfoResponse(
    String icao,
    String name,
    Double latitude,
    Double longitude,
    Integer status) {

  public boolean hasCoordinates() {
    return latitude != null
        && longitude != null
        && Double.isFinite(latitude)
        && Double.isFinite(longitude);
  }
}
