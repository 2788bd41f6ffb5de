package com.simbridge.bridge.airport;

/** Airport reference point in decimal degrees. */
public record AirportCoords(double lat, double lon) {
}
